package com.jsemit.ast;

import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.Optional;

/**
 * Renders nodes, properties and operators as {@code Tag(field, field, ...)}.
 *
 * <p>Fields are rendered in declaration order: nested nodes recursively, strings quoted,
 * lists as {@code [a, b]}, optionals as {@code Optional[x]} or {@code Optional.empty}, operators
 * by enum name. The output is for diagnostics and assertions; it is not JavaScript.</p>
 */
public final class DebugRenderer {

    private DebugRenderer() {
        // Utility class
    }

    public static String render(Object value) {
        StringBuilder sb = new StringBuilder();
        append(sb, value);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Object value) {
        if (value instanceof Node node) {
            appendRecord(sb, node.type(), (Record) node);
        } else if (value instanceof ObjectProperty property) {
            appendRecord(sb, property.kind(), (Record) property);
        } else if (value instanceof String s) {
            sb.append(JsStrings.quote(s));
        } else if (value instanceof Enum<?> e) {
            sb.append(e.name());
        } else if (value instanceof List<?> list) {
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                append(sb, list.get(i));
            }
            sb.append(']');
        } else if (value instanceof Optional<?> optional) {
            if (optional.isPresent()) {
                sb.append("Optional[");
                append(sb, optional.get());
                sb.append(']');
            } else {
                sb.append("Optional.empty");
            }
        } else {
            sb.append(value);
        }
    }

    private static void appendRecord(StringBuilder sb, String tag, Record value) {
        sb.append(tag).append('(');
        RecordComponent[] components = value.getClass().getRecordComponents();
        for (int i = 0; i < components.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            append(sb, read(components[i], value));
        }
        sb.append(')');
    }

    private static Object read(RecordComponent component, Record value) {
        try {
            return component.getAccessor().invoke(value);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(
                "Cannot read " + component.getName() + " of " + value.getClass().getSimpleName(), e);
        }
    }
}
