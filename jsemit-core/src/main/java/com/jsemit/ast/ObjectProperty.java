package com.jsemit.ast;

import java.util.List;
import java.util.Objects;

/**
 * One entry of an {@link ObjectLiteral}.
 */
public sealed interface ObjectProperty {

    /**
     * The shape's tag name, e.g. {@code "Getter"}.
     */
    String kind();

    <R> R accept(PropertyVisitor<R> visitor);

    /**
     * {@code key: value}, the key quoted only when it is not a valid identifier.
     */
    record LiteralKey(String key, Node value) implements ObjectProperty {
        public LiteralKey {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(PropertyVisitor<R> visitor) {
            return visitor.visitLiteralKey(this);
        }

        @Override
        public String kind() {
            return "LiteralKey";
        }
    }

    /**
     * {@code [key]: value}
     */
    record ComputedKey(Node key, Node value) implements ObjectProperty {
        public ComputedKey {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(PropertyVisitor<R> visitor) {
            return visitor.visitComputedKey(this);
        }

        @Override
        public String kind() {
            return "ComputedKey";
        }
    }

    /**
     * {@code get name() { body }}
     */
    record Getter(String name, List<Node> body) implements ObjectProperty {
        public Getter {
            Objects.requireNonNull(name, "name");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(PropertyVisitor<R> visitor) {
            return visitor.visitGetter(this);
        }

        @Override
        public String kind() {
            return "Getter";
        }
    }

    /**
     * {@code set name(param) { body }}
     */
    record Setter(String name, String param, List<Node> body) implements ObjectProperty {
        public Setter {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(param, "param");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(PropertyVisitor<R> visitor) {
            return visitor.visitSetter(this);
        }

        @Override
        public String kind() {
            return "Setter";
        }
    }
}
