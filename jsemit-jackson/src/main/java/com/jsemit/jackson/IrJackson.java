package com.jsemit.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for IR serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = IrJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(tree);
 * Node tree = mapper.readValue(json, Node.class);
 * </pre>
 */
public final class IrJackson {

    private IrJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for IR serialization/deserialization.
     *
     * The returned mapper:
     * - Tags every node with a "type" property and every object property with "kind"
     * - Writes absent optionals (label, else branch, initializer) as null
     * - Writes operators by enum name
     * - Rejects unknown properties, so a misspelled fixture fails loudly
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.registerModule(new Jdk8Module());

        // NullLiteral has no fields; its "type" tag is all it writes
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

        // Register the IR module with the polymorphic type handling
        mapper.registerModule(new IrModule());

        return mapper;
    }
}
