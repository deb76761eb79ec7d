package com.jsemit.json;

import com.jsemit.ast.Node;

/**
 * Interface for reading IR trees back from JSON.
 */
public interface IrJsonDeserializer {

    /**
     * Deserializes a JSON string to a node of whatever variant its {@code "type"} names.
     *
     * @param json the JSON string to deserialize
     * @return the deserialized tree
     * @throws IrJsonException if the JSON is malformed or names an unknown variant
     */
    Node deserialize(String json) throws IrJsonException;

    /**
     * Deserializes a JSON string to a specific node type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws IrJsonException if deserialization fails or the node is not a {@code T}
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws IrJsonException;
}
