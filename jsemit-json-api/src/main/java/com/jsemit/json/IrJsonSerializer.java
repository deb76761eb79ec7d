package com.jsemit.json;

import com.jsemit.ast.Node;

/**
 * Interface for serializing IR nodes to JSON.
 */
public interface IrJsonSerializer {

    /**
     * Serializes a node to a compact JSON string.
     *
     * @param node the root of the tree to serialize
     * @return the JSON representation of the tree
     * @throws IrJsonException if serialization fails
     */
    String serialize(Node node) throws IrJsonException;

    /**
     * Serializes a node to an indented JSON string, for fixtures and diagnostics.
     *
     * @param node the root of the tree to serialize
     * @return the pretty-printed JSON representation of the tree
     * @throws IrJsonException if serialization fails
     */
    String serializePretty(Node node) throws IrJsonException;
}
