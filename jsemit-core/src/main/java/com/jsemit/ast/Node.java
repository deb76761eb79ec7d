package com.jsemit.ast;

/**
 * Base interface for all IR nodes.
 *
 * <p>Nodes are immutable values. Equality is structural and there are no parent links, so a
 * subtree may appear under several parents. Nothing here checks that a tree is legal
 * JavaScript: a {@code break} outside any loop, or a duplicate binding, is built and printed
 * like any other node.</p>
 */
public sealed interface Node permits Expression, Statement {

    /**
     * The variant's tag name, e.g. {@code "NumericLiteral"}.
     */
    String type();

    <R> R accept(NodeVisitor<R> visitor);

    /**
     * Canonical tag-and-field rendering, for diagnostics and test assertions only.
     */
    default String debugString() {
        return DebugRenderer.render(this);
    }
}
