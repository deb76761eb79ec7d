package com.jsemit.traverse;

import com.jsemit.ast.Node;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Generic tree walks over the IR. Passes rewrite or inspect trees through these combinators
 * instead of taking nodes apart themselves.
 *
 * <p>Every walk reaches each child a variant declares, including object literal keys, values
 * and accessor bodies, exactly once. Walks keep no state between calls. Functions passed in are
 * expected to be total; an exception thrown by one propagates unchanged.</p>
 *
 * <pre>{@code
 * // Replace every reference to "tmp" with "t"
 * Node renamed = Traversal.bottomUp(
 *     n -> n.equals(new Identifier("tmp")) ? new Identifier("t") : n,
 *     root);
 * }</pre>
 */
public final class Traversal {

    private Traversal() {
        // Utility class
    }

    /**
     * Rewrites children first, rebuilds the node from the rewritten children, then applies
     * {@code rewrite} to the rebuilt node.
     */
    public static Node bottomUp(Function<Node, Node> rewrite, Node root) {
        Node rebuilt = root.accept(new ChildRebuilder(child -> bottomUp(rewrite, child)));
        return rewrite.apply(rebuilt);
    }

    /**
     * Applies {@code rewrite} to the node first, then descends into the children of the
     * result. Returning a leaf prunes the walk; returning a different subtree redirects it.
     */
    public static Node topDown(Function<Node, Node> rewrite, Node root) {
        Node rewritten = rewrite.apply(root);
        return rewritten.accept(new ChildRebuilder(child -> topDown(rewrite, child)));
    }

    /**
     * Applies {@code query} to every node in pre-order and combines the results with
     * {@code monoid}: {@code query(root)} first, then each child subtree's folded value in
     * order.
     */
    public static <R> R fold(Function<Node, R> query, Monoid<R> monoid, Node root) {
        R result = query.apply(root);
        for (Node child : children(root)) {
            result = monoid.combine(result, fold(query, monoid, child));
        }
        return result;
    }

    /**
     * Direct children in declaration order.
     */
    public static List<Node> children(Node node) {
        return node.accept(ChildLister.INSTANCE);
    }

    /**
     * Number of nodes in the tree, the root included.
     */
    public static int count(Node root) {
        return fold(n -> 1, Monoid.intSum(), root);
    }

    public static boolean anyMatch(Node root, Predicate<Node> predicate) {
        return fold(predicate::test, Monoid.any(), root);
    }
}
