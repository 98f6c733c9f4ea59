package io.tasktree;

import java.util.List;

/**
 * Extension points a concrete task type plugs into a {@link TreeNode}.
 *
 * <p>The defaults describe a bare node with no execution state of its own.
 * A task typically overrides {@link #stop(TreeNode, boolean)} to cancel itself
 * and then calls {@link TreeNode#stopChildren(boolean)}.
 */
public interface NodeBehavior {

    /**
     * Stateless default behavior.
     */
    NodeBehavior DEFAULT = new NodeBehavior() {
    };

    /**
     * Stops the node. The default only cascades to non-transient children.
     *
     * @param later whether stopping may be deferred to a later point
     */
    default void stop(TreeNode node, boolean later) {
        node.stopChildren(later);
    }

    /**
     * The default treats a node without a children collection as stopped.
     */
    default boolean isStopped(TreeNode node) {
        return node.children() == null;
    }

    /**
     * @return up to {@code length} frames starting at {@code from}, or null when unavailable.
     */
    default List<String> backtrace(TreeNode node, int from, int length) {
        return null;
    }

    /**
     * Type label used in {@link TreeNode#description()}.
     */
    default String typeName() {
        return "TreeNode";
    }
}
