package io.tasktree;

/**
 * Callback for {@link TreeNode#traverse(NodeVisitor)}.
 */
public interface NodeVisitor {

    /**
     * @param node  the visited node
     * @param depth distance from the node the traversal started at
     */
    void visit(TreeNode node, int depth);
}
