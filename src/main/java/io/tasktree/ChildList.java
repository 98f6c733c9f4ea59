package io.tasktree;

/**
 * Children of one {@link TreeNode}, counting how many of them are transient.
 *
 * <p>The count makes {@link #isFinished()} O(1): a child list is finished when every
 * present child is transient.
 */
public final class ChildList extends IntrusiveList<TreeNode> {

    private int transientCount;

    @Override
    ChildList insert(TreeNode item) {
        super.insert(item);
        if (item.isTransient()) {
            transientCount++;
        }
        return this;
    }

    @Override
    ChildList delete(TreeNode item) {
        super.delete(item);
        if (item.isTransient()) {
            transientCount--;
        }
        return this;
    }

    public int transientCount() {
        return transientCount;
    }

    /**
     * @return true when at least one direct child is transient.
     */
    public boolean hasTransients() {
        return transientCount > 0;
    }

    /**
     * @return true when no non-transient child is present.
     */
    public boolean isFinished() {
        return size() == transientCount;
    }
}
