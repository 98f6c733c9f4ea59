package io.tasktree;

/**
 * Link slots carried by a member of an {@link IntrusiveList}.
 *
 * <p>Slots are only written by the owning list; callers get read access.
 */
public final class Link<T extends Linkable<T>> {

    private T prev;
    private T next;
    private IntrusiveList<T> owner;

    /**
     * @return the member toward the start of the list, or null when first.
     */
    public T prev() {
        return prev;
    }

    /**
     * @return the member toward the insertion end, or null when last.
     */
    public T next() {
        return next;
    }

    /**
     * @return the list currently holding the member, or null.
     */
    public IntrusiveList<T> owner() {
        return owner;
    }

    void prev(T prev) {
        this.prev = prev;
    }

    void next(T next) {
        this.next = next;
    }

    void owner(IntrusiveList<T> owner) {
        this.owner = owner;
    }

    void clear() {
        this.prev = null;
        this.next = null;
        this.owner = null;
    }
}
