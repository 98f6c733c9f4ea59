package io.tasktree;

/**
 * An object that can be a member of one {@link IntrusiveList} at a time.
 */
public interface Linkable<T extends Linkable<T>> {

    /**
     * @return the link slots stored on this object; never null.
     */
    Link<T> link();
}
