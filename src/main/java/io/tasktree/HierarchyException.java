package io.tasktree;

/**
 * Raised when a parent change would make a node its own ancestor.
 */
public class HierarchyException extends RuntimeException {

    public HierarchyException(String message) {
        super(message);
    }
}
