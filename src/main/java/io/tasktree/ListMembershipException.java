package io.tasktree;

/**
 * Raised when an item is inserted while already linked, or deleted from a list it does not belong to.
 */
public class ListMembershipException extends RuntimeException {

    public ListMembershipException(String message) {
        super(message);
    }
}
