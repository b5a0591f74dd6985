package com.dcruver.smoothwrite.io;

/**
 * Outcome of deleting a stored note.
 */
public enum DeleteResult {
    DELETED,
    NOT_FOUND,
    FAILED;

    public boolean isDeleted() {
        return this == DELETED;
    }
}
