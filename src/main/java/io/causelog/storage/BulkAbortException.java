package io.causelog.storage;

/**
 * Raised by {@link EventStore#storeBulk} when any event in the batch is invalid. The whole
 * batch has been rolled back by the time this reaches the caller.
 */
public final class BulkAbortException extends RuntimeException {
    private final int index;

    public BulkAbortException(String message, int index) {
        super(message);
        this.index = index;
    }

    public BulkAbortException(String message, int index, Throwable cause) {
        super(message, cause);
        this.index = index;
    }

    /**
     * Zero-based position of the offending event, or -1 when the failure was not tied to one.
     */
    public int index() {
        return index;
    }
}
