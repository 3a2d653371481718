package com.ringlist.ring;

/**
 * Signals that a {@link RingList} operation was rejected. The list is left
 * unchanged whenever this is thrown.
 */
public class RingListException extends Exception {

    public enum Reason {
        /** The list holds no elements. */
        EMPTY_LIST,
        /** The index is negative or not below the list size. */
        INDEX_OUT_OF_BOUNDS,
        /**
         * The index is in range but the ring walk never reached it. Only a broken
         * ring can produce this.
         */
        NOT_FOUND
    }

    private final Reason reason;
    private final int index;

    public RingListException(Reason reason, int index, String message) {
        super(message);
        this.reason = reason;
        this.index = index;
    }

    static RingListException emptyList(int index) {
        return new RingListException(Reason.EMPTY_LIST, index, "The list is empty, nothing was done");
    }

    static RingListException outOfBounds(int index, int size) {
        return new RingListException(Reason.INDEX_OUT_OF_BOUNDS, index,
                "Index out of bounds: " + index + " (size " + size + ")");
    }

    static RingListException notFound(int index) {
        return new RingListException(Reason.NOT_FOUND, index,
                "The index couldn't be found, nothing was done: " + index);
    }

    public Reason reason() {
        return reason;
    }

    /** The index passed to the rejected call. */
    public int index() {
        return index;
    }
}
