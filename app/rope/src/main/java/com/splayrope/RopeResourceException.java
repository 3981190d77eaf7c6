package com.splayrope;

/**
 * Indicates that nodes for new characters could not be allocated, either
 * because the capacity of the rope would be exceeded or because the JVM ran
 * out of memory.
 */
public class RopeResourceException extends RopeException {
    /** The capacity that was in effect when the allocation failed. */
    private final int capacity;

    /**
     * Create a new resource exception.
     *
     * @param message
     *            The detail message.
     * @param capacity
     *            The capacity of the rope.
     */
    public RopeResourceException(String message, int capacity) {
        super(message);
        this.capacity = capacity;
    }

    /**
     * Create a new resource exception caused by a failed allocation.
     *
     * @param message
     *            The detail message.
     * @param capacity
     *            The capacity of the rope.
     * @param cause
     *            The error raised by the allocation.
     */
    public RopeResourceException(String message, int capacity, Throwable cause) {
        super(message, cause);
        this.capacity = capacity;
    }

    /**
     * Get the capacity of the rope that failed to allocate.
     *
     * @return The capacity.
     */
    public int getCapacity() {
        return capacity;
    }
}
