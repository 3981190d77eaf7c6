package com.splayrope;

/**
 * Base class of all errors signaled by the rope. A rope operation that throws
 * one of these has not changed the rope.
 */
public abstract class RopeException extends RuntimeException {
    /**
     * Create a new rope exception.
     *
     * @param message
     *            The detail message.
     */
    protected RopeException(String message) {
        super(message);
    }

    /**
     * Create a new rope exception with a cause.
     *
     * @param message
     *            The detail message.
     * @param cause
     *            The underlying cause.
     */
    protected RopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
