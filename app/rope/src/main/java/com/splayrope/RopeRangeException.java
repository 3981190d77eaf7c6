package com.splayrope;

/**
 * Indicates that an index, rank or range passed to a rope operation lies
 * outside the bounds that are valid for the current text.
 */
public class RopeRangeException extends RopeException {
    /**
     * Create a new range exception.
     *
     * @param message
     *            Description of the offending index and the valid bound.
     */
    public RopeRangeException(String message) {
        super(message);
    }
}
