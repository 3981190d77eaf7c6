package com.splayrope;

import java.io.IOException;

/**
 * Indicates that the driver input does not follow the expected protocol.
 */
public class InputFormatException extends IOException {
    /** The 1-based line at which the problem was detected, or 0 if unknown. */
    private final int line;

    /**
     * Create a new input format exception.
     *
     * @param message
     *            Description of the problem.
     * @param line
     *            The line of the input, or 0 if unknown.
     */
    public InputFormatException(String message, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    /**
     * Create a new input format exception wrapping a parser error.
     *
     * @param message
     *            Description of the problem.
     * @param cause
     *            The error raised by the parser.
     */
    public InputFormatException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
    }

    /**
     * Get the line at which the problem was detected.
     *
     * @return The 1-based line number, or 0 if unknown.
     */
    public int getLine() {
        return line;
    }
}
