package com.splayrope;

/**
 * The supported input protocols.
 */
public enum InputFormat {
    /** Text line, operation count, and whitespace separated triples. */
    TEXT("text"),
    /** A JSON object with {@code text} and {@code operations} fields. */
    JSON("json");

    private final String name;

    private InputFormat(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Get the input format for the given command line name.
     *
     * @param name
     *            The string to search for.
     * @return The input format with given name.
     */
    public static InputFormat fromString(String name) {
        for (InputFormat format : InputFormat.values()) {
            if (format.toString().equals(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("\"" + name + "\" is not a valid input format");
    }
}
