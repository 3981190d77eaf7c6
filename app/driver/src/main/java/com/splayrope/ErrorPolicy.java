package com.splayrope;

/**
 * What the driver does when an operation is rejected with a range error.
 */
public enum ErrorPolicy {
    /** Stop at the first rejected operation without producing output. */
    ABORT("abort"),
    /** Log the rejected operation and continue with the next one. */
    SKIP("skip");

    private final String name;

    private ErrorPolicy(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Get the policy for the given command line name.
     *
     * @param name
     *            The string to search for.
     * @return The policy with given name.
     */
    public static ErrorPolicy fromString(String name) {
        for (ErrorPolicy policy : ErrorPolicy.values()) {
            if (policy.toString().equals(name)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("\"" + name + "\" is not a valid error policy");
    }
}
