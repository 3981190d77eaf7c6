package com.splayrope;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary of a driver run, written as JSON if a report file is requested.
 */
public class RunReport {
    /** Length of the text, which never changes during a run. */
    @JsonProperty("length")
    public int length;
    /** Number of operations in the input. */
    @JsonProperty("operations")
    public int operations;
    @JsonProperty("applied")
    public int applied;
    @JsonProperty("rejected")
    public int rejected;
    /** Whether the run stopped at a rejected operation. */
    @JsonProperty("aborted")
    public boolean aborted;
    @JsonProperty("elapsed_ms")
    public long elapsedMillis;

    @Override
    public String toString() {
        return "RunReport[length=" + length + ", operations=" + operations + ", applied=" + applied
                + ", rejected=" + rejected + ", aborted=" + aborted + "]";
    }
}
