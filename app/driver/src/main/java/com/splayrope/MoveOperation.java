package com.splayrope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single cut-and-paste operation read from the input. Moves the characters
 * at indices {@code i} to {@code j} after the {@code k}-th character of the
 * remaining text.
 */
public class MoveOperation {
    @JsonProperty("i")
    public final int i;
    @JsonProperty("j")
    public final int j;
    @JsonProperty("k")
    public final int k;

    /**
     * Create a new operation. This constructor is also used by Jackson, in which
     * case all three indices must be present.
     *
     * @param i
     *            First index of the range to move.
     * @param j
     *            Last index (inclusive) of the range to move.
     * @param k
     *            The paste position.
     */
    @JsonCreator
    public MoveOperation(
            @JsonProperty(value = "i", required = true) int i,
            @JsonProperty(value = "j", required = true) int j,
            @JsonProperty(value = "k", required = true) int k) {
        this.i = i;
        this.j = j;
        this.k = k;
    }

    /**
     * Apply this operation to the given rope.
     *
     * @param rope
     *            The rope to rearrange.
     * @return The rope, or the reason the operation was rejected.
     */
    public Result<Rope> applyTo(Rope rope) {
        return rope.tryMoveRange(i, j, k);
    }

    @Override
    public String toString() {
        return "move(" + i + ", " + j + ", " + k + ")";
    }
}
