package com.splayrope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A text that supports moving a range of characters to another position in
 * amortized logarithmic time. The text is loaded once and then rearranged with
 * {@link #moveRange(int, int, int)}. Characters can also be inserted, but
 * never removed.
 * <p>
 * Note that every access, including {@link #charAt(int)}, restructures the
 * underlying tree. Instances must not be shared between threads without
 * external synchronization.
 */
public class Rope implements CharSequence {
    private static final Logger LOGGER = LoggerFactory.getLogger(Rope.class);

    /** Capacity used if none is given explicitly. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final int capacity;
    private SplayTree tree;

    private Rope(int capacity) {
        this.capacity = capacity;
        this.tree = new SplayTree();
    }

    /**
     * Build a rope holding the given text.
     *
     * @param text
     *            The initial text, possibly empty.
     * @return The new rope.
     * @throws RopeResourceException
     *             If the nodes for the text can not be allocated.
     */
    public static Rope build(CharSequence text) {
        return build(text, UNBOUNDED);
    }

    /**
     * Build a rope holding the given text that will never grow beyond the given
     * number of characters.
     *
     * @param text
     *            The initial text, possibly empty.
     * @param capacity
     *            The maximum length of the rope.
     * @return The new rope.
     * @throws RopeResourceException
     *             If the text is longer than the capacity or the nodes for the
     *             text can not be allocated.
     */
    public static Rope build(CharSequence text, int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative");
        }
        if (text.length() > capacity) {
            throw new RopeResourceException(
                    "Text of length " + text.length() + " exceeds capacity " + capacity, capacity);
        }
        Rope rope = new Rope(capacity);
        try {
            for (int i = 0; i < text.length(); i++) {
                rope.tree.appendAsNewRoot(text.charAt(i));
            }
        } catch (OutOfMemoryError e) {
            int loaded = rope.tree.size();
            rope.tree.destroy();
            throw new RopeResourceException("Failed to allocate node " + loaded + " of " + text.length(),
                    capacity, e);
        }
        LOGGER.debug("Built rope of {} characters", rope.tree.size());
        return rope;
    }

    private SplayTree tree() {
        if (tree == null) {
            throw new IllegalStateException("Rope has been disposed");
        }
        return tree;
    }

    /**
     * Get the maximum number of characters this rope may hold.
     *
     * @return The capacity.
     */
    public int capacity() {
        return capacity;
    }

    @Override
    public int length() {
        return tree().size();
    }

    @Override
    public char charAt(int index) {
        return tree().charAt(index);
    }

    /**
     * Cut the characters at indices {@code i} to {@code j} (inclusive) and paste
     * them after the {@code k}-th character of the remaining text. With
     * {@code k == 0} they are moved to the front.
     *
     * @param i
     *            The first index of the range, {@code 0 <= i <= j}.
     * @param j
     *            The last index of the range, {@code j < length()}.
     * @param k
     *            The paste position, {@code 0 <= k <= length() - (j - i + 1)}.
     * @throws RopeRangeException
     *             If any of the arguments is out of range. The rope is left
     *             unchanged in that case.
     */
    public void moveRange(int i, int j, int k) {
        tree().process(i, j, k);
    }

    /**
     * Like {@link #moveRange(int, int, int)}, but returns a rejected move as an
     * error result instead of throwing.
     *
     * @param i
     *            The first index of the range.
     * @param j
     *            The last index of the range.
     * @param k
     *            The paste position.
     * @return This rope, or the {@link RopeRangeException} of a rejected move.
     */
    public Result<Rope> tryMoveRange(int i, int j, int k) {
        try {
            moveRange(i, j, k);
            return Result.ok(this);
        } catch (RopeRangeException e) {
            return Result.err(e);
        }
    }

    /**
     * Insert a character so that it ends up at the given index.
     *
     * @param index
     *            The index of the new character, {@code 0 <= index <= length()}.
     * @param value
     *            The character to insert.
     * @throws RopeRangeException
     *             If the index is out of range.
     * @throws RopeResourceException
     *             If the rope is already at its capacity.
     */
    public void insert(int index, char value) {
        SplayTree current = tree();
        if (current.size() >= capacity) {
            throw new RopeResourceException("Rope is at its capacity " + capacity, capacity);
        }
        try {
            current.insert(index, value);
        } catch (OutOfMemoryError e) {
            throw new RopeResourceException("Failed to allocate node", capacity, e);
        }
    }

    /**
     * Insert a sequence of characters so that its first character ends up at
     * the given index. Either all characters are inserted or none: if allocating
     * a node fails partway, the characters inserted so far are removed again.
     *
     * @param index
     *            The index of the first new character.
     * @param text
     *            The characters to insert.
     * @throws RopeRangeException
     *             If the index is out of range.
     * @throws RopeResourceException
     *             If the text does not fit into the remaining capacity.
     */
    public void insert(int index, CharSequence text) {
        SplayTree current = tree();
        if (index < 0 || index > current.size()) {
            throw new RopeRangeException("Insert position " + index + " out of range [0, " + current.size() + "]");
        }
        if (text.length() > capacity - current.size()) {
            throw new RopeResourceException("Inserting " + text.length() + " characters exceeds capacity "
                    + capacity, capacity);
        }
        int inserted = 0;
        try {
            for (; inserted < text.length(); inserted++) {
                insert(index + inserted, text.charAt(inserted));
            }
        } catch (RopeResourceException e) {
            removeRange(index, index + inserted);
            throw e;
        }
    }

    /**
     * Remove the characters at indices {@code start} (inclusive) to {@code end}
     * (exclusive) and release their nodes. Only used to undo a partial insert.
     *
     * @param start
     *            The first index to remove.
     * @param end
     *            The index after the last one to remove.
     */
    void removeRange(int start, int end) {
        if (start >= end) {
            return;
        }
        SplayTree.Split tail = tree().split(end - 1);
        SplayTree head = null;
        SplayTree removed = tail.getLeft();
        if (start > 0) {
            SplayTree.Split split = removed.split(start - 1);
            head = split.getLeft();
            removed = split.getRight();
        }
        removed.destroy();
        tree = SplayTree.merge(head, tail.getRight());
    }

    /**
     * Get the full current text.
     *
     * @return The text.
     */
    public String render() {
        return new String(tree().materialize());
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        SplayTree current = tree();
        if (start < 0 || end > current.size() || start > end) {
            throw new RopeRangeException("Sub-sequence [" + start + ", " + end + ") out of range [0, "
                    + current.size() + "]");
        }
        StringBuilder builder = new StringBuilder(end - start);
        SplayTree.TreeIterator it = current.iterator(start);
        for (int i = start; i < end; i++) {
            builder.append(it.nextChar());
        }
        return builder.toString();
    }

    /**
     * Release all nodes of this rope. Any further use of the rope, except for
     * another call to this method, throws an {@link IllegalStateException}.
     */
    public void dispose() {
        if (tree != null) {
            int size = tree.size();
            tree.destroy();
            tree = null;
            LOGGER.debug("Disposed rope of {} characters", size);
        }
    }

    /**
     * Return whether {@link #dispose()} has been called.
     *
     * @return {@code true} if the rope has been disposed.
     */
    public boolean isDisposed() {
        return tree == null;
    }

    @Override
    public String toString() {
        return tree == null ? "Rope[disposed]" : render();
    }
}
