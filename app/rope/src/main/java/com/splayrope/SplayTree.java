package com.splayrope;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A splay tree of characters ordered by rank instead of by key. The in-order
 * traversal of the tree is the text it stores, and the subtree sizes kept in
 * each node allow finding the character at a given index. Every access splays
 * the accessed node to the root, which gives amortized logarithmic cost for
 * all operations.
 * <p>
 * Trees handed to {@link #split(int)} or {@link #merge(SplayTree, SplayTree)}
 * give their nodes away. After the call the consumed handle is empty and
 * should not be used any further.
 * <p>
 * This class is not thread-safe. Even reads like {@link #charAt(int)} change
 * the shape of the tree.
 */
public class SplayTree {
    /**
     * An iterator over the characters of the tree, starting at a given rank.
     * The iterator does not splay, but it is invalidated by any structural
     * change of the tree.
     */
    public static class TreeIterator implements Iterator<Character> {
        private final List<Node> path;

        private TreeIterator(List<Node> path) {
            this.path = path;
        }

        @Override
        public boolean hasNext() {
            return !path.isEmpty();
        }

        @Override
        public Character next() {
            return nextChar();
        }

        /**
         * Like {@link #next()}, but without boxing the character.
         *
         * @return The next character.
         */
        public char nextChar() {
            if (path.isEmpty()) {
                throw new NoSuchElementException("Iterator is empty");
            }
            Node current = path.get(path.size() - 1);
            char value = current.value;
            if (current.right != null) {
                // Go right once and then all the way to the left.
                current = current.right;
                path.add(current);
                while (current.left != null) {
                    current = current.left;
                    path.add(current);
                }
            } else {
                // Go up until we come from a left child.
                path.remove(path.size() - 1);
                while (!path.isEmpty() && path.get(path.size() - 1).right == current) {
                    current = path.remove(path.size() - 1);
                }
            }
            return value;
        }
    }

    /**
     * The result of splitting a tree in two.
     */
    public static final class Split {
        private final SplayTree left;
        private final SplayTree right;

        private Split(SplayTree left, SplayTree right) {
            this.left = left;
            this.right = right;
        }

        /**
         * Get the tree holding all positions up to and including the split rank.
         *
         * @return The left tree.
         */
        public SplayTree getLeft() {
            return left;
        }

        /**
         * Get the tree holding all positions after the split rank. This might be
         * an empty tree.
         *
         * @return The right tree.
         */
        public SplayTree getRight() {
            return right;
        }
    }

    /**
     * Internal node type. One node holds one character. The parent link is only
     * used for navigating upwards while splaying.
     */
    static final class Node {
        final char value;
        Node parent, left, right;
        int size;

        Node(char value) {
            this.value = value;
            this.size = 1;
        }
    }

    private Node root;
    private int size;

    /**
     * Create an empty tree.
     */
    public SplayTree() {
        root = null;
        size = 0;
    }

    private SplayTree(Node root) {
        if (root != null) {
            root.parent = null;
        }
        this.root = root;
        this.size = size(root);
    }

    /**
     * Get the number of characters in the tree.
     *
     * @return The size of the tree.
     */
    public int size() {
        return size;
    }

    /**
     * Return whether the tree contains no characters.
     *
     * @return {@code true} if the tree is empty.
     */
    public boolean isEmpty() {
        return root == null;
    }

    Node root() {
        return root;
    }

    private static int size(Node n) {
        return n == null ? 0 : n.size;
    }

    private static void update(Node n) {
        n.size = 1 + size(n.left) + size(n.right);
    }

    private void replaceChild(Node parent, Node oldChild, Node newChild) {
        newChild.parent = parent;
        if (parent == null) {
            root = newChild;
        } else if (parent.left == oldChild) {
            parent.left = newChild;
        } else {
            parent.right = newChild;
        }
    }

    private void rotateRight(Node x) {
        Node y = x.left;
        if (y == null) {
            return;
        }
        Node z = y.right;
        replaceChild(x.parent, x, y);
        x.parent = y;
        y.right = x;
        if (z != null) {
            z.parent = x;
        }
        x.left = z;
        update(x);
        update(y);
    }

    private void rotateLeft(Node x) {
        Node y = x.right;
        if (y == null) {
            return;
        }
        Node z = y.left;
        replaceChild(x.parent, x, y);
        x.parent = y;
        y.left = x;
        if (z != null) {
            z.parent = x;
        }
        x.right = z;
        update(x);
        update(y);
    }

    /**
     * Move the given node to the root of this tree.
     *
     * @param node
     *            A node of this tree.
     */
    private void splay(Node node) {
        Node parent = node.parent;
        while (parent != null) {
            Node grandParent = parent.parent;
            if (grandParent == null) {
                // Zig
                if (node == parent.left) {
                    rotateRight(parent);
                } else {
                    rotateLeft(parent);
                }
            } else if (node == parent.left) {
                if (parent == grandParent.left) {
                    // Zig-zig
                    rotateRight(grandParent);
                    rotateRight(parent);
                } else {
                    // Zig-zag
                    rotateRight(parent);
                    rotateLeft(grandParent);
                }
            } else {
                if (parent == grandParent.right) {
                    // Zig-zig
                    rotateLeft(grandParent);
                    rotateLeft(parent);
                } else {
                    // Zig-zag
                    rotateLeft(parent);
                    rotateRight(grandParent);
                }
            }
            parent = node.parent;
        }
    }

    private static void checkIndex(int index, int bound, String what) {
        if (index < 0 || index >= bound) {
            throw new RopeRangeException(what + " " + index + " out of range [0, " + bound + ")");
        }
    }

    /**
     * Find the node at the given 0-based rank and splay it to the root.
     *
     * @param k
     *            The rank to look up, {@code 0 <= k < size()}.
     * @return The node, which is now the root of the tree.
     */
    Node locate(int k) {
        checkIndex(k, size, "Rank");
        Node node = root;
        while (true) {
            int leftSize = size(node.left);
            if (k < leftSize) {
                node = node.left;
            } else if (k > leftSize) {
                k -= leftSize + 1;
                node = node.right;
            } else {
                break;
            }
        }
        splay(node);
        return node;
    }

    /**
     * Get the character at the given index. The node holding it becomes the new
     * root of the tree.
     *
     * @param index
     *            The index to query.
     * @return The character at that index.
     * @throws RopeRangeException
     *             If the index is outside {@code [0, size())}.
     */
    public char charAt(int index) {
        return locate(index).value;
    }

    private Node subtreeMaximum(Node node) {
        while (node.right != null) {
            node = node.right;
        }
        splay(node);
        return node;
    }

    /**
     * Append a character by making it the new root, with the old root as its
     * left child. This is only meant for loading the initial text. It does not
     * splay, so a text loaded this way starts out as a left leaning chain that
     * later accesses flatten.
     *
     * @param value
     *            The character to append.
     */
    public void appendAsNewRoot(char value) {
        Node node = new Node(value);
        if (root != null) {
            root.parent = node;
        }
        node.left = root;
        update(node);
        root = node;
        size++;
    }

    /**
     * Insert a character so that it ends up at the given index. The new node
     * becomes the root of the tree.
     *
     * @param rank
     *            The index of the new character, {@code 0 <= rank <= size()}.
     * @param value
     *            The character to insert.
     * @throws RopeRangeException
     *             If the rank is outside {@code [0, size()]}.
     */
    public void insert(int rank, char value) {
        checkIndex(rank, size + 1, "Insert position");
        Node node = new Node(value);
        if (root == null) {
            root = node;
        } else if (rank == size) {
            Node last = locate(rank - 1);
            last.parent = node;
            node.left = last;
            update(node);
            root = node;
        } else {
            Node next = locate(rank);
            node.left = next.left;
            if (node.left != null) {
                node.left.parent = node;
            }
            next.left = null;
            next.parent = node;
            node.right = next;
            update(next);
            update(node);
            root = node;
        }
        size++;
    }

    /**
     * Split this tree after the given rank. Positions {@code 0..rank} end up in
     * the left tree and the remaining positions in the right tree. This tree is
     * left empty.
     *
     * @param rank
     *            The last rank of the left tree, {@code 0 <= rank < size()}.
     * @return The two resulting trees.
     * @throws RopeRangeException
     *             If the rank is outside {@code [0, size())}.
     */
    public Split split(int rank) {
        Node left = locate(rank);
        Node right = left.right;
        left.right = null;
        update(left);
        root = null;
        size = 0;
        return new Split(new SplayTree(left), new SplayTree(right));
    }

    /**
     * Concatenate two trees. All positions of the first tree precede those of
     * the second in the result. If one of the trees is empty the other is
     * returned unchanged. Otherwise the first tree is returned and the second is
     * left empty.
     *
     * @param first
     *            The tree holding the leading text, may be {@code null}.
     * @param second
     *            The tree holding the trailing text, may be {@code null}.
     * @return The concatenated tree.
     */
    public static SplayTree merge(SplayTree first, SplayTree second) {
        if (first == null || first.root == null) {
            return second == null ? new SplayTree() : second;
        } else if (second == null || second.root == null) {
            return first;
        }
        Node last = first.subtreeMaximum(first.root);
        Node other = second.root;
        other.parent = last;
        last.right = other;
        update(last);
        first.size = last.size;
        second.root = null;
        second.size = 0;
        return first;
    }

    /**
     * Move the characters at positions {@code i..j} so that they follow the
     * {@code k}-th character of the text that remains after removing them. A
     * {@code k} of zero moves them to the front. The arguments are validated
     * before the tree is touched.
     *
     * @param i
     *            First index of the range to move.
     * @param j
     *            Last index (inclusive) of the range to move.
     * @param k
     *            Number of remaining characters that precede the moved range.
     * @throws RopeRangeException
     *             If {@code 0 <= i <= j < size()} or
     *             {@code 0 <= k <= size() - (j - i + 1)} is violated.
     */
    public void process(int i, int j, int k) {
        checkIndex(j, size, "Range end");
        if (i < 0 || i > j) {
            throw new RopeRangeException("Range start " + i + " out of range [0, " + j + "]");
        }
        int remaining = size - (j - i + 1);
        if (k < 0 || k > remaining) {
            throw new RopeRangeException("Paste position " + k + " out of range [0, " + remaining + "]");
        }
        Split split = split(j);
        SplayTree middle = split.getLeft();
        SplayTree right = split.getRight();
        SplayTree left;
        if (i > 0) {
            split = middle.split(i - 1);
            left = split.getLeft();
            middle = split.getRight();
        } else {
            left = new SplayTree();
        }
        left = merge(left, right);
        if (k > 0) {
            split = left.split(k - 1);
            left = split.getLeft();
            right = split.getRight();
        } else {
            right = left;
            left = new SplayTree();
        }
        SplayTree result = merge(merge(left, middle), right);
        root = result.root;
        size = result.size;
    }

    /**
     * Collect the whole text using an in-order traversal. This does not change
     * the tree.
     *
     * @return The characters in order.
     */
    public char[] materialize() {
        char[] result = new char[size];
        Node[] stack = new Node[Math.max(1, size)];
        int depth = 0;
        int index = 0;
        Node current = root;
        while (true) {
            while (current != null) {
                stack[depth++] = current;
                current = current.left;
            }
            if (depth == 0) {
                break;
            }
            current = stack[--depth];
            result[index++] = current.value;
            current = current.right;
        }
        return result;
    }

    /**
     * Create an iterator over the characters, starting at the given index. An
     * index equal to {@code size()} gives an iterator without elements.
     *
     * @param index
     *            The index to start at.
     * @return The new iterator.
     * @throws RopeRangeException
     *             If the index is outside {@code [0, size()]}.
     */
    public TreeIterator iterator(int index) {
        checkIndex(index, size + 1, "Iterator start");
        List<Node> path = new ArrayList<>();
        Node node = root;
        while (node != null && index < size) {
            path.add(node);
            int leftSize = size(node.left);
            if (index < leftSize) {
                node = node.left;
            } else if (index > leftSize) {
                index -= leftSize + 1;
                node = node.right;
            } else {
                return new TreeIterator(path);
            }
        }
        path.clear();
        return new TreeIterator(path);
    }

    /**
     * Unlink every node of the tree using an iterative post-order traversal,
     * and leave the tree empty. Calling this on an empty tree does nothing.
     */
    public void destroy() {
        if (root == null) {
            return;
        }
        Node[] stack = new Node[size];
        boolean[] visited = new boolean[size];
        int depth = 0;
        Node current = root;
        while (current != null) {
            stack[depth] = current;
            visited[depth] = false;
            depth++;
            current = current.left;
        }
        while (depth > 0) {
            current = stack[depth - 1];
            if (visited[depth - 1]) {
                current.parent = null;
                current.left = null;
                current.right = null;
                current.size = 0;
                stack[--depth] = null;
            } else {
                visited[depth - 1] = true;
                current = current.right;
                while (current != null) {
                    stack[depth] = current;
                    visited[depth] = false;
                    depth++;
                    current = current.left;
                }
            }
        }
        root = null;
        size = 0;
    }
}
