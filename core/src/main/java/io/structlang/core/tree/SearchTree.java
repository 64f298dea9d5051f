// file: core/src/main/java/io/structlang/core/tree/SearchTree.java
package io.structlang.core.tree;

import io.structlang.core.ErrorKind;
import io.structlang.core.Structure;
import io.structlang.core.StructureException;
import io.structlang.core.StructureKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.structlang.core.tree.NodeArena.NIL;

/**
 * Unbalanced binary search tree over distinct ints.
 * <p>
 * Invariant: for every node, all values in the left subtree are smaller and
 * all values in the right subtree are larger. Duplicates are never stored.
 * <p>
 * Insert and delete walk down iteratively, remembering the ancestors in a
 * reusable path buffer, then relink bottom-up through {@link #restore(int)}. The
 * walk back up stops at the first ancestor whose subtree kept its root and
 * its height. The plain tree keeps no per-node state, so that is the first
 * one; {@link AvlTree} overrides restore to maintain heights and rotate.
 * Depth is bounded only by size (sorted input builds a chain), so nothing
 * here recurses.
 */
public class SearchTree implements Structure {

    protected final NodeArena arena = new NodeArena();
    protected int root = NIL;
    private int size;
    private final Path path = new Path();

    public SearchTree() {
    }

    @Override
    public StructureKind kind() {
        return StructureKind.BST;
    }

    @Override
    public int size() {
        return size;
    }

    public int height() {
        return arena.measureHeight(root);
    }

    /**
     * Insert each value in order. Values already present are skipped.
     *
     * @return the skipped duplicates, in input order
     */
    public List<Integer> build(List<Integer> values) {
        List<Integer> skipped = new ArrayList<>();
        for (int v : values) {
            if (!tryInsert(v)) {
                skipped.add(v);
            }
        }
        return List.copyOf(skipped);
    }

    /** Insert {@code value}; DUPLICATE (and no change) when already present. */
    public void insert(int value) {
        if (!tryInsert(value)) {
            throw new StructureException(ErrorKind.DUPLICATE, "value %d already present".formatted(value));
        }
    }

    /** Delete {@code value}; DELETE (and no change) when absent. */
    public void delete(int value) {
        path.clear();
        int n = root;
        while (n != NIL && arena.value(n) != value) {
            int dir = value < arena.value(n) ? 0 : 1;
            path.push(n, dir);
            n = arena.child(n, dir);
        }
        if (n == NIL) {
            throw new StructureException(ErrorKind.DELETE, "value %d not present".formatted(value));
        }
        beforeMutation();

        int unlinked = n;
        if (arena.left(n) != NIL && arena.right(n) != NIL) {
            // two children: the in-order successor's value moves up, the successor node goes
            path.push(n, 1);
            int successor = arena.right(n);
            while (arena.left(successor) != NIL) {
                path.push(successor, 0);
                successor = arena.left(successor);
            }
            arena.setValue(n, arena.value(successor));
            unlinked = successor;
        }
        int replacement = arena.left(unlinked) != NIL ? arena.left(unlinked) : arena.right(unlinked);
        arena.release(unlinked);
        root = relink(replacement);
        size--;
    }

    public SearchResult search(int value) {
        List<Integer> visited = new ArrayList<>();
        int n = root;
        while (n != NIL) {
            int v = arena.value(n);
            visited.add(v);
            if (value == v) {
                return new SearchResult(true, visited);
            }
            n = value < v ? arena.left(n) : arena.right(n);
        }
        return new SearchResult(false, visited);
    }

    public boolean contains(int value) {
        int n = root;
        while (n != NIL) {
            int v = arena.value(n);
            if (value == v) return true;
            n = value < v ? arena.left(n) : arena.right(n);
        }
        return false;
    }

    public List<Integer> traverse(Traversal order) {
        return arena.traverse(root, order);
    }

    /** Hook run once per mutating call, before the tree changes. */
    protected void beforeMutation() {
    }

    /**
     * Repair {@code node} after the child subtree on the walked path changed.
     *
     * @return the root of the repaired subtree ({@code node} unless it rotated)
     */
    protected int restore(int node) {
        return node;
    }

    // ---------- helpers ----------

    /** Single descent: false (and no change) when {@code value} is already stored. */
    private boolean tryInsert(int value) {
        path.clear();
        int n = root;
        while (n != NIL) {
            int v = arena.value(n);
            if (value == v) {
                return false;
            }
            int dir = value < v ? 0 : 1;
            path.push(n, dir);
            n = arena.child(n, dir);
        }
        beforeMutation();
        root = relink(arena.allocate(value));
        size++;
        return true;
    }

    /**
     * Hang {@code child} under the deepest ancestor of {@code path} and restore
     * ancestors bottom-up. Returns the tree's root afterwards.
     */
    private int relink(int child) {
        for (int i = path.size - 1; i >= 0; i--) {
            int node = path.nodes[i];
            arena.setChild(node, path.dirs[i], child);
            int heightBefore = arena.height(node);
            int top = restore(node);
            if (top == node && arena.height(node) == heightBefore) {
                return root; // nothing above can change
            }
            child = top;
        }
        return child;
    }

    /** Ancestors visited on the way down, with the direction taken at each (0 left, 1 right). */
    private static final class Path {
        private int[] nodes = new int[16];
        private int[] dirs = new int[16];
        private int size;

        void clear() {
            size = 0;
        }

        void push(int node, int dir) {
            if (size == nodes.length) {
                nodes = Arrays.copyOf(nodes, size * 2);
                dirs = Arrays.copyOf(dirs, size * 2);
            }
            nodes[size] = node;
            dirs[size] = dir;
            size++;
        }
    }
}
