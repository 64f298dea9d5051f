// file: core/src/main/java/io/structlang/core/tree/BinaryTree.java
package io.structlang.core.tree;

import io.structlang.core.ErrorKind;
import io.structlang.core.Structure;
import io.structlang.core.StructureException;
import io.structlang.core.StructureKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static io.structlang.core.tree.NodeArena.NIL;

/**
 * Plain binary tree addressed by paths.
 * <p>
 * A path is a sequence of 0 (go left) / 1 (go right) steps from the root;
 * the empty path is the root itself. A path of length k is only meaningful
 * when every proper prefix lands on an existing node.
 * <p>
 * Shape rules:
 *  - building from values fills slots in level order, left child first,
 *  - insert without a path takes the next empty level-order slot,
 *  - delete removes the addressed node together with its whole subtree.
 */
public final class BinaryTree implements Structure {

    private final NodeArena arena = new NodeArena();
    private int root = NIL;
    private int size;

    public BinaryTree(List<Integer> values) {
        for (int v : values) {
            insert(v);
        }
    }

    @Override
    public StructureKind kind() {
        return StructureKind.BINARYTREE;
    }

    @Override
    public int size() {
        return size;
    }

    public int height() {
        return arena.measureHeight(root);
    }

    /** Insert at the first empty slot in level order (left before right). */
    public void insert(int value) {
        if (root == NIL) {
            root = arena.allocate(value);
            size = 1;
            return;
        }
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            int n = queue.poll();
            for (int dir = 0; dir <= 1; dir++) {
                int c = arena.child(n, dir);
                if (c == NIL) {
                    arena.setChild(n, dir, arena.allocate(value));
                    size++;
                    return;
                }
                queue.add(c);
            }
        }
    }

    /**
     * Insert a leaf at the empty slot addressed by {@code path}.
     * Every step but the last must land on an existing node; the last step
     * must land on an empty child slot. An empty path only succeeds on an
     * empty tree (it then creates the root).
     */
    public void insertAt(int value, List<Integer> path) {
        checkSteps(path);
        if (path.isEmpty()) {
            if (root != NIL) {
                throw new StructureException(ErrorKind.INVALID_PATH, "root already exists");
            }
            root = arena.allocate(value);
            size = 1;
            return;
        }
        int parent = resolve(path.subList(0, path.size() - 1), path);
        int dir = path.get(path.size() - 1);
        if (arena.child(parent, dir) != NIL) {
            throw new StructureException(
                    ErrorKind.INVALID_PATH,
                    "slot at path %s is already occupied".formatted(render(path))
            );
        }
        arena.setChild(parent, dir, arena.allocate(value));
        size++;
    }

    /**
     * Remove the node at {@code path} and its subtree.
     *
     * @param expected when non-null, the node must hold this value
     * @return number of nodes removed
     */
    public int deleteAt(List<Integer> path, Integer expected) {
        checkSteps(path);
        if (path.isEmpty()) {
            if (root == NIL) {
                throw new StructureException(ErrorKind.INVALID_PATH, "tree is empty");
            }
            checkExpected(root, expected, path);
            int removed = arena.releaseSubtree(root);
            root = NIL;
            size -= removed;
            return removed;
        }
        int parent = resolve(path.subList(0, path.size() - 1), path);
        int dir = path.get(path.size() - 1);
        int target = arena.child(parent, dir);
        if (target == NIL) {
            throw new StructureException(
                    ErrorKind.INVALID_PATH,
                    "no node at path %s".formatted(render(path))
            );
        }
        checkExpected(target, expected, path);
        arena.setChild(parent, dir, NIL);
        int removed = arena.releaseSubtree(target);
        size -= removed;
        return removed;
    }

    /**
     * Remove the first node (in level order) holding {@code value}, with its subtree.
     *
     * @return number of nodes removed
     */
    public int delete(int value) {
        if (root != NIL && arena.value(root) == value) {
            int removed = arena.releaseSubtree(root);
            root = NIL;
            size -= removed;
            return removed;
        }
        Deque<Integer> queue = new ArrayDeque<>();
        if (root != NIL) queue.add(root);
        while (!queue.isEmpty()) {
            int n = queue.poll();
            for (int dir = 0; dir <= 1; dir++) {
                int c = arena.child(n, dir);
                if (c == NIL) continue;
                if (arena.value(c) == value) {
                    arena.setChild(n, dir, NIL);
                    int removed = arena.releaseSubtree(c);
                    size -= removed;
                    return removed;
                }
                queue.add(c);
            }
        }
        throw new StructureException(ErrorKind.DELETE, "value %d not present".formatted(value));
    }

    /** Value of the node at {@code path}. */
    public int valueAt(List<Integer> path) {
        checkSteps(path);
        if (root == NIL) {
            throw new StructureException(ErrorKind.INVALID_PATH, "tree is empty");
        }
        return arena.value(resolve(path, path));
    }

    public List<Integer> traverse(Traversal order) {
        return arena.traverse(root, order);
    }

    // ---------- helpers ----------

    /** Walk {@code steps} from the root; every step must land on a node. */
    private int resolve(List<Integer> steps, List<Integer> fullPath) {
        if (root == NIL) {
            throw new StructureException(ErrorKind.INVALID_PATH, "tree is empty");
        }
        int n = root;
        for (int i = 0; i < steps.size(); i++) {
            n = arena.child(n, steps.get(i));
            if (n == NIL) {
                throw new StructureException(
                        ErrorKind.INVALID_PATH,
                        "path %s breaks at step %d: no node at %s".formatted(
                                render(fullPath), i + 1, render(fullPath.subList(0, i + 1)))
                );
            }
        }
        return n;
    }

    private void checkExpected(int node, Integer expected, List<Integer> path) {
        if (expected != null && arena.value(node) != expected) {
            throw new StructureException(
                    ErrorKind.INVALID_PATH,
                    "node at path %s holds %d, not %d".formatted(render(path), arena.value(node), expected)
            );
        }
    }

    private static void checkSteps(List<Integer> path) {
        for (int step : path) {
            if (step != 0 && step != 1) {
                throw new StructureException(ErrorKind.INVALID_PATH, "path steps must be 0 or 1, got " + step);
            }
        }
    }

    private static String render(List<Integer> path) {
        if (path.isEmpty()) return "<root>";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < path.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(path.get(i));
        }
        return sb.toString();
    }
}
