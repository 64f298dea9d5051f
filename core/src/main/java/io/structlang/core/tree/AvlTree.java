// file: core/src/main/java/io/structlang/core/tree/AvlTree.java
package io.structlang.core.tree;

import io.structlang.core.StructureKind;

import java.util.ArrayList;
import java.util.List;

import static io.structlang.core.tree.NodeArena.NIL;

/**
 * Self-balancing search tree.
 * <p>
 * Invariant: the search-tree order holds and, for every node,
 * |height(left) - height(right)| <= 1.
 * <p>
 * Rebalancing happens in {@link #restore(int)}, which runs on the ancestors
 * of the changed position, bottom-up, until one keeps its root and height:
 *  - balance > 1, left child balance >= 0  -> right rotation (left-left),
 *  - balance > 1, left child balance < 0   -> left on child, right on node (left-right),
 *  - balance < -1, right child balance <= 0 -> left rotation (right-right),
 *  - balance < -1, right child balance > 0  -> right on child, left on node (right-left).
 * After an insert the first rotation restores the subtree's old height, so
 * no ancestor above it needs one; a delete may rotate at several levels.
 */
public final class AvlTree extends SearchTree {

    private final List<String> rotations = new ArrayList<>();

    @Override
    public StructureKind kind() {
        return StructureKind.AVL;
    }

    /** Cached at the root; heights are kept exact on every node. */
    @Override
    public int height() {
        return arena.height(root);
    }

    /** Rotations applied by the most recent insert or delete, lowest first. */
    public List<String> lastRotations() {
        return List.copyOf(rotations);
    }

    /** height(left) - height(right) of the node holding {@code value}; 0 when absent. */
    public int balanceOf(int value) {
        int n = root;
        while (n != NIL) {
            int v = arena.value(n);
            if (v == value) return arena.balance(n);
            n = value < v ? arena.left(n) : arena.right(n);
        }
        return 0;
    }

    /** True when every cached height is accurate and every balance factor is in {-1, 0, 1}. */
    public boolean isBalanced() {
        return checkBalanced(root) >= 0;
    }

    @Override
    public List<Integer> build(List<Integer> values) {
        List<Integer> skipped = super.build(values);
        rotations.clear();
        return skipped;
    }

    @Override
    protected void beforeMutation() {
        rotations.clear();
    }

    @Override
    protected int restore(int node) {
        arena.updateHeight(node);
        int balance = arena.balance(node);
        if (balance > 1) {
            int l = arena.left(node);
            if (arena.balance(l) < 0) {
                rotations.add("left-right at " + arena.value(node));
                arena.setLeft(node, rotateLeft(l));
            } else {
                rotations.add("right at " + arena.value(node));
            }
            return rotateRight(node);
        }
        if (balance < -1) {
            int r = arena.right(node);
            if (arena.balance(r) > 0) {
                rotations.add("right-left at " + arena.value(node));
                arena.setRight(node, rotateRight(r));
            } else {
                rotations.add("left at " + arena.value(node));
            }
            return rotateLeft(node);
        }
        return node;
    }

    // ---------- rotations ----------

    private int rotateRight(int y) {
        int x = arena.left(y);
        arena.setLeft(y, arena.right(x));
        arena.setRight(x, y);
        arena.updateHeight(y);
        arena.updateHeight(x);
        return x;
    }

    private int rotateLeft(int x) {
        int y = arena.right(x);
        arena.setRight(x, arena.left(y));
        arena.setLeft(y, x);
        arena.updateHeight(x);
        arena.updateHeight(y);
        return y;
    }

    /** Returns the measured height, or -1 when the subtree violates a balance or height rule. */
    private int checkBalanced(int n) {
        if (n == NIL) return 0;
        int lh = checkBalanced(arena.left(n));
        int rh = checkBalanced(arena.right(n));
        if (lh < 0 || rh < 0 || Math.abs(lh - rh) > 1) return -1;
        int h = 1 + Math.max(lh, rh);
        return h == arena.height(n) ? h : -1;
    }
}
