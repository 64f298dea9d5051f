// file: core/src/main/java/io/structlang/core/tree/NodeArena.java
package io.structlang.core.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Index-addressed storage for integer binary-tree nodes.
 * <p>
 * Nodes are ints into parallel arrays instead of object references, so a
 * rotation or subtree removal only rewrites child slots:
 *  - value[n], left[n], right[n], height[n] describe node n,
 *  - {@link #NIL} marks an absent child,
 *  - released nodes are chained through left[] and reused by allocate().
 * <p>
 * Heights count nodes on the longest downward path: a leaf has height 1,
 * NIL has height 0.
 */
final class NodeArena {

    static final int NIL = -1;

    private int[] value = new int[16];
    private int[] left = new int[16];
    private int[] right = new int[16];
    private int[] height = new int[16];
    private int used;
    private int freeHead = NIL;

    int allocate(int v) {
        int n;
        if (freeHead != NIL) {
            n = freeHead;
            freeHead = left[n];
        } else {
            if (used == value.length) {
                int cap = value.length * 2;
                value = Arrays.copyOf(value, cap);
                left = Arrays.copyOf(left, cap);
                right = Arrays.copyOf(right, cap);
                height = Arrays.copyOf(height, cap);
            }
            n = used++;
        }
        value[n] = v;
        left[n] = NIL;
        right[n] = NIL;
        height[n] = 1;
        return n;
    }

    /** Release {@code n} and every node below it; returns how many nodes were released. */
    int releaseSubtree(int n) {
        if (n == NIL) return 0;
        int released = 0;
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(n);
        while (!stack.isEmpty()) {
            int cur = stack.pop();
            if (left[cur] != NIL) stack.push(left[cur]);
            if (right[cur] != NIL) stack.push(right[cur]);
            release(cur);
            released++;
        }
        return released;
    }

    void release(int n) {
        right[n] = NIL;
        left[n] = freeHead;
        freeHead = n;
    }

    int value(int n) { return value[n]; }

    void setValue(int n, int v) { value[n] = v; }

    int left(int n) { return left[n]; }

    int right(int n) { return right[n]; }

    void setLeft(int n, int child) { left[n] = child; }

    void setRight(int n, int child) { right[n] = child; }

    int child(int n, int direction) { return direction == 0 ? left[n] : right[n]; }

    void setChild(int n, int direction, int child) {
        if (direction == 0) left[n] = child;
        else right[n] = child;
    }

    int height(int n) { return n == NIL ? 0 : height[n]; }

    void updateHeight(int n) {
        height[n] = 1 + Math.max(height(left[n]), height(right[n]));
    }

    /** height(left) - height(right). */
    int balance(int n) {
        return n == NIL ? 0 : height(left[n]) - height(right[n]);
    }

    /** Height computed by walking the subtree level by level, independent of the cached heights. */
    int measureHeight(int n) {
        if (n == NIL) return 0;
        int levels = 0;
        Deque<Integer> level = new ArrayDeque<>();
        level.add(n);
        while (!level.isEmpty()) {
            levels++;
            for (int i = level.size(); i > 0; i--) {
                int cur = level.poll();
                if (left[cur] != NIL) level.add(left[cur]);
                if (right[cur] != NIL) level.add(right[cur]);
            }
        }
        return levels;
    }

    List<Integer> traverse(int root, Traversal order) {
        List<Integer> out = new ArrayList<>();
        switch (order) {
            case PREORDER -> preorder(root, out);
            case INORDER -> inorder(root, out);
            case POSTORDER -> postorder(root, out);
            case LEVELORDER -> levelorder(root, out);
        }
        return List.copyOf(out);
    }

    // ---------- traversal helpers ----------
    // Explicit stacks: a search tree built from sorted input is a chain as deep as it is large.

    private void preorder(int root, List<Integer> out) {
        if (root == NIL) return;
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            int n = stack.pop();
            out.add(value[n]);
            if (right[n] != NIL) stack.push(right[n]);
            if (left[n] != NIL) stack.push(left[n]);
        }
    }

    private void inorder(int root, List<Integer> out) {
        Deque<Integer> stack = new ArrayDeque<>();
        int n = root;
        while (n != NIL || !stack.isEmpty()) {
            while (n != NIL) {
                stack.push(n);
                n = left[n];
            }
            n = stack.pop();
            out.add(value[n]);
            n = right[n];
        }
    }

    /** Reversed (node, right, left) preorder. */
    private void postorder(int root, List<Integer> out) {
        if (root == NIL) return;
        Deque<Integer> stack = new ArrayDeque<>();
        Deque<Integer> reversed = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            int n = stack.pop();
            reversed.push(n);
            if (left[n] != NIL) stack.push(left[n]);
            if (right[n] != NIL) stack.push(right[n]);
        }
        while (!reversed.isEmpty()) {
            out.add(value[reversed.pop()]);
        }
    }

    private void levelorder(int root, List<Integer> out) {
        if (root == NIL) return;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            int n = queue.poll();
            out.add(value[n]);
            if (left[n] != NIL) queue.add(left[n]);
            if (right[n] != NIL) queue.add(right[n]);
        }
    }
}
