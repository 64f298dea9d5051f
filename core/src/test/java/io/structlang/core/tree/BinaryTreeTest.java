// file: core/src/test/java/io/structlang/core/tree/BinaryTreeTest.java
package io.structlang.core.tree;

import io.structlang.core.ErrorKind;
import io.structlang.core.StructureException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for the path-addressed binary tree.
 *
 * Focus:
 *  - level-order build shape,
 *  - path insert needs every prefix to exist and an empty final slot,
 *  - delete removes whole subtrees and leaves the tree unchanged on failure.
 */
class BinaryTreeTest {

    @Test
    void build_fills_level_order() {
        var tree = new BinaryTree(List.of(1, 2, 3, 4, 5, 6));

        assertEquals(List.of(1, 2, 3, 4, 5, 6), tree.traverse(Traversal.LEVELORDER));
        assertEquals(List.of(1, 2, 4, 5, 3, 6), tree.traverse(Traversal.PREORDER));
        assertEquals(List.of(4, 2, 5, 1, 6, 3), tree.traverse(Traversal.INORDER));
        assertEquals(List.of(4, 5, 2, 6, 3, 1), tree.traverse(Traversal.POSTORDER));
        assertEquals(3, tree.height());
    }

    @Test
    void insert_at_path_requires_existing_prefix() {
        var tree = new BinaryTree(List.of(1, 2, 3));

        tree.insertAt(6, List.of(0, 1));
        assertEquals(6, tree.valueAt(List.of(0, 1)));
        assertEquals(4, tree.size());

        var ex = assertThrows(StructureException.class, () -> tree.insertAt(7, List.of(0, 0, 1)));
        assertEquals(ErrorKind.INVALID_PATH, ex.kind());
        assertEquals(4, tree.size());
    }

    @Test
    void insert_at_occupied_slot_fails() {
        var tree = new BinaryTree(List.of(1, 2, 3));
        var ex = assertThrows(StructureException.class, () -> tree.insertAt(9, List.of(1)));
        assertEquals(ErrorKind.INVALID_PATH, ex.kind());
        assertEquals(List.of(1, 2, 3), tree.traverse(Traversal.LEVELORDER));
    }

    @Test
    void insert_without_path_takes_next_level_order_slot() {
        var tree = new BinaryTree(List.of(1, 2, 3));
        tree.deleteAt(List.of(0), null);
        tree.insert(8);

        assertEquals(8, tree.valueAt(List.of(0)));
    }

    @Test
    void path_delete_removes_subtree() {
        var tree = new BinaryTree(List.of(1, 2, 3, 4, 5));
        assertEquals(3, tree.deleteAt(List.of(0), 2));

        assertEquals(List.of(1, 3), tree.traverse(Traversal.LEVELORDER));
        assertEquals(2, tree.size());
    }

    @Test
    void path_delete_checks_expected_value() {
        var tree = new BinaryTree(List.of(1, 2, 3));
        var ex = assertThrows(StructureException.class, () -> tree.deleteAt(List.of(1), 2));
        assertEquals(ErrorKind.INVALID_PATH, ex.kind());
        assertEquals(3, tree.size());
    }

    @Test
    void value_delete_uses_first_level_order_match() {
        var tree = new BinaryTree(List.of(1, 7, 7, 4));
        assertEquals(2, tree.delete(7));

        assertEquals(List.of(1, 7), tree.traverse(Traversal.LEVELORDER));
        assertEquals(ErrorKind.DELETE, assertThrows(StructureException.class, () -> tree.delete(42)).kind());
    }

    @Test
    void deleting_root_empties_tree() {
        var tree = new BinaryTree(List.of(1, 2, 3));
        assertEquals(3, tree.deleteAt(List.of(), null));
        assertEquals(0, tree.size());
        assertEquals(List.of(), tree.traverse(Traversal.INORDER));

        tree.insert(5);
        assertEquals(List.of(5), tree.traverse(Traversal.LEVELORDER));
    }

    @Test
    void traversal_is_restartable() {
        var tree = new BinaryTree(List.of(3, 1, 2));
        assertEquals(tree.traverse(Traversal.POSTORDER), tree.traverse(Traversal.POSTORDER));
    }
}
