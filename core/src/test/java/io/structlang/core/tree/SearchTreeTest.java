// file: core/src/test/java/io/structlang/core/tree/SearchTreeTest.java
package io.structlang.core.tree;

import io.structlang.core.ErrorKind;
import io.structlang.core.StructureException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SearchTreeTest {

    @Test
    void inorder_is_sorted_for_random_builds() {
        var rnd = new Random(7);
        for (int round = 0; round < 50; round++) {
            List<Integer> values = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                values.add(rnd.nextInt(200) - 100);
            }
            var bst = new SearchTree();
            bst.build(values);

            assertEquals(new ArrayList<>(new TreeSet<>(values)), bst.traverse(Traversal.INORDER));
        }
    }

    @Test
    void build_order_shapes_tree_and_skips_duplicates() {
        var bst = new SearchTree();
        var skipped = bst.build(List.of(50, 30, 70, 20, 40, 30));

        assertEquals(List.of(30), skipped);
        assertEquals(List.of(50, 30, 20, 40, 70), bst.traverse(Traversal.PREORDER));
        assertEquals(5, bst.size());
    }

    @Test
    void duplicate_insert_is_rejected_without_change() {
        var bst = new SearchTree();
        bst.build(List.of(5, 3));
        var ex = assertThrows(StructureException.class, () -> bst.insert(3));
        assertEquals(ErrorKind.DUPLICATE, ex.kind());
        assertEquals(2, bst.size());
    }

    @Test
    void search_reports_compared_values() {
        var bst = new SearchTree();
        bst.build(List.of(50, 30, 70, 20, 40));

        var hit = bst.search(40);
        assertTrue(hit.found());
        assertEquals(List.of(50, 30, 40), hit.visited());

        var miss = bst.search(65);
        assertFalse(miss.found());
        assertEquals(List.of(50, 70), miss.visited());
    }

    @Test
    void delete_covers_leaf_single_child_and_two_children() {
        var bst = new SearchTree();
        bst.build(List.of(50, 30, 70, 20, 40, 60, 80, 65));

        bst.delete(20);   // leaf
        bst.delete(60);   // single (right) child
        bst.delete(50);   // two children: successor 65 moves up

        assertEquals(List.of(30, 40, 65, 70, 80), bst.traverse(Traversal.INORDER));
        assertEquals(65, bst.traverse(Traversal.PREORDER).get(0));
        assertEquals(5, bst.size());
    }

    @Test
    void delete_missing_value_fails() {
        var bst = new SearchTree();
        bst.build(List.of(1));
        assertEquals(ErrorKind.DELETE, assertThrows(StructureException.class, () -> bst.delete(2)).kind());
    }

    @Test
    void sorted_input_builds_a_deep_chain_that_still_works() {
        int n = 100_000;
        List<Integer> ascending = IntStream.rangeClosed(1, n).boxed().collect(Collectors.toList());
        var bst = new SearchTree();

        assertTrue(bst.build(ascending).isEmpty());
        assertEquals(n, bst.height());
        assertEquals(ascending, bst.traverse(Traversal.INORDER));
        assertEquals(ascending, bst.traverse(Traversal.PREORDER));
        assertEquals(n, bst.traverse(Traversal.POSTORDER).get(0));
        assertEquals(1, bst.traverse(Traversal.POSTORDER).get(n - 1));

        var search = bst.search(n);
        assertTrue(search.found());
        assertEquals(n, search.visited().size());

        bst.delete(1);      // root with a right child only
        bst.delete(n);      // deepest leaf
        bst.delete(n / 2);  // middle of the chain
        assertEquals(n - 3, bst.size());
        assertEquals(n - 3, bst.height());
        assertEquals(2, bst.traverse(Traversal.LEVELORDER).get(0));
        assertEquals(n - 3, new TreeSet<>(bst.traverse(Traversal.INORDER)).size());
    }
}
