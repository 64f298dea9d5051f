// file: server/src/test/java/io/structlang/server/interpreter/CommandExecutorTest.java
package io.structlang.server.interpreter;

import io.structlang.core.Domain;
import io.structlang.core.ErrorKind;
import io.structlang.core.StructureKind;
import io.structlang.core.tree.SearchResult;
import io.structlang.lang.CommandParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for statement execution against a workspace.
 *
 * Focus:
 *  - every verb reaches the right engine and returns its data,
 *  - failures come back as Outcomes with the engine's error kind,
 *  - a failed statement leaves the workspace exactly as it was.
 */
class CommandExecutorTest {

    private final CommandParser parser = new CommandParser();
    private final Workspace linear = new Workspace(Domain.LINEAR);
    private final Workspace tree = new Workspace(Domain.TREE);

    private Outcome run(Workspace ws, String statement) {
        var parsed = parser.parse(statement);
        assertTrue(parsed.isOk(), () -> parsed.error().message());
        return new CommandExecutor(ws).execute(parsed.command());
    }

    private Outcome ok(Workspace ws, String statement) {
        Outcome o = run(ws, statement);
        assertTrue(o.ok(), () -> statement + " -> " + o);
        return o;
    }

    private ErrorKind failure(Workspace ws, String statement) {
        Outcome o = run(ws, statement);
        assertFalse(o.ok(), () -> statement + " unexpectedly succeeded");
        return o.errorKind();
    }

    @Test
    void arraylist_insert_get_delete_flow() {
        ok(linear, "create arraylist with 1,2,3");
        ok(linear, "insert 100 at 0 in arraylist");
        assertEquals(100, ok(linear, "get at 0 from arraylist").data());

        ok(linear, "delete 3 from arraylist");
        assertEquals(ErrorKind.NOT_FOUND, failure(linear, "get 3 from arraylist"));
        assertEquals(List.of(100, 1, 2), StructureView.of(linear.find(StructureKind.ARRAYLIST).orElseThrow()).contents());
    }

    @Test
    void index_error_leaves_list_unchanged() {
        ok(linear, "create linkedlist with 5,6");
        assertEquals(ErrorKind.INDEX, failure(linear, "insert 1 at 9 in linkedlist"));
        assertEquals(ErrorKind.INDEX, failure(linear, "delete at 2 from linkedlist"));
        assertEquals(ErrorKind.DELETE, failure(linear, "delete 42 from linkedlist"));

        assertEquals(List.of(5, 6), StructureView.of(linear.find(StructureKind.LINKEDLIST).orElseThrow()).contents());
    }

    @Test
    void arraylist_capacity_is_enforced() {
        ok(linear, "create arraylist with 1,2 size 2");
        assertEquals(ErrorKind.CAPACITY, failure(linear, "insert 3 at 2 in arraylist"));
    }

    @Test
    void stack_verbs() {
        ok(linear, "create stack");
        assertEquals(ErrorKind.EMPTY, failure(linear, "pop from stack"));
        ok(linear, "push 1 to stack");
        ok(linear, "push 2 to stack");
        assertEquals(2, ok(linear, "peek stack").data());
        assertEquals(2, ok(linear, "pop from stack").data());
        assertEquals(1, ok(linear, "peek from stack").data());
    }

    @Test
    void binary_tree_path_operations() {
        assertEquals(ErrorKind.PRECONDITION, failure(tree, "insert 6 at 0,1 in binarytree"));

        ok(tree, "create binarytree with 1,2,3");
        ok(tree, "insert 6 at 0,1 in binarytree");
        assertEquals(ErrorKind.INVALID_PATH, failure(tree, "insert 7 at 1,1,0 in binarytree"));
        assertEquals(List.of(1, 2, 3, 6), ok(tree, "traverse levelorder").data());

        assertEquals(ErrorKind.INVALID_PATH, failure(tree, "delete 9 at 0 from binarytree"));
        assertEquals(2, ok(tree, "delete 2 at 0 from binarytree").data());
        assertEquals(List.of(1, 3), ok(tree, "tree.binary_tree.traverse inorder").data());
    }

    @Test
    void bst_build_search_and_duplicate() {
        var built = ok(tree, "build bst with 50,30,70,30");
        assertTrue(built.message().contains("skipped duplicates [30]"));
        assertInstanceOf(Map.class, built.data());

        var search = (SearchResult) ok(tree, "search 70 in bst").data();
        assertTrue(search.found());
        assertEquals(List.of(50, 70), search.visited());

        assertEquals(ErrorKind.DUPLICATE, failure(tree, "tree.bst.insert 70"));
        ok(tree, "tree.bst.remove 70");
        assertFalse(((SearchResult) ok(tree, "search 70 in bst").data()).found());
    }

    @Test
    void avl_reports_rotations() {
        ok(tree, "build avl with 30,20");
        assertEquals(List.of("right at 30"), ok(tree, "insert 10 in avl").data());
        assertEquals(List.of(), ok(tree, "insert 40 in avl").data());
    }

    @Test
    void huffman_round_trip_and_errors() {
        ok(tree, "build huffman with a:5,b:9,c:12,d:13,e:16,f:45");
        String bits = (String) ok(tree, "encode \"face\" using huffman").data();
        assertEquals("face", ok(tree, "decode " + bits + " using huffman").data());

        String a = (String) ok(tree, "encode \"a\" using huffman").data();
        String f = (String) ok(tree, "encode \"f\" using huffman").data();
        assertTrue(a.length() >= f.length());

        assertEquals(ErrorKind.UNKNOWN_CHARACTER, failure(tree, "encode \"xyz\" using huffman"));
        assertEquals(ErrorKind.DECODE, failure(tree, "decode 012 using huffman"));
        assertEquals(ErrorKind.DECODE, failure(tree, "decode 1 using huffman"));
    }

    @Test
    void failed_rebuild_keeps_previous_instance() {
        ok(tree, "build huffman with a:1,b:2");
        assertEquals(ErrorKind.DUPLICATE, failure(tree, "build huffman with a:1,a:2"));
        assertEquals("1", ok(tree, "encode \"b\" using huffman").data());
    }

    @Test
    void clears() {
        ok(linear, "create stack");
        ok(linear, "create arraylist");
        ok(linear, "clear stack");
        assertFalse(linear.contains(StructureKind.STACK));
        assertTrue(linear.contains(StructureKind.ARRAYLIST));

        ok(linear, "clear");
        assertTrue(linear.structures().isEmpty());
    }

    @Test
    void unsupported_and_context_errors_come_from_validator() {
        ok(tree, "create binarytree");
        assertEquals(ErrorKind.UNSUPPORTED_OPERATION, failure(tree, "search 1 in binarytree"));
        assertEquals(ErrorKind.CONTEXT, failure(tree, "create arraylist"));
    }

    @Test
    void sorted_bst_build_of_100000_values_returns_an_outcome() {
        String values = IntStream.rangeClosed(1, 100_000).mapToObj(Integer::toString).collect(Collectors.joining(","));

        Outcome built = ok(tree, "build bst with " + values);
        StructureView view = (StructureView) built.data();
        assertEquals(100_000, view.size());
        assertEquals(100_000, view.height());
        assertEquals(1, view.contents().get(0));

        var search = (SearchResult) ok(tree, "search 100000 in bst").data();
        assertTrue(search.found());
        assertEquals(100_000, search.visited().size());

        ok(tree, "tree.bst.remove 1");
        assertEquals(ErrorKind.DUPLICATE, failure(tree, "tree.bst.insert 99999"));
    }

    @Test
    void every_linear_kind_rejects_non_positive_size() {
        assertEquals(ErrorKind.INVALID_ARGUMENT, failure(linear, "create stack size -5"));
        assertEquals(ErrorKind.INVALID_ARGUMENT, failure(linear, "create linkedlist size 0"));
        assertEquals(ErrorKind.INVALID_ARGUMENT, failure(linear, "create arraylist size 0"));
        assertTrue(linear.structures().isEmpty());
    }
}
