// file: history/src/test/java/io/structlang/history/OperationRecorderTest.java
package io.structlang.history;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static io.structlang.history.HistoryContext.GLOBAL;
import static io.structlang.history.HistoryContext.LINEAR;
import static io.structlang.history.HistoryContext.TREE;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for boundary-based history retrieval.
 *
 * Goal is to validate:
 *  - a context view starts at its latest create/build or global clear,
 *  - failed entries are kept in the log but never shown,
 *  - the merged view interleaves contexts in recording order with the last
 *    global clear as its own row.
 */
class OperationRecorderTest {

    private final OperationRecorder recorder =
            new OperationRecorder(Clock.fixed(Instant.parse("2024-03-01T09:30:00Z"), ZoneOffset.UTC));

    private static List<String> texts(List<HistoryEntry> entries) {
        return entries.stream().map(HistoryEntry::commandText).toList();
    }

    @Test
    void history_restarts_after_clear_and_recreate() {
        recorder.record("create arraylist with 1,2,3", LINEAR, true);
        recorder.record("insert 4 at 0 in arraylist", LINEAR, true);
        recorder.record("clear", GLOBAL, true);
        recorder.record("create arraylist with 9", LINEAR, true);
        recorder.record("get at 0 from arraylist", LINEAR, true);

        assertEquals(List.of("create arraylist with 9", "get at 0 from arraylist"), texts(recorder.history(LINEAR)));
    }

    @Test
    void global_clear_heads_the_view_when_it_is_the_boundary() {
        recorder.record("create stack with 1", LINEAR, true);
        recorder.record("clear", GLOBAL, true);
        recorder.record("create bst", TREE, true);

        assertEquals(List.of("clear"), texts(recorder.history(LINEAR)));
        assertEquals(List.of("create bst"), texts(recorder.history(TREE)));
    }

    @Test
    void context_boundaries_are_independent() {
        recorder.record("create arraylist", LINEAR, true);
        recorder.record("build bst with 5,3", TREE, true);
        recorder.record("insert 1 at 0 in arraylist", LINEAR, true);
        recorder.record("tree.bst.create 7,8", TREE, true);
        recorder.record("tree.bst.insert 9", TREE, true);

        assertEquals(List.of("create arraylist", "insert 1 at 0 in arraylist"), texts(recorder.history(LINEAR)));
        assertEquals(List.of("tree.bst.create 7,8", "tree.bst.insert 9"), texts(recorder.history(TREE)));
    }

    @Test
    void failed_entries_are_logged_but_hidden_and_never_boundaries() {
        recorder.record("create linkedlist with 1", LINEAR, true);
        recorder.record("create linkedlist with x", LINEAR, false);
        recorder.record("delete 5 from linkedlist", LINEAR, false);

        assertEquals(List.of("create linkedlist with 1"), texts(recorder.history(LINEAR)));
        assertEquals(3, recorder.entries().size());
        assertFalse(recorder.entries().get(1).success());
    }

    @Test
    void local_clear_is_not_a_boundary() {
        recorder.record("create stack", LINEAR, true);
        recorder.record("clear stack", LINEAR, true);
        recorder.record("create arraylist", LINEAR, true, true);

        assertEquals(List.of("create arraylist"), texts(recorder.history(LINEAR)));
        assertFalse(recorder.entries().get(1).boundary());
    }

    @Test
    void merged_view_interleaves_in_recording_order() {
        recorder.record("create arraylist", LINEAR, true);
        recorder.record("clear", GLOBAL, true);
        recorder.record("create arraylist with 1", LINEAR, true);
        recorder.record("build avl with 3,2,1", TREE, true);
        recorder.record("insert 5 at 1 in arraylist", LINEAR, true);
        recorder.record("search 2 in avl", TREE, true);

        var merged = recorder.mergedHistory();
        assertEquals(List.of(
                "clear",
                "create arraylist with 1",
                "build avl with 3,2,1",
                "insert 5 at 1 in arraylist",
                "search 2 in avl"
        ), texts(merged));
        assertEquals(GLOBAL, merged.get(0).context());
        assertEquals(TREE, merged.get(2).context());
    }

    @Test
    void empty_log_has_empty_views() {
        assertTrue(recorder.history(LINEAR).isEmpty());
        assertTrue(recorder.mergedHistory().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> recorder.history(GLOBAL));
    }

    @Test
    void closed_log_rejects_appends() {
        recorder.record("create stack", LINEAR, true);
        recorder.close();

        assertThrows(IllegalStateException.class, () -> recorder.record("pop from stack", LINEAR, true));
        assertEquals(1, recorder.entries().size());
    }

    @Test
    void sequences_increase_and_timestamps_come_from_clock() {
        var a = recorder.record("create stack", LINEAR, true);
        var b = recorder.record("push 1 to stack", LINEAR, true);

        assertTrue(b.sequence() > a.sequence());
        assertEquals(Instant.parse("2024-03-01T09:30:00Z"), b.timestamp());
    }
}
