// file: history/src/main/java/io/structlang/history/OperationLog.java
package io.structlang.history;

import java.util.List;

/**
 * Append-only log of executed statements.
 * <p>
 * Contract:
 *  - entries are never edited or removed; views truncate on read only,
 *  - views contain successful entries only, oldest first,
 *  - a single-context view starts at that context's latest boundary: the
 *    later of its last create/build and the last global clear (the clear is
 *    included as the first row when it is that boundary),
 *  - the merged view interleaves linear and tree entries, each since its own
 *    boundary, plus the last global clear as a row tagged GLOBAL.
 * <p>
 * A log is owned by its host and closed with it; recording into a closed log
 * fails with IllegalStateException.
 */
public interface OperationLog extends AutoCloseable {

    /**
     * Append an entry, detecting boundaries from the text: a statement that
     * starts with {@code create}/{@code build} (or {@code tree.<x>.create})
     * in LINEAR/TREE, or any {@code clear} in GLOBAL.
     */
    HistoryEntry record(String commandText, HistoryContext context, boolean success);

    /** Append an entry with an explicit boundary flag. */
    HistoryEntry record(String commandText, HistoryContext context, boolean success, boolean boundary);

    /** View of LINEAR or TREE since its boundary. */
    List<HistoryEntry> history(HistoryContext context);

    /** Chronological view across both domains. */
    List<HistoryEntry> mergedHistory();

    /** Every entry ever recorded, failed ones included. */
    List<HistoryEntry> entries();

    @Override
    void close();
}
