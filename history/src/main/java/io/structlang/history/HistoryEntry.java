// file: history/src/main/java/io/structlang/history/HistoryEntry.java
package io.structlang.history;

import java.time.Instant;
import java.util.Objects;

/**
 * One recorded statement.
 * <p>
 * Fields:
 *  - sequence:    position in the log, strictly increasing; ties in timestamp
 *                 are ordered by it,
 *  - commandText: statement as executed (trimmed),
 *  - timestamp:   recorder clock at append time,
 *  - context:     linear, tree, or global,
 *  - success:     whether the statement was applied,
 *  - boundary:    create/build in its context, or global clear; only counts
 *                 when success is true.
 */
public record HistoryEntry(
        long sequence,
        String commandText,
        Instant timestamp,
        HistoryContext context,
        boolean success,
        boolean boundary
) {
    public HistoryEntry {
        Objects.requireNonNull(commandText, "commandText");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(context, "context");
    }

    boolean isEffectiveBoundary() {
        return success && boundary;
    }
}
