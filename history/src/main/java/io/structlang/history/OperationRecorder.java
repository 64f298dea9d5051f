// file: history/src/main/java/io/structlang/history/OperationRecorder.java
package io.structlang.history;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * In-memory {@link OperationLog}.
 * <p>
 * Design:
 *  - a single list in append order; sequence numbers are list positions + 1,
 *    and the merged view orders by them rather than by wall-clock time,
 *  - boundaries are found by scanning backwards on each read; the log is
 *    expected to stay small (one interactive session),
 *  - the clock is injected so tests can pin timestamps.
 * All methods are synchronized; reads return immutable snapshots.
 */
public final class OperationRecorder implements OperationLog {

    private static final Logger log = Logger.getLogger(OperationRecorder.class.getName());

    private final Clock clock;
    private final List<HistoryEntry> entries = new ArrayList<>();
    private boolean closed;

    public OperationRecorder() {
        this(Clock.systemDefaultZone());
    }

    public OperationRecorder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Clock clock() {
        return clock;
    }

    @Override
    public HistoryEntry record(String commandText, HistoryContext context, boolean success) {
        Objects.requireNonNull(commandText, "commandText");
        Objects.requireNonNull(context, "context");
        return record(commandText, context, success, looksLikeBoundary(commandText.strip(), context));
    }

    @Override
    public synchronized HistoryEntry record(String commandText, HistoryContext context, boolean success, boolean boundary) {
        Objects.requireNonNull(commandText, "commandText");
        Objects.requireNonNull(context, "context");
        if (closed) {
            throw new IllegalStateException("operation log is closed");
        }
        String text = commandText.strip();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("commandText must not be blank");
        }
        HistoryEntry e = new HistoryEntry(entries.size() + 1L, text, clock.instant(), context, success, boundary);
        entries.add(e);
        return e;
    }

    @Override
    public synchronized List<HistoryEntry> history(HistoryContext context) {
        if (context == HistoryContext.GLOBAL) {
            throw new IllegalArgumentException("history view needs linear or tree; use mergedHistory()");
        }
        long since = boundaryOf(context);
        List<HistoryEntry> out = new ArrayList<>();
        HistoryEntry clear = lastGlobalClear();
        if (clear != null && since > 0 && clear.sequence() >= since) {
            out.add(clear);
        }
        collect(context, since, out);
        return List.copyOf(out);
    }

    @Override
    public synchronized List<HistoryEntry> mergedHistory() {
        long sinceLinear = boundaryOf(HistoryContext.LINEAR);
        long sinceTree = boundaryOf(HistoryContext.TREE);
        List<HistoryEntry> out = new ArrayList<>();
        collect(HistoryContext.LINEAR, sinceLinear, out);
        collect(HistoryContext.TREE, sinceTree, out);

        // every entry kept above is newer than the last global clear
        HistoryEntry clear = lastGlobalClear();
        if (clear != null) {
            out.add(clear);
        }
        out.sort(Comparator.comparingLong(HistoryEntry::sequence));
        return List.copyOf(out);
    }

    @Override
    public synchronized List<HistoryEntry> entries() {
        return List.copyOf(entries);
    }

    @Override
    public synchronized void close() {
        if (!closed) {
            closed = true;
            log.fine(() -> "operation log closed after " + entries.size() + " entries");
        }
    }

    // ---------- helpers ----------

    /** Sequence of the latest boundary for {@code context}, or 0 when there is none. */
    private long boundaryOf(HistoryContext context) {
        long local = 0;
        for (int i = entries.size() - 1; i >= 0; i--) {
            HistoryEntry e = entries.get(i);
            if (e.context() == context && e.isEffectiveBoundary()) {
                local = e.sequence();
                break;
            }
        }
        HistoryEntry clear = lastGlobalClear();
        return Math.max(local, clear == null ? 0 : clear.sequence());
    }

    private HistoryEntry lastGlobalClear() {
        for (int i = entries.size() - 1; i >= 0; i--) {
            HistoryEntry e = entries.get(i);
            if (e.context() == HistoryContext.GLOBAL && e.isEffectiveBoundary()) {
                return e;
            }
        }
        return null;
    }

    private void collect(HistoryContext context, long since, List<HistoryEntry> out) {
        for (HistoryEntry e : entries) {
            if (e.context() == context && e.success() && e.sequence() >= since) {
                out.add(e);
            }
        }
    }

    static boolean looksLikeBoundary(String text, HistoryContext context) {
        if (context == HistoryContext.GLOBAL) {
            return text.equals("clear") || text.startsWith("clear ");
        }
        return text.startsWith("create ") || text.equals("create")
                || text.startsWith("build ")
                || text.matches("tree\\.[a-z_]+\\.create\\b.*");
    }
}
