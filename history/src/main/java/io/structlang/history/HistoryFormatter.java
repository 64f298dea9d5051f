// file: history/src/main/java/io/structlang/history/HistoryFormatter.java
package io.structlang.history;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Renders history views as text, one {@code HH:mm:ss [ctx] command} line per
 * entry. The {@code [ctx]} tag is only written for merged views.
 */
public final class HistoryFormatter {

    private final DateTimeFormatter time;

    public HistoryFormatter(ZoneId zone) {
        this.time = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(Objects.requireNonNull(zone, "zone"));
    }

    public String format(List<HistoryEntry> entries, boolean tagged) {
        StringBuilder sb = new StringBuilder();
        for (HistoryEntry e : entries) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(time.format(e.timestamp())).append(' ');
            if (tagged) {
                sb.append('[').append(e.context().wireName()).append("] ");
            }
            sb.append(e.commandText());
        }
        return sb.toString();
    }
}
