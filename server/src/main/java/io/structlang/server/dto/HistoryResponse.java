// file: server/src/main/java/io/structlang/server/dto/HistoryResponse.java
package io.structlang.server.dto;

import java.util.List;

/**
 * JSON response for GET /history?view=linear|tree|merged.
 * text is the same view rendered as {@code HH:mm:ss [ctx] command} lines.
 */
public class HistoryResponse {
    public String view;
    public List<Entry> entries;
    public String text;

    public static class Entry {
        public long sequence;
        public String timestamp;   // ISO-8601 instant
        public String context;
        public String command;
        public boolean success;
    }
}
