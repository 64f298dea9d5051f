// file: server/src/main/java/io/structlang/server/dto/ScriptResponse.java
package io.structlang.server.dto;

import java.util.List;

/**
 * JSON response for POST /scripts.
 *   {
 *     "aborted": false,
 *     "skipped": 0,
 *     "outcomes": [
 *       { "line": 1, "statement": "get at 0 from arraylist", "ok": true,
 *         "errorKind": null, "message": "position 0 holds 1", "data": 1 }
 *     ]
 *   }
 */
public class ScriptResponse {
    public boolean aborted;
    public int skipped;
    public List<StatementResult> outcomes;

    public static class StatementResult {
        public int line;
        public String statement;
        public boolean ok;
        public String errorKind;   // null when ok
        public String message;
        public Object data;        // null when the statement returns nothing
    }
}
