// file: server/src/main/java/io/structlang/server/dto/ScriptRequest.java
package io.structlang.server.dto;

/**
 * JSON body for POST /scripts.
 * Example:
 *   {
 *     "script": "create arraylist with 1,2,3; get at 0 from arraylist",
 *     "context": "linear"
 *   }
 * context is optional; when absent the workspace keeps its active context.
 */
public class ScriptRequest {
    public String script;
    public String context;
}
