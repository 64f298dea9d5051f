// file: server/src/main/java/io/structlang/server/dto/ContextRequest.java
package io.structlang.server.dto;

/** JSON body for PUT /workspace/context: {@code {"context": "tree"}}. */
public class ContextRequest {
    public String context;
}
