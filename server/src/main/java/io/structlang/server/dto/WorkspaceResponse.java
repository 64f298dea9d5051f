// file: server/src/main/java/io/structlang/server/dto/WorkspaceResponse.java
package io.structlang.server.dto;

import io.structlang.server.interpreter.StructureView;

import java.util.List;

/**
 * JSON response for GET /workspace and PUT /workspace/context.
 *   {
 *     "context": "tree",
 *     "structures": [ { "kind": "avl", "domain": "tree", "size": 3, "contents": [2,1,3], "height": 2, ... } ]
 *   }
 */
public class WorkspaceResponse {
    public String context;
    public List<StructureView> structures;
}
