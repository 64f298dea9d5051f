// file: server/src/main/java/io/structlang/server/dto/WorkspaceJson.java
package io.structlang.server.dto;

/**
 * On-disk shape of a workspace config file. Absent fields stay null and fall
 * back to defaults.
 */
public class WorkspaceJson {
    public String initialContext;
    public String failurePolicy;
    public Boolean recordFailures;
    public Integer maxStatements;
}
