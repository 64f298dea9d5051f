// file: server/src/main/java/io/structlang/server/WorkspaceConfig.java
package io.structlang.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.structlang.core.Domain;
import io.structlang.server.dto.WorkspaceJson;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Interpreter settings for one workspace.
 *
 * Fields:
 *  - initialContext:  domain active at startup,
 *  - failurePolicy:   abort or continue after a failed statement,
 *  - recordFailures:  whether failed statements enter the operation log,
 *  - maxStatements:   upper bound on statements per script.
 */
public final class WorkspaceConfig {

    public static final int DEFAULT_MAX_STATEMENTS = 10_000;

    private final Domain initialContext;
    private final FailurePolicy failurePolicy;
    private final boolean recordFailures;
    private final int maxStatements;

    public WorkspaceConfig(Domain initialContext, FailurePolicy failurePolicy, boolean recordFailures, int maxStatements) {
        if (maxStatements <= 0) throw new IllegalArgumentException("maxStatements must be > 0");
        this.initialContext = Objects.requireNonNull(initialContext, "initialContext");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.recordFailures = recordFailures;
        this.maxStatements = maxStatements;
    }

    public static WorkspaceConfig defaults() {
        return new WorkspaceConfig(Domain.LINEAR, FailurePolicy.ABORT, true, DEFAULT_MAX_STATEMENTS);
    }

    public static WorkspaceConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            WorkspaceJson cfg = mapper.readValue(path.toFile(), WorkspaceJson.class);
            WorkspaceConfig d = defaults();
            return new WorkspaceConfig(
                    cfg.initialContext == null ? d.initialContext : parseContext(cfg.initialContext),
                    cfg.failurePolicy == null ? d.failurePolicy : FailurePolicy.fromName(cfg.failurePolicy),
                    cfg.recordFailures == null ? d.recordFailures : cfg.recordFailures,
                    cfg.maxStatements == null ? d.maxStatements : cfg.maxStatements
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load WorkspaceConfig from " + path, e);
        }
    }

    /** Applies CLI overrides; null arguments keep the current value. */
    public WorkspaceConfig withOverrides(String context, String policy) {
        return new WorkspaceConfig(
                context == null ? initialContext : parseContext(context),
                policy == null ? failurePolicy : FailurePolicy.fromName(policy),
                recordFailures,
                maxStatements
        );
    }

    public static Domain parseContext(String name) {
        return Domain.fromWireName(name.trim())
                .orElseThrow(() -> new IllegalArgumentException("context must be linear or tree, got '" + name + "'"));
    }

    public Domain initialContext() {
        return initialContext;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    public boolean recordFailures() {
        return recordFailures;
    }

    public int maxStatements() {
        return maxStatements;
    }
}
