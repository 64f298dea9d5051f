// file: server/src/test/java/io/structlang/server/WorkspaceConfigJsonTest.java
package io.structlang.server;

import io.structlang.core.Domain;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies workspace settings can be loaded from JSON and overridden from the command line.
 */
class WorkspaceConfigJsonTest {

    @TempDir
    Path tmp;

    @Test
    void loads_all_fields_from_json() throws Exception {
        String json = """
                {
                  "initialContext": "tree",
                  "failurePolicy": "continue",
                  "recordFailures": false,
                  "maxStatements": 50
                }
                """;
        Path cfgPath = tmp.resolve("workspace.json");
        Files.writeString(cfgPath, json);

        WorkspaceConfig cfg = WorkspaceConfig.fromJsonFile(cfgPath);

        assertEquals(Domain.TREE, cfg.initialContext());
        assertEquals(FailurePolicy.CONTINUE, cfg.failurePolicy());
        assertFalse(cfg.recordFailures());
        assertEquals(50, cfg.maxStatements());
    }

    @Test
    void missing_fields_fall_back_to_defaults() throws Exception {
        Path cfgPath = tmp.resolve("partial.json");
        Files.writeString(cfgPath, "{ \"failurePolicy\": \"CONTINUE\" }");

        WorkspaceConfig cfg = WorkspaceConfig.fromJsonFile(cfgPath);

        assertEquals(Domain.LINEAR, cfg.initialContext());
        assertEquals(FailurePolicy.CONTINUE, cfg.failurePolicy());
        assertTrue(cfg.recordFailures());
        assertEquals(WorkspaceConfig.DEFAULT_MAX_STATEMENTS, cfg.maxStatements());
    }

    @Test
    void command_line_overrides_win() throws Exception {
        Path cfgPath = tmp.resolve("workspace.json");
        Files.writeString(cfgPath, "{ \"initialContext\": \"linear\", \"failurePolicy\": \"abort\" }");

        var server = new ServerConfig(8080, "tree", null, cfgPath.toString());
        WorkspaceConfig cfg = server.workspaceConfig();

        assertEquals(Domain.TREE, cfg.initialContext());
        assertEquals(FailurePolicy.ABORT, cfg.failurePolicy());
    }

    @Test
    void bad_values_are_rejected() throws Exception {
        Path cfgPath = tmp.resolve("bad.json");
        Files.writeString(cfgPath, "{ \"initialContext\": \"graph\" }");

        assertThrows(IllegalArgumentException.class, () -> WorkspaceConfig.fromJsonFile(cfgPath));
        assertThrows(IllegalArgumentException.class, () -> WorkspaceConfig.defaults().withOverrides(null, "retry"));
        assertThrows(RuntimeException.class, () -> WorkspaceConfig.fromJsonFile(tmp.resolve("missing.json")));
    }
}
