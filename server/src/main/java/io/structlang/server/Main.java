// file: server/src/main/java/io/structlang/server/Main.java
package io.structlang.server;

import io.structlang.history.OperationRecorder;

import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for the structlang server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and the optional JSON config file).
 *  - Wire the operation log, script service and HTTP layer.
 *  - Close the operation log when the process shuts down.
 */
public final class Main {

    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);
        WorkspaceConfig workspaceConfig = cfg.workspaceConfig();

        var recorder = new OperationRecorder();
        var scripts = new ScriptService(workspaceConfig, recorder);
        var web = new WebServer(cfg.httpPort(), scripts);

        web.start();
        System.out.printf(
                "structlang listening on http://%s:%d (context=%s, policy=%s)%n",
                "localhost", cfg.httpPort(),
                workspaceConfig.initialContext().wireName(),
                workspaceConfig.failurePolicy().name().toLowerCase(Locale.ROOT)
        );

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "error stopping HTTP server", e);
            } finally {
                recorder.close();
            }
        }));
    }
}
