// file: server/src/main/java/io/structlang/server/WebServer.java
package io.structlang.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.structlang.core.Domain;
import io.structlang.history.HistoryContext;
import io.structlang.history.HistoryEntry;
import io.structlang.history.HistoryFormatter;
import io.structlang.server.dto.ContextRequest;
import io.structlang.server.dto.HistoryResponse;
import io.structlang.server.dto.ScriptRequest;
import io.structlang.server.dto.ScriptResponse;
import io.structlang.server.dto.WorkspaceResponse;
import io.structlang.server.interpreter.Outcome;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over {@link ScriptService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST /scripts              Run a script; 200 even when statements fail
 *   - GET  /history?view=...     linear | tree | merged (default merged)
 *   - GET  /workspace            Active context + structure views
 *   - PUT  /workspace/context    Switch the active context
 *   - GET  /admin/health         Basic health check
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ScriptService scripts;
    private final HistoryFormatter formatter;

    public WebServer(int port, ScriptService scripts) {
        this(port, scripts, new HistoryFormatter(ZoneId.systemDefault()));
    }

    public WebServer(int port, ScriptService scripts, HistoryFormatter formatter) {
        this.scripts = scripts;
        this.formatter = formatter;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    switch (path) {
                        case "/scripts" -> {
                            if ("POST".equals(method)) handleRunScript(exchange);
                            else methodNotAllowed(exchange, method, path);
                        }
                        case "/history" -> {
                            if ("GET".equals(method)) handleHistory(exchange);
                            else methodNotAllowed(exchange, method, path);
                        }
                        case "/workspace" -> {
                            if ("GET".equals(method)) handleWorkspace(exchange);
                            else methodNotAllowed(exchange, method, path);
                        }
                        case "/workspace/context" -> {
                            if ("PUT".equals(method)) handleSwitchContext(exchange);
                            else methodNotAllowed(exchange, method, path);
                        }
                        case "/admin/health" -> {
                            send(exchange, 200, Map.of("status", "ok"));
                            RequestLogger.logRequest(method, path, 200, 0, -1, null);
                        }
                        default -> {
                            send(exchange, 404, Map.of("error", "not found"));
                            RequestLogger.logRequest(method, path, 404, 0, -1, null);
                        }
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop(); // For tests to stop server
    }

    // ---------- handlers ----------

    /** POST /scripts */
    private void handleRunScript(HttpServerExchange ex) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status;
                    long interpreterMs = -1L;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            var req = json.readValue(data, ScriptRequest.class);
                            if (req.script == null) {
                                throw new IllegalArgumentException("script must not be null");
                            }
                            Domain context = req.context == null ? null : WorkspaceConfig.parseContext(req.context);

                            long iStart = System.nanoTime();
                            ScriptReport report = scripts.run(req.script, context);
                            interpreterMs = (System.nanoTime() - iStart) / 1_000_000L;

                            status = 200;
                            send(exchange, status, toDto(report));
                        }
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", bad.getMessage()));
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, errorBody(e));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest("POST", path, exchange.getStatusCode(), totalMs, interpreterMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), status, 0, -1, ioEx);
                }
        );
    }

    /** GET /history?view=linear|tree|merged */
    private void handleHistory(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            String view = firstOrNull(ex.getQueryParameters().get("view"));
            if (view == null || view.isBlank()) {
                view = "merged";
            }
            List<HistoryEntry> entries;
            boolean merged = view.equals("merged");
            if (merged) {
                entries = scripts.history().mergedHistory();
            } else {
                HistoryContext ctx = HistoryContext.fromWireName(view)
                        .filter(c -> c != HistoryContext.GLOBAL)
                        .orElseThrow(() -> new IllegalArgumentException("view must be linear, tree or merged"));
                entries = scripts.history().history(ctx);
            }

            var dto = new HistoryResponse();
            dto.view = view;
            dto.entries = new ArrayList<>(entries.size());
            for (HistoryEntry e : entries) {
                var row = new HistoryResponse.Entry();
                row.sequence = e.sequence();
                row.timestamp = e.timestamp().toString();
                row.context = e.context().wireName();
                row.command = e.commandText();
                row.success = e.success();
                dto.entries.add(row);
            }
            dto.text = formatter.format(entries, merged);
            send(ex, status, dto);
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", bad.getMessage()));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, errorBody(e));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, -1, error);
        }
    }

    /** GET /workspace */
    private void handleWorkspace(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            send(ex, status, workspaceDto());
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, errorBody(e));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, -1, error);
        }
    }

    /** PUT /workspace/context */
    private void handleSwitchContext(HttpServerExchange ex) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    long start = System.nanoTime();
                    int status;
                    Throwable error = null;
                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            var req = json.readValue(data, ContextRequest.class);
                            if (req.context == null) {
                                throw new IllegalArgumentException("context must not be null");
                            }
                            scripts.switchContext(WorkspaceConfig.parseContext(req.context));
                            status = 200;
                            send(exchange, status, workspaceDto());
                        }
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", bad.getMessage()));
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, errorBody(e));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest("PUT", exchange.getRequestPath(), exchange.getStatusCode(), totalMs, -1, error);
                    }
                },
                (exchange, ioEx) -> {
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("PUT", exchange.getRequestPath(), status, 0, -1, ioEx);
                }
        );
    }

    // ---------- helpers ----------

    private WorkspaceResponse workspaceDto() {
        var dto = new WorkspaceResponse();
        dto.context = scripts.activeContext().wireName();
        dto.structures = scripts.structures();
        return dto;
    }

    private static ScriptResponse toDto(ScriptReport report) {
        var dto = new ScriptResponse();
        dto.aborted = report.aborted();
        dto.skipped = report.skipped();
        dto.outcomes = new ArrayList<>(report.outcomes().size());
        for (StatementOutcome so : report.outcomes()) {
            Outcome o = so.outcome();
            var row = new ScriptResponse.StatementResult();
            row.line = so.line();
            row.statement = so.statement();
            row.ok = o.ok();
            row.errorKind = o.ok() ? null : o.errorKind().wireName();
            row.message = o.message();
            row.data = o.data();
            dto.outcomes.add(row);
        }
        return dto;
    }

    private void methodNotAllowed(HttpServerExchange ex, String method, String path) {
        send(ex, 405, Map.of("error", "method not allowed"));
        RequestLogger.logRequest(method, path, 405, 0, -1, null);
    }

    private static Map<String, String> errorBody(Exception e) {
        return Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage()));
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
