// file: client/src/main/java/io/structlang/client/Cli.java
package io.structlang.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Simple CLI for driving a running structlang server over HTTP.
 *
 * Usage:
 *   structlang-cli [--base-url http://host:port] run <file> [--context linear|tree]
 *   structlang-cli [--base-url http://host:port] exec "<statements>" [--context linear|tree]
 *   structlang-cli [--base-url http://host:port] history [linear|tree|merged]
 *   structlang-cli [--base-url http://host:port] workspace
 *   structlang-cli [--base-url http://host:port] use <linear|tree>
 *
 * Examples:
 *   structlang-cli exec "create arraylist with 1,2,3; get at 0 from arraylist"
 *   structlang-cli run demo.sl --context tree
 *   structlang-cli history merged
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String baseUrl = parsed.getKey();
            String[] rest = parsed.getValue();

            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(baseUrl);

            switch (cmd) {
                case "run" -> {
                    if (rest.length != 2 && !(rest.length == 4 && "--context".equals(rest[2]))) {
                        usageAndExit("run requires <file> [--context linear|tree]");
                    }
                    String script = Files.readString(Path.of(rest[1]), StandardCharsets.UTF_8);
                    cli.runScript(script, rest.length == 4 ? rest[3] : null);
                }
                case "exec" -> {
                    if (rest.length != 2 && !(rest.length == 4 && "--context".equals(rest[2]))) {
                        usageAndExit("exec requires \"<statements>\" [--context linear|tree]");
                    }
                    cli.runScript(rest[1], rest.length == 4 ? rest[3] : null);
                }
                case "history" -> {
                    if (rest.length > 2) {
                        usageAndExit("history takes at most one view: linear, tree or merged");
                    }
                    cli.history(rest.length == 2 ? rest[1] : "merged");
                }
                case "workspace" -> {
                    if (rest.length != 1) {
                        usageAndExit("workspace takes no arguments");
                    }
                    cli.workspace();
                }
                case "use" -> {
                    if (rest.length != 2) {
                        usageAndExit("use requires <linear|tree>");
                    }
                    cli.use(rest[1]);
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 3) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private void runScript(String script, String context) throws Exception {
        String body = "{\"script\":" + jsonString(script)
                + ",\"context\":" + (context == null ? "null" : jsonString(context)) + "}";

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/scripts"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        String resp = send(req, "POST /scripts");
        System.out.println(resp);
        // Statement failures still answer 200; surface an aborted script through the exit code.
        if (resp.contains("\"aborted\":true")) {
            System.exit(3);
        }
    }

    private void history(String view) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/history?view=" + view))
                .GET()
                .build();

        String body = send(req, "GET /history");
        String text = stringField(body, "text");
        if (text == null) {
            System.out.println(body);
        } else if (text.isEmpty()) {
            System.out.println("(no history)");
        } else {
            System.out.println(text);
        }
    }

    private void workspace() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/workspace"))
                .GET()
                .build();
        System.out.println(send(req, "GET /workspace"));
    }

    private void use(String context) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/workspace/context"))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString("{\"context\":" + jsonString(context) + "}"))
                .build();
        send(req, "PUT /workspace/context");
        System.out.println("OK");
    }

    private String send(HttpRequest req, String what) throws IOException, InterruptedException {
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException(what + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        return resp.body();
    }

    // ---------- tiny JSON helpers (no JSON dependency on the client) ----------

    /** Quote {@code s} as a JSON string literal. */
    static String jsonString(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Ad-hoc lookup of a top-level string field; assumes the server's compact
     * Jackson output. Returns null when the field is absent or not a string.
     */
    static String stringField(String body, String name) {
        String marker = "\"" + name + "\":\"";
        int idx = body.indexOf(marker);
        if (idx < 0) {
            return null;
        }
        StringBuilder out = new StringBuilder();
        for (int i = idx + marker.length(); i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '"') {
                return out.toString();
            }
            if (c != '\\') {
                out.append(c);
                continue;
            }
            if (++i >= body.length()) {
                break;
            }
            char e = body.charAt(i);
            switch (e) {
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'u' -> {
                    if (i + 4 >= body.length()) {
                        return null;
                    }
                    out.append((char) Integer.parseInt(body.substring(i + 1, i + 5), 16));
                    i += 4;
                }
                default -> out.append(e);
            }
        }
        return null;
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  structlang-cli [--base-url http://host:port] run <file> [--context linear|tree]
                  structlang-cli [--base-url http://host:port] exec "<statements>" [--context linear|tree]
                  structlang-cli [--base-url http://host:port] history [linear|tree|merged]
                  structlang-cli [--base-url http://host:port] workspace
                  structlang-cli [--base-url http://host:port] use <linear|tree>
                """);
        System.exit(1);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
