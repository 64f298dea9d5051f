// file: server/src/main/java/io/structlang/server/ServerConfig.java
package io.structlang.server;

import java.nio.file.Path;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:    HTTP API port
 *  - context:     initial active context ("linear" | "tree"), null to keep the config file value
 *  - policy:      failure policy ("abort" | "continue"), null to keep the config file value
 *  - configPath:  optional JSON workspace config
 */
public record ServerConfig(
        int httpPort,
        String context,
        String policy,
        String configPath
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --port,    -p <port>
     *   --context, -c <linear|tree>
     *   --policy      <abort|continue>
     *   --config      <path>
     *   --help,    -h
     *
     * All flags are optional.
     */
    public static ServerConfig fromArgs(String[] args) {
        int httpPort = 8080;
        String context = null;
        String policy = null;
        String configPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--context", "-c" -> {
                    ensureValue(args, i);
                    context = args[++i];
                }

                case "--policy" -> {
                    ensureValue(args, i);
                    policy = args[++i];
                }

                case "--config" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, context, policy, configPath);
    }

    /** Load the config file when given, then apply the CLI overrides. */
    public WorkspaceConfig workspaceConfig() {
        WorkspaceConfig base = configPath == null || configPath.isBlank()
                ? WorkspaceConfig.defaults()
                : WorkspaceConfig.fromJsonFile(Path.of(configPath));
        return base.withOverrides(context, policy);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: structlang-server [options]

            Options:
              --port,    -p   HTTP port (default: 8080)
              --context, -c   Initial context: linear | tree (default: linear)
              --policy        Failure policy: abort | continue (default: abort)
              --config        Path to JSON workspace config (optional)
              --help,    -h   Show this help message
            """);
        System.exit(0);
    }
}
