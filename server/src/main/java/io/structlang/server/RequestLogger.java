// file: server/src/main/java/io/structlang/server/RequestLogger.java
package io.structlang.server;

import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per HTTP request.
 *
 * Only POST /scripts reports an interpreter time: the span of
 * {@link ScriptService#run(String, io.structlang.core.Domain)}, which covers
 * splitting, parsing, executing and recording every statement, plus any wait
 * for a script already in flight. The rest of the total is JSON decoding,
 * validation of the request and encoding of the response.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed request. 5xx lines go out at WARNING with the
     * exception attached when there is one; everything else at INFO,
     * including 4xx and scripts whose statements failed.
     *
     * @param interpreterMillis time inside {@code ScriptService.run}, or -1 for routes that run no script
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long interpreterMillis,
            Throwable error
    ) {
        String msg = format(method, path, status, totalMillis, interpreterMillis);

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }

    static String format(String method, String path, int status, long totalMillis, long interpreterMillis) {
        return String.format(
                Locale.ROOT,
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                interpreterMillis >= 0 ? ", interpreter=" + interpreterMillis + "ms" : ""
        );
    }
}
