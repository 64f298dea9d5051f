// file: server/src/test/java/io/structlang/server/RequestLoggerTest.java
package io.structlang.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class RequestLoggerTest {

    private final Logger logger = Logger.getLogger(RequestLogger.class.getName());
    private final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private final Handler capture = new Handler() {
        @Override
        public void publish(LogRecord record) {
            if (record.getMessage().contains(" /logger-test/")) {
                records.add(record);
            }
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void attach() {
        logger.addHandler(capture);
    }

    @AfterEach
    void detach() {
        logger.removeHandler(capture);
    }

    @Test
    void interpreter_time_is_shown_only_when_measured() {
        assertEquals("HTTP POST /scripts -> 200 (total=12ms, interpreter=9ms)",
                RequestLogger.format("POST", "/scripts", 200, 12, 9));
        assertEquals("HTTP GET /workspace -> 200 (total=1ms)",
                RequestLogger.format("GET", "/workspace", 200, 1, -1));
    }

    @Test
    void server_errors_log_at_warning_with_cause() {
        var boom = new IllegalStateException("boom");
        RequestLogger.logRequest("POST", "/logger-test/a", 500, 3, -1, boom);
        RequestLogger.logRequest("PUT", "/logger-test/b", 400, 1, -1, new IllegalArgumentException("bad"));
        RequestLogger.logRequest("POST", "/logger-test/c", 200, 5, 4, null);

        assertEquals(3, records.size());
        assertEquals(Level.WARNING, records.get(0).getLevel());
        assertSame(boom, records.get(0).getThrown());
        assertEquals(Level.INFO, records.get(1).getLevel());
        assertNull(records.get(1).getThrown());
        assertEquals("HTTP POST /logger-test/c -> 200 (total=5ms, interpreter=4ms)", records.get(2).getMessage());
    }
}
