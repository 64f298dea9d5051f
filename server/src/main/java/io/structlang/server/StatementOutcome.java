// file: server/src/main/java/io/structlang/server/StatementOutcome.java
package io.structlang.server;

import io.structlang.server.interpreter.Outcome;

/**
 * Outcome of one script statement.
 *
 * @param line      1-based script line
 * @param statement statement text as split from the script
 */
public record StatementOutcome(int line, String statement, Outcome outcome) {
}
