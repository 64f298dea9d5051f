// file: server/src/main/java/io/structlang/server/ScriptReport.java
package io.structlang.server;

import java.util.List;

/**
 * Result of running a script.
 *
 * @param outcomes one entry per executed statement, in script order
 * @param aborted  true when a failure stopped the script under {@link FailurePolicy#ABORT}
 * @param skipped  statements left unexecuted because of the abort
 */
public record ScriptReport(List<StatementOutcome> outcomes, boolean aborted, int skipped) {

    public ScriptReport {
        outcomes = List.copyOf(outcomes);
    }

    public boolean allOk() {
        return outcomes.stream().allMatch(o -> o.outcome().ok());
    }
}
