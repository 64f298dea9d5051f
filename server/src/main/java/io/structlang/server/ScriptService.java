// file: server/src/main/java/io/structlang/server/ScriptService.java
package io.structlang.server;

import io.structlang.core.Domain;
import io.structlang.core.ErrorKind;
import io.structlang.history.HistoryContext;
import io.structlang.history.OperationLog;
import io.structlang.lang.Command;
import io.structlang.lang.CommandParser;
import io.structlang.lang.ParseResult;
import io.structlang.lang.ScriptSplitter;
import io.structlang.lang.Statement;
import io.structlang.server.interpreter.CommandExecutor;
import io.structlang.server.interpreter.Outcome;
import io.structlang.server.interpreter.StructureView;
import io.structlang.server.interpreter.Workspace;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Application service for running scripts against one workspace.
 *
 * Responsibilities:
 *  - Split, parse and execute scripts statement by statement.
 *  - Apply the configured {@link FailurePolicy}.
 *  - Record every executed statement in the {@link OperationLog}: successes
 *    always, failures when {@code recordFailures} is set. Parse failures are
 *    recorded in the active context.
 *  - Keep the HTTP layer away from workspace, parser and executor details.
 *
 * Concurrency: every public method is synchronized, so at most one script is
 * in flight and reads never observe a half-run script.
 */
public class ScriptService {

    private static final Logger log = Logger.getLogger(ScriptService.class.getName());

    private final Workspace workspace;
    private final CommandExecutor executor;
    private final CommandParser parser;
    private final OperationLog history;
    private final WorkspaceConfig config;

    public ScriptService(WorkspaceConfig config, OperationLog history) {
        this(config, new Workspace(config.initialContext()), new CommandParser(), history);
    }

    public ScriptService(WorkspaceConfig config, Workspace workspace, CommandParser parser, OperationLog history) {
        this.config = Objects.requireNonNull(config, "config");
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.history = Objects.requireNonNull(history, "history");
        this.executor = new CommandExecutor(workspace);
    }

    /** Run {@code script} in the current active context. */
    public synchronized ScriptReport run(String script) {
        return run(script, null);
    }

    /**
     * Run {@code script}, first switching to {@code context} when it is non-null.
     *
     * @throws IllegalArgumentException when the script exceeds {@code maxStatements}
     */
    public synchronized ScriptReport run(String script, Domain context) {
        List<Statement> statements = ScriptSplitter.split(script);
        if (statements.size() > config.maxStatements()) {
            throw new IllegalArgumentException("script has %d statements; the limit is %d"
                    .formatted(statements.size(), config.maxStatements()));
        }
        if (context != null) {
            workspace.switchContext(context);
        }

        List<StatementOutcome> outcomes = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            Statement st = statements.get(i);
            Outcome outcome = runStatement(st);
            outcomes.add(new StatementOutcome(st.line(), st.text(), outcome));
            if (!outcome.ok() && config.failurePolicy() == FailurePolicy.ABORT) {
                int skipped = statements.size() - i - 1;
                log.info(() -> "script aborted at line %d (%s); %d statements skipped"
                        .formatted(st.line(), outcome.errorKind().wireName(), skipped));
                return new ScriptReport(outcomes, true, skipped);
            }
        }
        return new ScriptReport(outcomes, false, 0);
    }

    public synchronized Domain activeContext() {
        return workspace.activeContext();
    }

    public synchronized void switchContext(Domain context) {
        workspace.switchContext(context);
    }

    /** Views of every live structure, in kind order. */
    public synchronized List<StructureView> structures() {
        return workspace.structures().values().stream().map(StructureView::of).toList();
    }

    public OperationLog history() {
        return history;
    }

    // ---------- helpers ----------

    private Outcome runStatement(Statement st) {
        ParseResult parsed = parser.parse(st.text());
        if (!parsed.isOk()) {
            Outcome failed = Outcome.failure(ErrorKind.PARSE, parsed.error().message());
            if (config.recordFailures()) {
                history.record(st.text(), HistoryContext.of(workspace.activeContext()), false, false);
            }
            return failed;
        }

        Command command = parsed.command();
        Outcome outcome = executor.execute(command);
        if (outcome.ok() || config.recordFailures()) {
            HistoryContext ctx = command.isGlobal() ? HistoryContext.GLOBAL : HistoryContext.of(command.domain());
            boolean boundary = command.isGlobal() || command.isRebuild();
            history.record(command.source(), ctx, outcome.ok(), boundary);
        }
        return outcome;
    }
}
