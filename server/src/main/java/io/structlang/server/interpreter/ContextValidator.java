// file: server/src/main/java/io/structlang/server/interpreter/ContextValidator.java
package io.structlang.server.interpreter;

import io.structlang.core.ErrorKind;
import io.structlang.lang.Command;
import io.structlang.lang.Verb;

import java.util.Optional;

/**
 * Checks a parsed command against workspace state before anything runs.
 * <p>
 * Checks, in order (first failure wins):
 *  1) existence: anything but create/build/clear needs a live target -> PRECONDITION,
 *  2) context: the target's domain must be the active one (global clear is exempt) -> CONTEXT,
 *  3) capability: the verb must be legal for the kind -> UNSUPPORTED_OPERATION.
 * Pure: never mutates the workspace and never throws for a well-formed command.
 */
public final class ContextValidator {

    public Optional<Outcome> validate(Command command, Workspace workspace) {
        if (command.isGlobal()) {
            return Optional.empty();
        }
        var kind = command.kind();
        boolean exempt = command.isRebuild() || command.verb() == Verb.CLEAR;
        if (!exempt && !workspace.contains(kind)) {
            return reject(ErrorKind.PRECONDITION,
                    "%s has not been created; start with 'create %s'".formatted(kind.keyword(), kind.keyword()));
        }
        if (kind.domain() != workspace.activeContext()) {
            return reject(ErrorKind.CONTEXT,
                    "%s is a %s structure but the active context is %s".formatted(
                            kind.keyword(), kind.domain().wireName(), workspace.activeContext().wireName()));
        }
        if (!Capabilities.allows(kind, command.verb())) {
            return reject(ErrorKind.UNSUPPORTED_OPERATION,
                    "%s does not support %s".formatted(kind.keyword(), command.verb().keyword()));
        }
        return Optional.empty();
    }

    private static Optional<Outcome> reject(ErrorKind kind, String message) {
        return Optional.of(Outcome.failure(kind, message));
    }
}
