// file: server/src/main/java/io/structlang/server/FailurePolicy.java
package io.structlang.server;

import java.util.Locale;

/** What a script does after a statement fails. */
public enum FailurePolicy {
    /** Stop at the first failure; later statements are neither run nor recorded. */
    ABORT,
    /** Report the failure and go on with the next statement. */
    CONTINUE;

    public static FailurePolicy fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("failure policy must be abort or continue, got '" + name + "'", e);
        }
    }
}
