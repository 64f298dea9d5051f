// file: history/src/main/java/io/structlang/history/HistoryContext.java
package io.structlang.history;

import io.structlang.core.Domain;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/** Context tag of a history entry: one per domain plus GLOBAL for workspace-wide clears. */
public enum HistoryContext {
    LINEAR, TREE, GLOBAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static HistoryContext of(Domain domain) {
        Objects.requireNonNull(domain, "domain");
        return domain == Domain.LINEAR ? LINEAR : TREE;
    }

    public static Optional<HistoryContext> fromWireName(String name) {
        for (HistoryContext c : values()) {
            if (c.wireName().equals(name)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
