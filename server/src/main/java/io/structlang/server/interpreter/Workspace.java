// file: server/src/main/java/io/structlang/server/interpreter/Workspace.java
package io.structlang.server.interpreter;

import io.structlang.core.Domain;
import io.structlang.core.Structure;
import io.structlang.core.StructureKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of live structures plus the active context.
 * <p>
 * Invariants:
 *  - at most one instance per {@link StructureKind},
 *  - instances are replaced wholesale on create/build, never patched here,
 *  - only {@link CommandExecutor} mutates the registry (package-private writers);
 *    the active context is host state and may be switched by anyone.
 * Not thread-safe; callers serialize access (see ScriptService).
 */
public final class Workspace {

    private final Map<StructureKind, Structure> live = new EnumMap<>(StructureKind.class);
    private Domain activeContext;

    public Workspace(Domain initialContext) {
        this.activeContext = Objects.requireNonNull(initialContext, "initialContext");
    }

    public Domain activeContext() {
        return activeContext;
    }

    public void switchContext(Domain context) {
        this.activeContext = Objects.requireNonNull(context, "context");
    }

    public boolean contains(StructureKind kind) {
        return live.containsKey(kind);
    }

    public Optional<Structure> find(StructureKind kind) {
        return Optional.ofNullable(live.get(kind));
    }

    /** Live structures in kind order. */
    public Map<StructureKind, Structure> structures() {
        return Collections.unmodifiableMap(new EnumMap<>(live));
    }

    /** Typed lookup of an instance the validator has already proven to exist. */
    <T extends Structure> T require(StructureKind kind, Class<T> type) {
        Structure s = live.get(kind);
        if (s == null) {
            throw new IllegalStateException(kind.keyword() + " is not in the workspace");
        }
        return type.cast(s);
    }

    void put(Structure structure) {
        live.put(structure.kind(), structure);
    }

    boolean remove(StructureKind kind) {
        return live.remove(kind) != null;
    }

    /** Drops every structure; returns how many were live. */
    int clearAll() {
        int n = live.size();
        live.clear();
        return n;
    }
}
