// file: lang/src/main/java/io/structlang/lang/Command.java
package io.structlang.lang;

import io.structlang.core.Domain;
import io.structlang.core.StructureKind;
import io.structlang.core.tree.SymbolFrequency;
import io.structlang.core.tree.Traversal;

import java.util.List;
import java.util.Objects;

/**
 * Canonical, syntax-independent form of one statement.
 * <p>
 * Every surface form (bare keyword, {@code tree.<struct>.<verb>}, {@code build ... with})
 * reduces to this record; downstream code never looks at the statement text
 * except to log or record it.
 * <p>
 * Fields that a verb does not use are null (scalars) or empty (lists). Notes:
 *  - kind is null only for the global {@code clear},
 *  - position is a linear index, path a binary-tree address (null when absent),
 *  - value doubles as the expected node value of a binary-tree path delete,
 *  - capacity is the optional {@code size N} of a linear create.
 */
public record Command(
        Verb verb,
        StructureKind kind,
        List<Integer> values,
        Integer value,
        Integer position,
        List<Integer> path,
        List<SymbolFrequency> frequencies,
        String text,
        String bits,
        Traversal traversal,
        Integer capacity,
        String source
) {

    public Command {
        Objects.requireNonNull(verb, "verb");
        Objects.requireNonNull(source, "source");
        if (kind == null && verb != Verb.CLEAR) {
            throw new IllegalArgumentException(verb.keyword() + " needs a structure kind");
        }
        values = values == null ? List.of() : List.copyOf(values);
        frequencies = frequencies == null ? List.of() : List.copyOf(frequencies);
        path = path == null ? null : List.copyOf(path);
    }

    /** Domain of the target structure; null for the global clear. */
    public Domain domain() {
        return kind == null ? null : kind.domain();
    }

    /** True for the bare {@code clear} that wipes the whole workspace. */
    public boolean isGlobal() {
        return kind == null;
    }

    /** True when this command replaces the target with a fresh instance. */
    public boolean isRebuild() {
        return verb == Verb.CREATE || verb == Verb.BUILD;
    }

    public static Builder builder(Verb verb, StructureKind kind, String source) {
        return new Builder(verb, kind, source);
    }

    public static final class Builder {
        private final Verb verb;
        private final StructureKind kind;
        private final String source;
        private List<Integer> values;
        private Integer value;
        private Integer position;
        private List<Integer> path;
        private List<SymbolFrequency> frequencies;
        private String text;
        private String bits;
        private Traversal traversal;
        private Integer capacity;

        private Builder(Verb verb, StructureKind kind, String source) {
            this.verb = verb;
            this.kind = kind;
            this.source = source;
        }

        public Builder values(List<Integer> values) { this.values = values; return this; }
        public Builder value(Integer value) { this.value = value; return this; }
        public Builder position(Integer position) { this.position = position; return this; }
        public Builder path(List<Integer> path) { this.path = path; return this; }
        public Builder frequencies(List<SymbolFrequency> frequencies) { this.frequencies = frequencies; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder bits(String bits) { this.bits = bits; return this; }
        public Builder traversal(Traversal traversal) { this.traversal = traversal; return this; }
        public Builder capacity(Integer capacity) { this.capacity = capacity; return this; }

        public Command build() {
            return new Command(verb, kind, values, value, position, path, frequencies,
                    text, bits, traversal, capacity, source);
        }
    }
}
