// file: core/src/main/java/io/structlang/core/tree/SearchResult.java
package io.structlang.core.tree;

import java.util.List;

/**
 * Outcome of a search-tree lookup.
 *
 * @param found    whether the value is stored
 * @param visited  node values compared against, root first
 */
public record SearchResult(boolean found, List<Integer> visited) {
    public SearchResult {
        visited = List.copyOf(visited);
    }
}
