// file: core/src/main/java/io/structlang/core/StructureKind.java
package io.structlang.core;

import java.util.Optional;

/**
 * Closed set of structure kinds a workspace can hold.
 * <p>
 * Each kind has:
 *  - keyword:     the lowercase name used by bare-keyword statements ("binarytree"),
 *  - dottedName:  the name used by dot-prefixed tree statements ("binary_tree"),
 *                 null for linear kinds, which have no dotted form,
 *  - domain:      linear or tree.
 */
public enum StructureKind {
    ARRAYLIST("arraylist", null, Domain.LINEAR),
    LINKEDLIST("linkedlist", null, Domain.LINEAR),
    STACK("stack", null, Domain.LINEAR),
    BINARYTREE("binarytree", "binary_tree", Domain.TREE),
    BST("bst", "bst", Domain.TREE),
    AVL("avl", "avl", Domain.TREE),
    HUFFMAN("huffman", "huffman", Domain.TREE);

    private final String keyword;
    private final String dottedName;
    private final Domain domain;

    StructureKind(String keyword, String dottedName, Domain domain) {
        this.keyword = keyword;
        this.dottedName = dottedName;
        this.domain = domain;
    }

    public String keyword() {
        return keyword;
    }

    public Domain domain() {
        return domain;
    }

    public boolean isLinear() {
        return domain == Domain.LINEAR;
    }

    /** Case-sensitive lookup of a bare-keyword name. */
    public static Optional<StructureKind> fromKeyword(String word) {
        for (StructureKind k : values()) {
            if (k.keyword.equals(word)) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }

    /** Case-sensitive lookup of a dot-prefixed tree name ("binary_tree", "bst", ...). */
    public static Optional<StructureKind> fromDottedName(String word) {
        for (StructureKind k : values()) {
            if (k.dottedName != null && k.dottedName.equals(word)) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}
