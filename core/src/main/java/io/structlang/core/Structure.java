// file: core/src/main/java/io/structlang/core/Structure.java
package io.structlang.core;

/**
 * Common view of a live structure instance held by a workspace.
 */
public interface Structure {

    StructureKind kind();

    /** Number of stored elements (nodes, for trees). */
    int size();
}
