// file: server/src/main/java/io/structlang/server/interpreter/Capabilities.java
package io.structlang.server.interpreter;

import io.structlang.core.StructureKind;
import io.structlang.lang.Verb;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/** Fixed table of which verbs each structure kind accepts. */
public final class Capabilities {

    private static final Map<StructureKind, Set<Verb>> TABLE = new EnumMap<>(StructureKind.class);

    static {
        Set<Verb> list = EnumSet.of(Verb.CREATE, Verb.INSERT, Verb.DELETE, Verb.GET, Verb.CLEAR);
        Set<Verb> stack = EnumSet.copyOf(list);
        stack.addAll(EnumSet.of(Verb.PUSH, Verb.POP, Verb.PEEK));
        Set<Verb> searchTree = EnumSet.of(Verb.CREATE, Verb.BUILD, Verb.INSERT, Verb.DELETE, Verb.SEARCH, Verb.CLEAR);

        TABLE.put(StructureKind.ARRAYLIST, list);
        TABLE.put(StructureKind.LINKEDLIST, list);
        TABLE.put(StructureKind.STACK, stack);
        TABLE.put(StructureKind.BINARYTREE, EnumSet.of(Verb.CREATE, Verb.INSERT, Verb.DELETE, Verb.TRAVERSE, Verb.CLEAR));
        TABLE.put(StructureKind.BST, searchTree);
        TABLE.put(StructureKind.AVL, searchTree);
        TABLE.put(StructureKind.HUFFMAN, EnumSet.of(Verb.CREATE, Verb.BUILD, Verb.ENCODE, Verb.DECODE, Verb.CLEAR));
        TABLE.replaceAll((k, v) -> Collections.unmodifiableSet(v));
    }

    private Capabilities() {
    }

    public static boolean allows(StructureKind kind, Verb verb) {
        return TABLE.get(kind).contains(verb);
    }

    public static Set<Verb> of(StructureKind kind) {
        return TABLE.get(kind);
    }
}
