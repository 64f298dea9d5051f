// file: server/src/main/java/io/structlang/server/interpreter/StructureView.java
package io.structlang.server.interpreter;

import io.structlang.core.Structure;
import io.structlang.core.linear.ArrayListStructure;
import io.structlang.core.linear.LinearStructure;
import io.structlang.core.tree.BinaryTree;
import io.structlang.core.tree.HuffmanTree;
import io.structlang.core.tree.SearchTree;
import io.structlang.core.tree.Traversal;

import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of one structure, shaped for an external renderer.
 * <p>
 *  - linear kinds: elements in order; capacity when bounded,
 *  - trees: values in level order plus height,
 *  - huffman: {@code symbol:weight} nodes in level order ('*' for internal
 *    nodes) plus the code table.
 * Fields that do not apply are null.
 */
public record StructureView(
        String kind,
        String domain,
        int size,
        List<?> contents,
        Integer height,
        Integer capacity,
        Map<Character, String> codes
) {

    public static StructureView of(Structure s) {
        String kind = s.kind().keyword();
        String domain = s.kind().domain().wireName();
        if (s instanceof LinearStructure linear) {
            Integer capacity = null;
            if (s instanceof ArrayListStructure list && list.capacity().isPresent()) {
                capacity = list.capacity().getAsInt();
            }
            return new StructureView(kind, domain, linear.size(), linear.toList(), null, capacity, null);
        }
        if (s instanceof BinaryTree tree) {
            return new StructureView(kind, domain, tree.size(), tree.traverse(Traversal.LEVELORDER), tree.height(), null, null);
        }
        if (s instanceof SearchTree tree) {
            return new StructureView(kind, domain, tree.size(), tree.traverse(Traversal.LEVELORDER), tree.height(), null, null);
        }
        if (s instanceof HuffmanTree huffman) {
            return new StructureView(kind, domain, huffman.size(), huffman.levelOrder(), null, null, huffman.codes());
        }
        throw new IllegalArgumentException("no view for " + s.getClass().getName());
    }
}
