// file: core/src/main/java/io/structlang/core/tree/HuffmanTree.java
package io.structlang.core.tree;

import io.structlang.core.ErrorKind;
import io.structlang.core.Structure;
import io.structlang.core.StructureException;
import io.structlang.core.StructureKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Huffman code tree built from symbol frequencies.
 * <p>
 * Construction:
 *  - one leaf per input pair, created in input order,
 *  - repeatedly take the two lightest trees and join them under a new
 *    internal node (first taken goes left, second goes right) whose weight
 *    is their sum, until one tree remains.
 * Ties on weight are broken by creation order: leaves in input order, then
 * internal nodes in the order they were made. The result is deterministic.
 * <p>
 * Codes: a left step is '0' and a right step '1'. A tree with a single
 * symbol is just a leaf; its code is defined as "0".
 * <p>
 * Nodes live in parallel arrays indexed by creation order, which doubles as
 * the tie-break key.
 */
public final class HuffmanTree implements Structure {

    private static final int NIL = -1;

    private final char[] symbol;
    private final long[] weight;
    private final int[] left;
    private final int[] right;
    private final int root;
    private final int nodeCount;
    private final Map<Character, String> codes;

    public HuffmanTree(List<SymbolFrequency> frequencies) {
        if (frequencies == null || frequencies.isEmpty()) {
            throw new StructureException(ErrorKind.INVALID_ARGUMENT, "huffman needs at least one character");
        }
        Set<Character> seen = new HashSet<>();
        for (SymbolFrequency f : frequencies) {
            if (!seen.add(f.symbol())) {
                throw new StructureException(ErrorKind.DUPLICATE, "character '%c' listed twice".formatted(f.symbol()));
            }
            if (f.weight() <= 0) {
                throw new StructureException(
                        ErrorKind.INVALID_ARGUMENT,
                        "frequency of '%c' must be > 0, got %d".formatted(f.symbol(), f.weight())
                );
            }
        }

        int capacity = 2 * frequencies.size() - 1;
        this.symbol = new char[capacity];
        this.weight = new long[capacity];
        this.left = new int[capacity];
        this.right = new int[capacity];

        PriorityQueue<Integer> forest = new PriorityQueue<>(
                Comparator.<Integer>comparingLong(n -> weight[n]).thenComparingInt(n -> n)
        );
        int next = 0;
        for (SymbolFrequency f : frequencies) {
            symbol[next] = f.symbol();
            weight[next] = f.weight();
            left[next] = NIL;
            right[next] = NIL;
            forest.add(next++);
        }
        while (forest.size() > 1) {
            int a = forest.poll();
            int b = forest.poll();
            weight[next] = weight[a] + weight[b];
            left[next] = a;
            right[next] = b;
            forest.add(next++);
        }
        this.root = forest.poll();
        this.nodeCount = next;
        this.codes = buildCodes();
    }

    @Override
    public StructureKind kind() {
        return StructureKind.HUFFMAN;
    }

    /** Total number of nodes, leaves and internal. */
    @Override
    public int size() {
        return nodeCount;
    }

    public long totalWeight() {
        return weight[root];
    }

    /** Code table keyed by symbol, in left-to-right leaf order. */
    public Map<Character, String> codes() {
        return codes;
    }

    /**
     * Concatenate the codes of every character of {@code text}.
     * UNKNOWN_CHARACTER when some character has no leaf.
     */
    public String encode(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!codes.containsKey(c)) {
                throw new StructureException(
                        ErrorKind.UNKNOWN_CHARACTER,
                        "character '%c' is not in the huffman tree".formatted(c)
                );
            }
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            sb.append(codes.get(text.charAt(i)));
        }
        return sb.toString();
    }

    /**
     * Walk the tree bit by bit, emitting a symbol at every leaf and
     * restarting from the root. DECODE on a bit other than 0/1, on a step
     * into a missing child, or on trailing bits that stop short of a leaf.
     */
    public String decode(String bits) {
        StringBuilder out = new StringBuilder();
        if (isLeaf(root)) {
            for (int i = 0; i < bits.length(); i++) {
                char b = bits.charAt(i);
                if (b != '0') {
                    throw decodeError(b, i);
                }
                out.append(symbol[root]);
            }
            return out.toString();
        }
        int n = root;
        for (int i = 0; i < bits.length(); i++) {
            char b = bits.charAt(i);
            if (b == '0') {
                n = left[n];
            } else if (b == '1') {
                n = right[n];
            } else {
                throw decodeError(b, i);
            }
            if (isLeaf(n)) {
                out.append(symbol[n]);
                n = root;
            }
        }
        if (n != root) {
            throw new StructureException(ErrorKind.DECODE, "trailing bits do not reach a leaf");
        }
        return out.toString();
    }

    /** Symbols (internal nodes as '*') with their weights, breadth-first from the root. */
    public List<String> levelOrder() {
        List<String> out = new ArrayList<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            int n = queue.poll();
            out.add((isLeaf(n) ? String.valueOf(symbol[n]) : "*") + ":" + weight[n]);
            if (!isLeaf(n)) {
                queue.add(left[n]);
                queue.add(right[n]);
            }
        }
        return List.copyOf(out);
    }

    // ---------- helpers ----------

    private boolean isLeaf(int n) {
        return left[n] == NIL;
    }

    private Map<Character, String> buildCodes() {
        Map<Character, String> table = new LinkedHashMap<>();
        if (isLeaf(root)) {
            table.put(symbol[root], "0");
            return Collections.unmodifiableMap(table);
        }
        collect(root, new StringBuilder(), table);
        return Collections.unmodifiableMap(table);
    }

    private void collect(int n, StringBuilder prefix, Map<Character, String> table) {
        if (isLeaf(n)) {
            table.put(symbol[n], prefix.toString());
            return;
        }
        prefix.append('0');
        collect(left[n], prefix, table);
        prefix.setCharAt(prefix.length() - 1, '1');
        collect(right[n], prefix, table);
        prefix.setLength(prefix.length() - 1);
    }

    private static StructureException decodeError(char bit, int index) {
        return new StructureException(
                ErrorKind.DECODE,
                "invalid bit '%c' at offset %d".formatted(bit, index)
        );
    }
}
