// file: core/src/main/java/io/structlang/core/tree/SymbolFrequency.java
package io.structlang.core.tree;

/**
 * One {@code char:weight} pair of a Huffman build.
 */
public record SymbolFrequency(char symbol, int weight) {

    @Override
    public String toString() {
        return symbol + ":" + weight;
    }
}
