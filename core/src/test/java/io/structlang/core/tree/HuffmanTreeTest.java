// file: core/src/test/java/io/structlang/core/tree/HuffmanTreeTest.java
package io.structlang.core.tree;

import io.structlang.core.ErrorKind;
import io.structlang.core.StructureException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HuffmanTreeTest {

    private static HuffmanTree classic() {
        return new HuffmanTree(List.of(
                new SymbolFrequency('a', 5),
                new SymbolFrequency('b', 9),
                new SymbolFrequency('c', 12),
                new SymbolFrequency('d', 13),
                new SymbolFrequency('e', 16),
                new SymbolFrequency('f', 45)
        ));
    }

    @Test
    void classic_table_produces_known_codes() {
        var tree = classic();

        assertEquals(Map.of(
                'a', "1100", 'b', "1101", 'c', "100",
                'd', "101", 'e', "111", 'f', "0"
        ), tree.codes());
        assertEquals(100, tree.totalWeight());
        assertEquals(11, tree.size());
        assertEquals("*:100", tree.levelOrder().get(0));
        assertEquals("f:45", tree.levelOrder().get(1));
    }

    @Test
    void rarer_symbols_never_get_shorter_codes() {
        var codes = classic().codes();
        assertTrue(codes.get('a').length() >= codes.get('f').length());
        assertTrue(codes.get('b').length() >= codes.get('e').length());
    }

    @Test
    void decode_inverts_encode() {
        var tree = classic();
        for (String text : List.of("", "f", "abcdef", "faceddeaf", "aaaaabbbbbbbbb")) {
            assertEquals(text, tree.decode(tree.encode(text)));
        }
    }

    @Test
    void single_symbol_uses_code_zero() {
        var tree = new HuffmanTree(List.of(new SymbolFrequency('x', 3)));

        assertEquals("0", tree.codes().get('x'));
        assertEquals("000", tree.encode("xxx"));
        assertEquals("xx", tree.decode("00"));
        assertEquals(ErrorKind.DECODE, assertThrows(StructureException.class, () -> tree.decode("01")).kind());
    }

    @Test
    void equal_weights_break_ties_by_input_order() {
        var tree = new HuffmanTree(List.of(
                new SymbolFrequency('p', 1),
                new SymbolFrequency('q', 1)
        ));
        assertEquals("0", tree.codes().get('p'));
        assertEquals("1", tree.codes().get('q'));
    }

    @Test
    void unknown_character_is_rejected() {
        var ex = assertThrows(StructureException.class, () -> classic().encode("abz"));
        assertEquals(ErrorKind.UNKNOWN_CHARACTER, ex.kind());
    }

    @Test
    void decode_rejects_bad_bits_and_dangling_suffix() {
        var tree = classic();
        assertEquals(ErrorKind.DECODE, assertThrows(StructureException.class, () -> tree.decode("01x")).kind());
        assertEquals(ErrorKind.DECODE, assertThrows(StructureException.class, () -> tree.decode("011")).kind());
    }

    @Test
    void build_validates_input() {
        assertEquals(ErrorKind.INVALID_ARGUMENT,
                assertThrows(StructureException.class, () -> new HuffmanTree(List.of())).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT,
                assertThrows(StructureException.class,
                        () -> new HuffmanTree(List.of(new SymbolFrequency('a', 0)))).kind());
        assertEquals(ErrorKind.DUPLICATE,
                assertThrows(StructureException.class, () -> new HuffmanTree(List.of(
                        new SymbolFrequency('a', 1), new SymbolFrequency('a', 2)))).kind());
    }
}
