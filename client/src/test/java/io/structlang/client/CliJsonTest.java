// file: client/src/test/java/io/structlang/client/CliJsonTest.java
package io.structlang.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CliJsonTest {

    @Test
    void scripts_are_quoted_as_json_strings() {
        assertEquals("\"encode \\\"ab\\\" using huffman\\nclear\"",
                Cli.jsonString("encode \"ab\" using huffman\nclear"));
        assertEquals("\"a\\\\b\\u0001\"", Cli.jsonString("a\\b\u0001"));
    }

    @Test
    void history_text_is_unescaped() {
        String body = "{\"view\":\"merged\",\"entries\":[],\"text\":\"09:30:00 [linear] create stack\\n"
                + "09:30:01 [tree] encode \\\"ab\\\" using huffman\"}";

        assertEquals("09:30:00 [linear] create stack\n09:30:01 [tree] encode \"ab\" using huffman",
                Cli.stringField(body, "text"));
        assertEquals("merged", Cli.stringField(body, "view"));
        assertNull(Cli.stringField(body, "missing"));
    }
}
