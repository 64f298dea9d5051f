// file: lang/src/main/java/io/structlang/lang/CommandParser.java
package io.structlang.lang;

import io.structlang.core.StructureKind;
import io.structlang.core.tree.Traversal;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns one statement into a canonical {@link Command}.
 *
 * Surface forms:
 *  - bare keyword:   {@code insert 5 at 0 in arraylist}, {@code traverse inorder}, ...
 *  - dotted tree:    {@code tree.<binary_tree|bst|avl|huffman>.<verb> args}
 *  - build:          {@code build <bst|avl|huffman> with ...}, accepted in either style
 *
 * Design:
 *  - One tokenizer feeds two dispatch tables keyed by verb, one per surface
 *    style; each rule reads its arguments off a {@link TokenCursor}.
 *  - When a verb is directly followed by {@code at}, the position/path form
 *    is tried first ({@code delete at 2 from arraylist}); otherwise the value form.
 *  - Only spelling and shape are checked here. Whether the target exists,
 *    belongs to the active context or supports the verb is decided later.
 *  - {@link #parse(String)} never throws; failures come back as {@link ParseError}.
 */
public final class CommandParser {

    @FunctionalInterface
    private interface Rule {
        /**
         * @param target structure named by the dotted prefix, or null for bare statements
         */
        Command read(TokenCursor in, StructureKind target, String source);
    }

    private final Map<Verb, Rule> bare = new EnumMap<>(Verb.class);
    private final Map<Verb, Rule> dotted = new EnumMap<>(Verb.class);

    public CommandParser() {
        bare.put(Verb.CREATE, this::create);
        bare.put(Verb.INSERT, this::insert);
        bare.put(Verb.DELETE, this::delete);
        bare.put(Verb.GET, this::get);
        bare.put(Verb.PUSH, this::push);
        bare.put(Verb.POP, this::pop);
        bare.put(Verb.PEEK, this::peek);
        bare.put(Verb.SEARCH, this::search);
        bare.put(Verb.TRAVERSE, this::traverse);
        bare.put(Verb.BUILD, this::build);
        bare.put(Verb.ENCODE, this::encode);
        bare.put(Verb.DECODE, this::decode);
        bare.put(Verb.CLEAR, this::clear);

        dotted.put(Verb.CREATE, this::dottedCreate);
        dotted.put(Verb.INSERT, this::dottedInsert);
        dotted.put(Verb.DELETE, this::dottedDelete);
        dotted.put(Verb.SEARCH, this::dottedSearch);
        dotted.put(Verb.TRAVERSE, this::dottedTraverse);
        dotted.put(Verb.CLEAR, this::dottedClear);
    }

    public ParseResult parse(String statement) {
        String source = statement == null ? "" : statement.strip();
        try {
            if (source.isEmpty()) {
                throw new SyntaxException("empty statement");
            }
            List<Token> tokens = Tokenizer.tokenize(source);
            TokenCursor in = new TokenCursor(tokens);
            Command command = isDotted(in) ? readDotted(in, source) : readBare(in, source);
            in.expectEnd();
            return ParseResult.ok(command);
        } catch (SyntaxException e) {
            return ParseResult.failed(new ParseError(source, e.getMessage()));
        }
    }

    // ---------- dispatch ----------

    private static boolean isDotted(TokenCursor in) {
        Token second = in.peek(1);
        return second != null && second.type() == Token.Type.DOT;
    }

    private Command readBare(TokenCursor in, String source) {
        String keyword = in.word("command keyword");
        Verb verb = Verb.fromKeyword(keyword)
                .orElseThrow(() -> new SyntaxException("unknown command '" + keyword + "'"));
        return bare.get(verb).read(in, null, source);
    }

    private Command readDotted(TokenCursor in, String source) {
        String prefix = in.word("'tree'");
        if (prefix.equals("linear")) {
            throw new SyntaxException("linear structures have no dotted form; write e.g. 'create arraylist with 1,2'");
        }
        if (!prefix.equals("tree")) {
            throw new SyntaxException("unknown prefix '" + prefix + "' (only 'tree.' is supported)");
        }
        in.expect(Token.Type.DOT, "'.'");
        String name = in.word("tree structure name");
        StructureKind kind = StructureKind.fromDottedName(name)
                .orElseThrow(() -> new SyntaxException(
                        "unknown tree structure '" + name + "' (expected binary_tree, bst, avl or huffman)"));
        in.expect(Token.Type.DOT, "'.'");
        String verbWord = in.word("verb");
        Verb verb = verbWord.equals("remove")
                ? Verb.DELETE
                : Verb.fromKeyword(verbWord).orElse(null);
        Rule rule = verb == null ? null : dotted.get(verb);
        if (rule == null) {
            throw new SyntaxException("unknown verb '" + verbWord
                    + "' for tree." + name + " (expected create, insert, delete, remove, search, traverse or clear)");
        }
        return rule.read(in, kind, source);
    }

    // ---------- bare rules ----------

    private Command create(TokenCursor in, StructureKind ignored, String source) {
        StructureKind kind = in.structureName();
        Command.Builder b = Command.builder(Verb.CREATE, kind, source);
        if (in.acceptWord("with")) {
            readElements(in, kind, b);
        }
        if (in.acceptWord("size")) {
            if (!kind.isLinear()) {
                throw new SyntaxException("'size' only applies to arraylist, linkedlist and stack");
            }
            b.capacity(in.integer("capacity"));
        }
        return b.build();
    }

    private Command build(TokenCursor in, StructureKind ignored, String source) {
        StructureKind kind = in.structureName();
        Command.Builder b = Command.builder(Verb.BUILD, kind, source);
        in.expectWord("with");
        readElements(in, kind, b);
        return b.build();
    }

    private Command insert(TokenCursor in, StructureKind ignored, String source) {
        int value = in.integer("value");
        List<Integer> at = in.acceptWord("at") ? in.intList("position") : null;
        in.expectWord("in");
        StructureKind kind = in.structureName();
        Command.Builder b = Command.builder(Verb.INSERT, kind, source).value(value);
        if (kind.isLinear()) {
            if (at == null) {
                throw new SyntaxException("insert into " + kind.keyword() + " needs 'at <position>'");
            }
            b.position(single(at, "position"));
        } else {
            address(kind, at, b);
        }
        return b.build();
    }

    private Command delete(TokenCursor in, StructureKind ignored, String source) {
        if (in.acceptWord("at")) {
            List<Integer> at = in.intList("position");
            in.expectWord("from");
            StructureKind kind = in.structureName();
            Command.Builder b = Command.builder(Verb.DELETE, kind, source);
            if (kind.isLinear()) {
                b.position(single(at, "position"));
            } else {
                address(kind, at, b);
            }
            return b.build();
        }
        int value = in.integer("value");
        List<Integer> at = in.acceptWord("at") ? in.intList("path") : null;
        in.expectWord("from");
        StructureKind kind = in.structureName();
        Command.Builder b = Command.builder(Verb.DELETE, kind, source).value(value);
        if (kind.isLinear()) {
            if (at != null) {
                throw new SyntaxException("use either 'delete <value>' or 'delete at <position>' on " + kind.keyword());
            }
        } else {
            address(kind, at, b);
        }
        return b.build();
    }

    private Command get(TokenCursor in, StructureKind ignored, String source) {
        boolean byPosition = in.acceptWord("at");
        int operand = in.integer(byPosition ? "position" : "value");
        in.expectWord("from");
        StructureKind kind = in.structureName();
        Command.Builder b = Command.builder(Verb.GET, kind, source);
        return (byPosition ? b.position(operand) : b.value(operand)).build();
    }

    private Command push(TokenCursor in, StructureKind ignored, String source) {
        int value = in.integer("value");
        in.expectWord("to");
        return Command.builder(Verb.PUSH, in.structureName(), source).value(value).build();
    }

    private Command pop(TokenCursor in, StructureKind ignored, String source) {
        in.expectWord("from");
        return Command.builder(Verb.POP, in.structureName(), source).build();
    }

    private Command peek(TokenCursor in, StructureKind ignored, String source) {
        in.acceptWord("from");
        return Command.builder(Verb.PEEK, in.structureName(), source).build();
    }

    private Command search(TokenCursor in, StructureKind ignored, String source) {
        int value = in.integer("value");
        in.expectWord("in");
        return Command.builder(Verb.SEARCH, in.structureName(), source).value(value).build();
    }

    private Command traverse(TokenCursor in, StructureKind ignored, String source) {
        Traversal order = in.traversal();
        StructureKind kind = in.acceptWord("in") ? in.structureName() : StructureKind.BINARYTREE;
        return Command.builder(Verb.TRAVERSE, kind, source).traversal(order).build();
    }

    private Command encode(TokenCursor in, StructureKind ignored, String source) {
        String text = in.expect(Token.Type.STRING, "quoted text").text();
        in.expectWord("using");
        return Command.builder(Verb.ENCODE, in.structureName(), source).text(text).build();
    }

    private Command decode(TokenCursor in, StructureKind ignored, String source) {
        String bits = in.bits();
        in.expectWord("using");
        return Command.builder(Verb.DECODE, in.structureName(), source).bits(bits).build();
    }

    private Command clear(TokenCursor in, StructureKind ignored, String source) {
        if (in.atEnd()) {
            return Command.builder(Verb.CLEAR, null, source).build();
        }
        return Command.builder(Verb.CLEAR, in.structureName(), source).build();
    }

    // ---------- dotted rules ----------

    private Command dottedCreate(TokenCursor in, StructureKind kind, String source) {
        Command.Builder b = Command.builder(Verb.CREATE, kind, source);
        in.acceptWord("with");
        if (!in.atEnd()) {
            readElements(in, kind, b);
        }
        return b.build();
    }

    private Command dottedInsert(TokenCursor in, StructureKind kind, String source) {
        Command.Builder b = Command.builder(Verb.INSERT, kind, source).value(in.integer("value"));
        address(kind, in.acceptWord("at") ? in.path() : null, b);
        return b.build();
    }

    private Command dottedDelete(TokenCursor in, StructureKind kind, String source) {
        Command.Builder b = Command.builder(Verb.DELETE, kind, source);
        if (in.acceptWord("at")) {
            if (kind != StructureKind.BINARYTREE) {
                throw new SyntaxException("delete on " + kind.keyword() + " needs a value");
            }
            return b.path(in.path()).build();
        }
        b.value(in.integer("value"));
        address(kind, in.acceptWord("at") ? in.path() : null, b);
        return b.build();
    }

    private Command dottedSearch(TokenCursor in, StructureKind kind, String source) {
        return Command.builder(Verb.SEARCH, kind, source).value(in.integer("value")).build();
    }

    private Command dottedTraverse(TokenCursor in, StructureKind kind, String source) {
        if (kind != StructureKind.BINARYTREE) {
            throw new SyntaxException("traverse is only available as tree.binary_tree.traverse");
        }
        return Command.builder(Verb.TRAVERSE, kind, source).traversal(in.traversal()).build();
    }

    private Command dottedClear(TokenCursor in, StructureKind kind, String source) {
        return Command.builder(Verb.CLEAR, kind, source).build();
    }

    // ---------- helpers ----------

    /** Reads the element list of a create/build: char:freq pairs for huffman, ints otherwise. */
    private static void readElements(TokenCursor in, StructureKind kind, Command.Builder b) {
        if (kind == StructureKind.HUFFMAN) {
            b.frequencies(in.frequencyList());
        } else {
            b.values(in.intList("value"));
        }
    }

    /** Attaches an optional {@code at} list as a tree path; only binary trees are path-addressed. */
    private static void address(StructureKind kind, List<Integer> at, Command.Builder b) {
        if (at == null) {
            return;
        }
        if (kind != StructureKind.BINARYTREE) {
            throw new SyntaxException(kind.keyword() + " nodes are not addressed by path");
        }
        for (int step : at) {
            if (step != 0 && step != 1) {
                throw new SyntaxException("path steps must be 0 or 1, got " + step);
            }
        }
        b.path(at);
    }

    private static int single(List<Integer> at, String what) {
        if (at.size() != 1) {
            throw new SyntaxException(what + " must be a single integer");
        }
        return at.get(0);
    }
}
