// file: server/src/main/java/io/structlang/server/interpreter/CommandExecutor.java
package io.structlang.server.interpreter;

import io.structlang.core.ErrorKind;
import io.structlang.core.Structure;
import io.structlang.core.StructureException;
import io.structlang.core.StructureKind;
import io.structlang.core.linear.ArrayListStructure;
import io.structlang.core.linear.LinearStructure;
import io.structlang.core.linear.LinkedListStructure;
import io.structlang.core.linear.StackStructure;
import io.structlang.core.tree.AvlTree;
import io.structlang.core.tree.BinaryTree;
import io.structlang.core.tree.HuffmanTree;
import io.structlang.core.tree.SearchTree;
import io.structlang.lang.Command;
import io.structlang.lang.Verb;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies validated commands to the workspace.
 *
 * Responsibilities:
 *  - run the {@link ContextValidator} and stop at its rejection,
 *  - dispatch by verb to the engine of the target kind,
 *  - turn engine failures into {@link Outcome}s.
 *
 * Atomicity:
 *  - engines check every precondition before mutating,
 *  - create/build constructs the new instance completely before it replaces
 *    the old one, so a failed rebuild leaves the previous instance live.
 *
 * A RuntimeException other than StructureException is a bug; it is logged
 * and reported as INTERNAL instead of escaping into the script loop.
 */
public final class CommandExecutor {

    private static final Logger log = Logger.getLogger(CommandExecutor.class.getName());

    private final Workspace workspace;
    private final ContextValidator validator;

    public CommandExecutor(Workspace workspace) {
        this(workspace, new ContextValidator());
    }

    public CommandExecutor(Workspace workspace, ContextValidator validator) {
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public Workspace workspace() {
        return workspace;
    }

    public Outcome execute(Command command) {
        Optional<Outcome> rejected = validator.validate(command, workspace);
        if (rejected.isPresent()) {
            log.fine(() -> "rejected '%s': %s".formatted(command.source(), rejected.get().message()));
            return rejected.get();
        }
        try {
            return apply(command);
        } catch (StructureException e) {
            log.fine(() -> "failed '%s': %s %s".formatted(command.source(), e.kind().wireName(), e.getMessage()));
            return Outcome.failure(e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "internal error executing '" + command.source() + "'", e);
            return Outcome.failure(ErrorKind.INTERNAL, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Outcome apply(Command c) {
        return switch (c.verb()) {
            case CREATE, BUILD -> create(c);
            case INSERT -> insert(c);
            case DELETE -> delete(c);
            case GET -> get(c);
            case PUSH -> {
                workspace.require(c.kind(), StackStructure.class).push(c.value());
                yield Outcome.success("pushed " + c.value());
            }
            case POP -> {
                int v = workspace.require(c.kind(), StackStructure.class).pop();
                yield Outcome.success("popped " + v, v);
            }
            case PEEK -> {
                int v = workspace.require(c.kind(), StackStructure.class).peek();
                yield Outcome.success("top is " + v, v);
            }
            case SEARCH -> {
                var result = workspace.require(c.kind(), SearchTree.class).search(c.value());
                yield Outcome.success((result.found() ? "found " : "did not find ") + c.value(), result);
            }
            case TRAVERSE -> {
                List<Integer> order = workspace.require(c.kind(), BinaryTree.class).traverse(c.traversal());
                yield Outcome.success(c.traversal().keyword() + ": " + order, order);
            }
            case ENCODE -> {
                String bits = workspace.require(c.kind(), HuffmanTree.class).encode(c.text());
                yield Outcome.success("encoded " + c.text().length() + " characters into " + bits.length() + " bits", bits);
            }
            case DECODE -> {
                String text = workspace.require(c.kind(), HuffmanTree.class).decode(c.bits());
                yield Outcome.success("decoded " + c.bits().length() + " bits", text);
            }
            case CLEAR -> clear(c);
        };
    }

    // ---------- verbs ----------

    private Outcome create(Command c) {
        OptionalInt capacity = c.capacity() == null ? OptionalInt.empty() : OptionalInt.of(c.capacity());
        List<Integer> skipped = List.of();
        Structure fresh;
        switch (c.kind()) {
            case ARRAYLIST -> fresh = new ArrayListStructure(c.values(), capacity);
            case LINKEDLIST -> fresh = new LinkedListStructure(c.values(), capacity);
            case STACK -> fresh = new StackStructure(c.values(), capacity);
            case BINARYTREE -> fresh = new BinaryTree(c.values());
            case BST, AVL -> {
                SearchTree tree = c.kind() == StructureKind.AVL ? new AvlTree() : new SearchTree();
                skipped = tree.build(c.values());
                fresh = tree;
            }
            case HUFFMAN -> fresh = new HuffmanTree(c.frequencies());
            default -> throw new IllegalStateException("unhandled kind " + c.kind());
        }
        workspace.put(fresh);

        StructureView view = StructureView.of(fresh);
        String message = "%s %s (size %d)".formatted(
                c.verb() == Verb.BUILD ? "built" : "created", c.kind().keyword(), fresh.size());
        if (!skipped.isEmpty()) {
            message += "; skipped duplicates " + skipped;
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("structure", view);
            data.put("skipped", skipped);
            return Outcome.success(message, data);
        }
        return Outcome.success(message, view);
    }

    private Outcome insert(Command c) {
        switch (c.kind()) {
            case ARRAYLIST, LINKEDLIST, STACK -> {
                workspace.require(c.kind(), LinearStructure.class).insert(c.value(), c.position());
                return Outcome.success("inserted %d at %d".formatted(c.value(), c.position()));
            }
            case BINARYTREE -> {
                BinaryTree tree = workspace.require(c.kind(), BinaryTree.class);
                if (c.path() == null) {
                    tree.insert(c.value());
                    return Outcome.success("inserted " + c.value());
                }
                tree.insertAt(c.value(), c.path());
                return Outcome.success("inserted %d at path %s".formatted(c.value(), c.path()));
            }
            case AVL -> {
                AvlTree tree = workspace.require(c.kind(), AvlTree.class);
                tree.insert(c.value());
                List<String> rotations = tree.lastRotations();
                return Outcome.success(
                        "inserted " + c.value() + (rotations.isEmpty() ? "" : "; rotations " + rotations),
                        rotations);
            }
            default -> {
                workspace.require(c.kind(), SearchTree.class).insert(c.value());
                return Outcome.success("inserted " + c.value());
            }
        }
    }

    private Outcome delete(Command c) {
        switch (c.kind()) {
            case ARRAYLIST, LINKEDLIST, STACK -> {
                LinearStructure list = workspace.require(c.kind(), LinearStructure.class);
                if (c.position() != null) {
                    int removed = list.deleteAt(c.position());
                    return Outcome.success("deleted %d from position %d".formatted(removed, c.position()), removed);
                }
                int position = list.delete(c.value());
                return Outcome.success("deleted %d from position %d".formatted(c.value(), position), position);
            }
            case BINARYTREE -> {
                BinaryTree tree = workspace.require(c.kind(), BinaryTree.class);
                int removed = c.path() != null ? tree.deleteAt(c.path(), c.value()) : tree.delete(c.value());
                return Outcome.success("deleted %d %s".formatted(removed, removed == 1 ? "node" : "nodes"), removed);
            }
            case AVL -> {
                AvlTree tree = workspace.require(c.kind(), AvlTree.class);
                tree.delete(c.value());
                List<String> rotations = tree.lastRotations();
                return Outcome.success(
                        "deleted " + c.value() + (rotations.isEmpty() ? "" : "; rotations " + rotations),
                        rotations);
            }
            default -> {
                workspace.require(c.kind(), SearchTree.class).delete(c.value());
                return Outcome.success("deleted " + c.value());
            }
        }
    }

    private Outcome get(Command c) {
        LinearStructure list = workspace.require(c.kind(), LinearStructure.class);
        if (c.position() != null) {
            int v = list.get(c.position());
            return Outcome.success("position %d holds %d".formatted(c.position(), v), v);
        }
        int position = list.indexOf(c.value());
        return Outcome.success("%d is at position %d".formatted(c.value(), position), position);
    }

    private Outcome clear(Command c) {
        if (c.isGlobal()) {
            int n = workspace.clearAll();
            log.info(() -> "workspace cleared (" + n + " structures dropped)");
            return Outcome.success("cleared workspace (" + n + " structures)");
        }
        boolean removed = workspace.remove(c.kind());
        return Outcome.success(removed ? "cleared " + c.kind().keyword() : c.kind().keyword() + " was already empty");
    }
}
