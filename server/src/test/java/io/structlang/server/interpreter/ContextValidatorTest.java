// file: server/src/test/java/io/structlang/server/interpreter/ContextValidatorTest.java
package io.structlang.server.interpreter;

import io.structlang.core.Domain;
import io.structlang.core.ErrorKind;
import io.structlang.core.linear.ArrayListStructure;
import io.structlang.core.linear.StackStructure;
import io.structlang.core.tree.BinaryTree;
import io.structlang.lang.Command;
import io.structlang.lang.CommandParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ContextValidatorTest {

    private final CommandParser parser = new CommandParser();
    private final ContextValidator validator = new ContextValidator();

    private Command cmd(String statement) {
        return parser.parse(statement).command();
    }

    private ErrorKind rejection(String statement, Workspace ws) {
        return validator.validate(cmd(statement), ws).map(Outcome::errorKind).orElse(null);
    }

    @Test
    void missing_target_is_a_precondition_error() {
        var ws = new Workspace(Domain.TREE);
        assertEquals(ErrorKind.PRECONDITION, rejection("insert 6 at 0,1 in binarytree", ws));
        assertNull(rejection("create binarytree with 1,2,3", ws));
        assertNull(rejection("build bst with 1", ws));
    }

    @Test
    void domain_must_match_active_context() {
        var ws = new Workspace(Domain.LINEAR);
        assertEquals(ErrorKind.CONTEXT, rejection("create bst", ws));
        assertEquals(ErrorKind.CONTEXT, rejection("clear bst", ws));
        assertNull(rejection("clear", ws));
    }

    @Test
    void existence_is_checked_before_context() {
        var ws = new Workspace(Domain.LINEAR);
        assertEquals(ErrorKind.PRECONDITION, rejection("search 5 in bst", ws));
    }

    @Test
    void verb_must_be_legal_for_kind() {
        var ws = new Workspace(Domain.TREE);
        ws.put(new BinaryTree(List.of(1)));
        assertEquals(ErrorKind.UNSUPPORTED_OPERATION, rejection("search 1 in binarytree", ws));
        assertNull(rejection("traverse inorder", ws));

        var linear = new Workspace(Domain.LINEAR);
        linear.put(new StackStructure(List.of(), OptionalInt.empty()));
        assertNull(rejection("push 1 to stack", linear));
        linear.put(ArrayListStructure.empty());
        assertEquals(ErrorKind.UNSUPPORTED_OPERATION, rejection("push 1 to arraylist", linear));
    }

    @Test
    void local_clear_needs_no_live_target() {
        assertNull(rejection("clear stack", new Workspace(Domain.LINEAR)));
    }

    @Test
    void validation_does_not_touch_workspace() {
        var ws = new Workspace(Domain.LINEAR);
        validator.validate(cmd("clear"), ws);
        validator.validate(cmd("create arraylist"), ws);
        assertTrue(ws.structures().isEmpty());
        assertEquals(Domain.LINEAR, ws.activeContext());
    }
}
