package me.christianrobert.trylower.transformation.semantic.lowered;

import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.trylower.transformation.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Lowered trees compare structurally so that repeated runs can be checked for identity.
 */
class LoweredNodeEqualityTest {

    @Test
    void equalStructuresAreEqual() {
        LoweredNode first = new MatchNode(ValueNode.of(expr("op()", 1)), "x", ValueNode.reference("x"),
                ERROR_B, "e", new ReturnErrorNode(expr("fail()", 2), ERROR_A));
        LoweredNode second = new MatchNode(ValueNode.of(expr("op()", 1)), "x", ValueNode.reference("x"),
                ERROR_B, "e", new ReturnErrorNode(expr("fail()", 2), ERROR_A));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void throwTargetIsPartOfTheStructure() {
        assertNotEquals(new ReturnErrorNode(expr("fail()", 2), ERROR_A), new FailNode(expr("fail()", 2), ERROR_A));
    }

    @Test
    void valueKindsAreDistinct() {
        assertNotEquals(ValueNode.reference("x"), ValueNode.of(expr("x", 1)));
        assertEquals(ValueNode.unit(), ValueNode.unit());
    }

    @Test
    void placeholdersCompareByCodes() {
        assertEquals(new ErrorPlaceholderNode(at(1), List.of("E-MISSING-HANDLER(ErrorC)")),
                new ErrorPlaceholderNode(at(1), List.of("E-MISSING-HANDLER(ErrorC)")));
        assertNotEquals(new ErrorPlaceholderNode(at(1), List.of("E-MISSING-HANDLER(ErrorC)")),
                new ErrorPlaceholderNode(at(1), List.of("E-DUPLICATE-HANDLER(ErrorB)")));
    }
}
