package org.dice.simplifier.parsing.ast;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import org.dice.simplifier.parsing.ast.operands.Constant;
import org.dice.simplifier.parsing.ast.operands.Variable;
import org.dice.simplifier.parsing.ast.operators.And;
import org.dice.simplifier.parsing.ast.operators.Not;
import org.dice.simplifier.parsing.ast.operators.Or;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TestExpressions {

    private static final Variable A = new Variable("A");
    private static final Variable B = new Variable("B");
    private static final Variable C = new Variable("C");

    @Test
    public void rendersOperands() {
        assertEquals("1", Constant.TRUE.render());
        assertEquals("0", Constant.FALSE.render());
        assertEquals("x_1", new Variable("x_1").render());
    }

    @Test
    public void parenthesizesOnlyWhereNeeded() {
        assertEquals("!A", new Not(A).render());
        assertEquals("!!A", new Not(new Not(A)).render());
        assertEquals("!(A | B)", new Not(new Or(A, B)).render());
        assertEquals("!(A & B)", new Not(new And(A, B)).render());
        assertEquals("A | (B & C)", new Or(A, new And(B, C)).render());
        assertEquals("A & (B | C)", new And(A, new Or(B, C)).render());
        assertEquals("A & !B & !(B | C)", new And(A, new Not(B), new Not(new Or(B, C))).render());
        // same kind needs no parentheses, the operators are associative
        assertEquals("A & B & C", new And(A, new And(B, C)).render());
        assertEquals("A | B | C", new Or(new Or(A, B), C).render());
    }

    @Test
    public void comparesByValue() {
        assertEquals(new And(A, new Not(B)), new And(new Variable("A"), new Not(new Variable("B"))));
        assertEquals(new And(A, B).hashCode(), new And(A, B).hashCode());
        assertNotEquals(new And(A, B), new Or(A, B));
        assertNotEquals(new And(A, B), new And(B, A));
        assertNotEquals(new Not(A), A);
        assertSame(Constant.TRUE, Constant.of(true));
        assertSame(Constant.FALSE, Constant.of(false));
        assertNotEquals(Constant.TRUE, Constant.FALSE);
    }

    @Test
    public void evaluatesUnderAssignment() {
        Map<String, Boolean> assignment = ImmutableMap.of("A", true, "B", false, "C", true);
        assertTrue(new And(A, new Not(B)).evaluate(assignment));
        assertFalse(new And(A, B).evaluate(assignment));
        assertTrue(new Or(B, C).evaluate(assignment));
        assertFalse(new Or(B, Constant.FALSE).evaluate(assignment));
        assertTrue(new Not(new And(A, B, C)).evaluate(assignment));
        assertTrue(Constant.TRUE.evaluate(ImmutableMap.<String, Boolean>of()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void failsOnUnassignedVariable() {
        new And(A, B).evaluate(ImmutableMap.of("A", true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsBlankVariableName() {
        new Variable(" ");
    }

    @Test
    public void reportsVariablesAndSize() {
        Expression expression = new Or(new And(C, A), new Not(A), Constant.TRUE);
        assertEquals(ImmutableSortedSet.of("A", "C"), expression.variables());
        assertEquals(7, expression.size());
        assertEquals(1, Constant.FALSE.size());
        assertTrue(Constant.FALSE.variables().isEmpty());
    }
}
