package org.dice.simplifier.parsing;

import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operands.Constant;
import org.dice.simplifier.parsing.ast.operands.Variable;
import org.dice.simplifier.parsing.ast.operators.And;
import org.dice.simplifier.parsing.ast.operators.Not;
import org.dice.simplifier.parsing.ast.operators.Or;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TestCanonicalizer {

    private static final Variable A = new Variable("A");
    private static final Variable B = new Variable("B");
    private static final Variable C = new Variable("C");
    private static final Variable D = new Variable("D");
    private static final Variable E = new Variable("E");

    @Test
    public void flattensAndSortsChildren() {
        Expression canonical = Canonicalizer.canonicalize(new And(new Or(C, B), new And(B, A)));
        assertEquals(new And(A, B, new Or(B, C)), canonical);
        assertEquals("A & B & (B | C)", canonical.render());
    }

    @Test
    public void ordersByKindThenArityThenText() {
        Expression canonical = Canonicalizer.canonicalize(new Or(
                new And(A, B, C), new Not(E), new And(D, E), Constant.FALSE, D, Constant.TRUE, A));
        assertEquals("1 | 0 | A | D | !E | (D & E) | (A & B & C)", canonical.render());
    }

    @Test
    public void collapsesSingleChild() {
        assertSame(A, Canonicalizer.canonicalize(new And(Collections.<Expression>singletonList(A))));
        assertEquals(A, Canonicalizer.canonicalize(new Or(new And(A))));
    }

    @Test
    public void doesNotFlattenAcrossNegation() {
        assertEquals("!(A | B)", Canonicalizer.canonicalize(new Not(new Or(B, A))).render());
        assertEquals("A & !(B & C)", Canonicalizer.canonicalize(new And(new Not(new And(C, B)), A)).render());
    }

    @Test
    public void keepsDuplicates() {
        assertEquals("A & A & B", Canonicalizer.canonicalize(new And(A, B, A)).render());
    }

    @Test
    public void isIdempotent() {
        Random random = new Random(42);
        for (int i = 0; i < 200; i++) {
            Expression expression = RandomExpressions.generate(random, 5, 4);
            Expression once = Canonicalizer.canonicalize(expression);
            assertEquals(once, Canonicalizer.canonicalize(once));
        }
    }

    @Test
    public void ignoresChildOrder() {
        List<Expression> children = new ArrayList<Expression>(Arrays.<Expression>asList(
                A, new Not(B), new Or(C, D), Constant.TRUE, new And(D, E)));
        Expression expected = Canonicalizer.canonicalize(new And(children));
        Random random = new Random(7);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(children, random);
            assertEquals(expected, Canonicalizer.canonicalize(new And(children)));
        }
    }

    @Test
    public void comparesConstantsFirst() {
        assertTrue(CanonicalOrder.INSTANCE.compare(Constant.TRUE, Constant.FALSE) < 0);
        assertTrue(CanonicalOrder.INSTANCE.compare(Constant.FALSE, A) < 0);
        assertTrue(CanonicalOrder.INSTANCE.compare(A, B) < 0);
        assertTrue(CanonicalOrder.INSTANCE.compare(new Variable("Z"), new Not(A)) < 0);
        assertTrue(CanonicalOrder.INSTANCE.compare(new Not(A), new And(A, B)) < 0);
        assertTrue(CanonicalOrder.INSTANCE.compare(new And(D, E, A), new Or(A, B)) < 0);
        assertEquals(0, CanonicalOrder.INSTANCE.compare(new Or(A, B), new Or(A, B)));
    }
}
