package org.dice.simplifier.parsing;

import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operands.Constant;
import org.dice.simplifier.parsing.ast.operands.Variable;
import org.dice.simplifier.parsing.ast.operators.And;
import org.dice.simplifier.parsing.ast.operators.NaryOperator;
import org.dice.simplifier.parsing.ast.operators.Not;
import org.dice.simplifier.parsing.ast.operators.Or;

import java.util.Comparator;

/**
 * Total order on the children of an And / Or node: constants (1 before 0), variables
 * (alphabetical), negations, conjunctions, disjunctions. Operators of the same kind
 * are ordered by arity, then by their rendered text.
 */
public final class CanonicalOrder implements Comparator<Expression> {

    public static final CanonicalOrder INSTANCE = new CanonicalOrder();

    private CanonicalOrder() {
    }

    @Override
    public int compare(Expression e1, Expression e2) {
        int d = Integer.compare(rank(e1), rank(e2));
        if (d != 0) {
            return d;
        }
        d = Integer.compare(weight(e1), weight(e2));
        if (d != 0) {
            return d;
        }
        return e1.render().compareTo(e2.render());
    }

    private static int rank(Expression e) {
        if (e instanceof Constant) {
            return 0;
        }
        if (e instanceof Variable) {
            return 1;
        }
        if (e instanceof Not) {
            return 2;
        }
        if (e instanceof And) {
            return 3;
        }
        if (e instanceof Or) {
            return 4;
        }
        throw new IllegalArgumentException("Unknown expression type " + e.getClass().getName());
    }

    private static int weight(Expression e) {
        if (e instanceof Constant) {
            return ((Constant) e).getState() ? 0 : 1;
        }
        if (e instanceof NaryOperator) {
            return ((NaryOperator) e).arity();
        }
        return 0;
    }
}
