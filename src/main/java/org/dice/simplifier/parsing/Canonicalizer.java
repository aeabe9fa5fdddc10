package org.dice.simplifier.parsing;

import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operands.Operand;
import org.dice.simplifier.parsing.ast.operators.NaryOperator;
import org.dice.simplifier.parsing.ast.operators.Not;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Brings a tree into canonical form: nested operators of the same kind are flattened
 * into their parent, children are sorted by {@link CanonicalOrder} and an operator
 * left with a single child is replaced by that child.
 * <p>
 * Only associativity and commutativity are applied, never a simplification, so the
 * result is always logically equal to the input.
 */
public final class Canonicalizer {

    private Canonicalizer() {
    }

    public static Expression canonicalize(Expression expression) {
        if (expression instanceof Operand) {
            return expression;
        }
        if (expression instanceof Not) {
            return new Not(canonicalize(((Not) expression).getChild()));
        }
        if (expression instanceof NaryOperator) {
            NaryOperator operator = (NaryOperator) expression;
            List<Expression> children = new ArrayList<Expression>();
            for (Expression child : operator.getChildren()) {
                Expression canonical = canonicalize(child);
                if (canonical.getClass() == operator.getClass()) {
                    children.addAll(((NaryOperator) canonical).getChildren());
                }
                else {
                    children.add(canonical);
                }
            }
            Collections.sort(children, CanonicalOrder.INSTANCE);
            if (children.size() == 1) {
                return children.get(0);
            }
            return operator.withChildren(children);
        }
        throw new IllegalArgumentException("Unknown expression type " + expression.getClass().getName());
    }
}
