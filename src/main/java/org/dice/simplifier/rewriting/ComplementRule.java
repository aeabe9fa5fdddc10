package org.dice.simplifier.rewriting;

import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operators.NaryOperator;
import org.dice.simplifier.parsing.ast.operators.Not;

import java.util.HashSet;
import java.util.Set;

/**
 * {@code A & !A = 0}, {@code A | !A = 1}
 */
class ComplementRule implements RewriteRule {

    @Override
    public Expression apply(NaryOperator node) {
        Set<Expression> children = new HashSet<Expression>(node.getChildren());
        for (Expression child : node.getChildren()) {
            if (children.contains(new Not(child))) {
                return node.absorbingElement();
            }
        }
        return null;
    }

    @Override
    public Law law() {
        return Law.Complement;
    }
}
