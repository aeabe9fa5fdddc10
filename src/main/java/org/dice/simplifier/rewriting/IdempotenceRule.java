package org.dice.simplifier.rewriting;

import org.dice.simplifier.parsing.Canonicalizer;
import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operators.NaryOperator;

import java.util.ArrayList;
import java.util.LinkedHashSet;

/**
 * {@code A & A & B = A & B}, {@code A | A = A}
 */
class IdempotenceRule implements RewriteRule {

    @Override
    public Expression apply(NaryOperator node) {
        LinkedHashSet<Expression> unique = new LinkedHashSet<Expression>(node.getChildren());
        if (unique.size() == node.arity()) {
            return null;
        }
        return Canonicalizer.canonicalize(node.withChildren(new ArrayList<Expression>(unique)));
    }

    @Override
    public Law law() {
        return Law.Idempotence;
    }
}
