package org.dice.simplifier.rewriting;

import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operators.NaryOperator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code A & 1 = A}, {@code A | 0 = A}
 */
class IdentityRule implements RewriteRule {

    @Override
    public Expression apply(NaryOperator node) {
        List<Expression> rest = new ArrayList<Expression>(node.getChildren());
        rest.removeAll(Collections.singleton(node.identityElement()));
        if (rest.size() == node.arity()) {
            return null;
        }
        if (rest.isEmpty()) {
            return node.identityElement();
        }
        if (rest.size() == 1) {
            return rest.get(0);
        }
        return node.withChildren(rest);
    }

    @Override
    public Law law() {
        return Law.Identity;
    }
}
