package org.dice.simplifier.rewriting;

import org.dice.simplifier.parsing.Canonicalizer;
import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operators.NaryOperator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Distributive law read backwards:
 * {@code (A & B) | (A & C) = A & (B | C)} and {@code (A | B) & (A | C) = A | (B & C)}.
 * <p>
 * Fires only when every child is an operator of the dual kind and all of them share
 * at least one term. A child left without terms becomes its operator's identity
 * constant, e.g. {@code (A & B) | A & B & C} gives {@code A & B & (1 | C)}.
 */
class CommonFactorRule implements RewriteRule {

    private static final Comparator<Expression> BY_RENDERING = new Comparator<Expression>() {
        @Override
        public int compare(Expression e1, Expression e2) {
            return e1.render().compareTo(e2.render());
        }
    };

    @Override
    public Expression apply(NaryOperator node) {
        Set<Expression> common = null;
        for (Expression child : node.getChildren()) {
            if (!node.isDual(child)) {
                return null;
            }
            List<Expression> terms = ((NaryOperator) child).getChildren();
            if (common == null) {
                common = new LinkedHashSet<Expression>(terms);
            }
            else {
                common.retainAll(terms);
            }
            if (common.isEmpty()) {
                return null;
            }
        }
        if (common == null) {
            return null;
        }

        List<Expression> factors = new ArrayList<Expression>(common);
        Collections.sort(factors, BY_RENDERING);

        List<Expression> residuals = new ArrayList<Expression>(node.arity());
        for (Expression child : node.getChildren()) {
            NaryOperator term = (NaryOperator) child;
            List<Expression> rest = new ArrayList<Expression>(term.getChildren());
            rest.removeAll(common);
            if (rest.isEmpty()) {
                residuals.add(term.identityElement());
            }
            else if (rest.size() == 1) {
                residuals.add(rest.get(0));
            }
            else {
                residuals.add(Canonicalizer.canonicalize(term.withChildren(rest)));
            }
        }

        NaryOperator dual = (NaryOperator) node.getChildren().get(0);
        List<Expression> outer = new ArrayList<Expression>(factors);
        outer.add(Canonicalizer.canonicalize(node.withChildren(residuals)));
        return Canonicalizer.canonicalize(dual.withChildren(outer));
    }

    @Override
    public Law law() {
        return Law.CommonFactor;
    }
}
