package org.dice.simplifier.rewriting;

import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operators.NaryOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code A & (A | B) = A}, {@code A | (A & B) = A}
 * <p>
 * The absorbed child is dropped; any other siblings are kept, so
 * {@code A & C & (A | B)} becomes {@code A & C}.
 */
class AbsorptionRule implements RewriteRule {

    @Override
    public Expression apply(NaryOperator node) {
        List<Expression> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            Expression candidate = children.get(i);
            if (!node.isDual(candidate)) {
                continue;
            }
            List<Expression> terms = ((NaryOperator) candidate).getChildren();
            for (int j = 0; j < children.size(); j++) {
                if (j != i && terms.contains(children.get(j))) {
                    List<Expression> rest = new ArrayList<Expression>(children);
                    rest.remove(i);
                    return rest.size() == 1 ? rest.get(0) : node.withChildren(rest);
                }
            }
        }
        return null;
    }

    @Override
    public Law law() {
        return Law.Absorption;
    }
}
