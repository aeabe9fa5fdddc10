package org.dice.simplifier.rewriting;

import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operators.NaryOperator;

/**
 * {@code A & 0 = 0}, {@code A | 1 = 1}
 */
class AnnihilatorRule implements RewriteRule {

    @Override
    public Expression apply(NaryOperator node) {
        if (node.getChildren().contains(node.absorbingElement())) {
            return node.absorbingElement();
        }
        return null;
    }

    @Override
    public Law law() {
        return Law.Annihilation;
    }
}
