package org.dice.simplifier.rewriting;

import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operators.NaryOperator;

/**
 * A law applied at an And / Or node whose children are already at their fixpoint.
 * Rules are written once for both operators using the operator's identity and
 * absorbing constants.
 */
public interface RewriteRule {

    /**
     * @return the rewritten node, or null if the law does not apply
     */
    Expression apply(NaryOperator node);

    Law law();
}
