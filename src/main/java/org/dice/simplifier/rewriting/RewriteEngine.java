package org.dice.simplifier.rewriting;

import com.google.common.collect.ImmutableList;
import org.dice.simplifier.parsing.Canonicalizer;
import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operands.Operand;
import org.dice.simplifier.parsing.ast.operators.NaryOperator;
import org.dice.simplifier.parsing.ast.operators.Not;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies at most one boolean algebra law per call.
 * <p>
 * The tree is walked depth first, leftmost child first: the first child that changes
 * ends the call, so the caller can canonicalize before the next one. At an And / Or
 * node whose children are all at their fixpoint the laws are tried in this order:
 * <ol>
 *   <li>idempotence</li>
 *   <li>annihilator</li>
 *   <li>identity</li>
 *   <li>complement</li>
 *   <li>absorption</li>
 *   <li>common factor</li>
 * </ol>
 * Double negation is checked at a Not node whose child did not change.
 */
public class RewriteEngine {

    private static final List<RewriteRule> RULES = ImmutableList.of(
            new IdempotenceRule(),
            new AnnihilatorRule(),
            new IdentityRule(),
            new ComplementRule(),
            new AbsorptionRule(),
            new CommonFactorRule());

    public RewriteResult rewrite(Expression expression) {
        if (expression instanceof Operand) {
            return RewriteResult.unchanged(expression);
        }
        if (expression instanceof Not) {
            return rewriteNot((Not) expression);
        }
        if (expression instanceof NaryOperator) {
            return rewriteOperator((NaryOperator) expression);
        }
        throw new IllegalArgumentException("Unknown expression type " + expression.getClass().getName());
    }

    private RewriteResult rewriteNot(Not not) {
        Expression child = not.getChild();
        RewriteResult result = rewrite(child);
        if (result.isChanged()) {
            return RewriteResult.rewritten(new Not(result.getExpression()), result.getLaw());
        }
        if (child instanceof Not) {
            return RewriteResult.rewritten(((Not) child).getChild(), Law.DoubleNegation);
        }
        return RewriteResult.unchanged(not);
    }

    private RewriteResult rewriteOperator(NaryOperator node) {
        List<Expression> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            RewriteResult result = rewrite(children.get(i));
            if (result.isChanged()) {
                List<Expression> rewritten = new ArrayList<Expression>(children);
                rewritten.set(i, result.getExpression());
                return RewriteResult.rewritten(Canonicalizer.canonicalize(node.withChildren(rewritten)), result.getLaw());
            }
        }

        for (RewriteRule rule : RULES) {
            Expression rewritten = rule.apply(node);
            if (rewritten != null) {
                return RewriteResult.rewritten(rewritten, rule.law());
            }
        }
        return RewriteResult.unchanged(node);
    }
}
