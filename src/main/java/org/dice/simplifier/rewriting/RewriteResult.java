package org.dice.simplifier.rewriting;

import com.google.common.base.Preconditions;
import org.dice.simplifier.parsing.ast.Expression;

/**
 * Outcome of one {@link RewriteEngine#rewrite(Expression)} call. When nothing changed
 * the law is null and the expression is the input.
 */
public class RewriteResult {

    private final Expression expression;
    private final Law law;

    private RewriteResult(Expression expression, Law law) {
        this.expression = Preconditions.checkNotNull(expression, "expression");
        this.law = law;
    }

    public static RewriteResult unchanged(Expression expression) {
        return new RewriteResult(expression, null);
    }

    public static RewriteResult rewritten(Expression expression, Law law) {
        return new RewriteResult(expression, Preconditions.checkNotNull(law, "law"));
    }

    public Expression getExpression() {
        return expression;
    }

    public boolean isChanged() {
        return law != null;
    }

    public Law getLaw() {
        return law;
    }
}
