package org.dice.simplifier;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.dice.simplifier.parsing.Canonicalizer;
import org.dice.simplifier.parsing.OperatorPrecedenceParser;
import org.dice.simplifier.parsing.SymbolNormalizer;
import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.rewriting.RewriteEngine;
import org.dice.simplifier.rewriting.RewriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: normalizes, parses and simplifies an expression, recording every law
 * applied on the way.
 * <pre>
 *     SimplificationResult result = new BooleanSimplifier().simplify("(A and B) or (A and C)");
 *     result.getFinalText();   // A &amp; (B | C)
 * </pre>
 * Instances hold no mutable state and can be shared.
 */
public class BooleanSimplifier {

    private static final Logger Log = LoggerFactory.getLogger( BooleanSimplifier.class );

    private final SimplifierConfig config;
    private final RewriteEngine engine = new RewriteEngine();

    public BooleanSimplifier() {
        this(SimplifierConfig.load());
    }

    public BooleanSimplifier(SimplifierConfig config) {
        this.config = Preconditions.checkNotNull(config, "config");
    }

    /**
     * @throws org.dice.simplifier.parsing.ValidationException on characters outside the alphabet
     */
    public static String normalize(String raw) {
        return SymbolNormalizer.normalize(raw);
    }

    /**
     * Rewrites the expression until no law applies or the configured step limit is hit.
     *
     * @throws org.dice.simplifier.parsing.ExpressionException if the input can't be normalized or parsed
     */
    public SimplificationResult simplify(String raw) {
        final String normalized = normalize(raw);
        final Expression initial = OperatorPrecedenceParser.parse(normalized);

        ImmutableList.Builder<SimplificationStep> steps = ImmutableList.builder();
        Expression current = initial;
        int count = 0;
        boolean truncated = false;
        while (true) {
            final String before = current.render();
            RewriteResult result = engine.rewrite(current);
            if (!result.isChanged()) {
                break;
            }
            if (count >= config.getMaxSteps()) {
                Log.warn(String.format("Stopped simplifying '%s' after %d steps at '%s'", normalized, count, before));
                truncated = true;
                break;
            }
            current = Canonicalizer.canonicalize(result.getExpression());
            SimplificationStep step = new SimplificationStep(before, result.getLaw(), current.render());
            steps.add(step);
            count++;
            Log.debug("Step {}: {}", count, step);
        }
        return new SimplificationResult(normalized, initial, current, steps.build(), truncated);
    }

    public SimplifierConfig getConfig() {
        return config;
    }
}
