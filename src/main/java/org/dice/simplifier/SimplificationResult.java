package org.dice.simplifier;

import com.google.common.collect.ImmutableList;
import org.dice.simplifier.parsing.ast.Expression;

import java.util.List;

public class SimplificationResult {

    private final String normalizedInput;
    private final Expression initial;
    private final Expression simplified;
    private final ImmutableList<SimplificationStep> steps;
    private final boolean truncated;

    SimplificationResult(String normalizedInput, Expression initial, Expression simplified,
                         List<SimplificationStep> steps, boolean truncated) {
        this.normalizedInput = normalizedInput;
        this.initial = initial;
        this.simplified = simplified;
        this.steps = ImmutableList.copyOf(steps);
        this.truncated = truncated;
    }

    /** Input after alias substitution, see {@link BooleanSimplifier#normalize(String)}. */
    public String getNormalizedInput() {
        return normalizedInput;
    }

    /** Canonical tree of the input, before any law was applied. */
    public Expression getInitialExpression() {
        return initial;
    }

    public Expression getSimplifiedExpression() {
        return simplified;
    }

    public String getFinalText() {
        return simplified.render();
    }

    public ImmutableList<SimplificationStep> getSteps() {
        return steps;
    }

    /** True when the step limit stopped the simplification before its fixpoint. */
    public boolean isTruncated() {
        return truncated;
    }
}
