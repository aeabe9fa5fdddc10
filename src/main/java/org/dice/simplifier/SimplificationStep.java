package org.dice.simplifier;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import org.dice.simplifier.rewriting.Law;

/**
 * One rewrite: the rendered expression before it, the law applied and the rendered
 * expression after it.
 */
public final class SimplificationStep {

    private final String before;
    private final Law law;
    private final String after;

    public SimplificationStep(String before, Law law, String after) {
        this.before = Preconditions.checkNotNull(before, "before");
        this.law = Preconditions.checkNotNull(law, "law");
        this.after = Preconditions.checkNotNull(after, "after");
    }

    public String getBefore() {
        return before;
    }

    public Law getLaw() {
        return law;
    }

    public String getAfter() {
        return after;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SimplificationStep)) {
            return false;
        }
        SimplificationStep other = (SimplificationStep) o;
        return before.equals(other.before) && law == other.law && after.equals(other.after);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(before, law, after);
    }

    @Override
    public String toString() {
        return String.format("%s → %s → %s", before, law.getLabel(), after);
    }
}
