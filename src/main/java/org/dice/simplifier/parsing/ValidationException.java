package org.dice.simplifier.parsing;

import com.google.common.collect.ImmutableSortedSet;

import java.util.Collection;

/**
 * Raised when characters outside the accepted alphabet remain after alias substitution.
 */
public class ValidationException extends ExpressionException {

    private final ImmutableSortedSet<Character> invalidCharacters;

    public ValidationException(Collection<Character> invalidCharacters) {
        this(ImmutableSortedSet.copyOf(invalidCharacters));
    }

    private ValidationException(ImmutableSortedSet<Character> invalidCharacters) {
        super(String.format("Invalid symbols found: %s", invalidCharacters));
        this.invalidCharacters = invalidCharacters;
    }

    public ImmutableSortedSet<Character> getInvalidCharacters() {
        return invalidCharacters;
    }
}
