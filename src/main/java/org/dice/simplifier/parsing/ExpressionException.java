package org.dice.simplifier.parsing;

/**
 * Base class of every failure raised while normalizing or parsing an expression.
 */
public abstract class ExpressionException extends RuntimeException {

    protected ExpressionException(String message) {
        super(message);
    }
}
