package org.dice.simplifier.parsing;

public class EmptyExpressionException extends ExpressionException {

    public EmptyExpressionException() {
        super("Expression is empty");
    }
}
