package org.dice.simplifier.parsing;

public class ExpressionSyntaxException extends ExpressionException {

    private final ParserErrors error;

    public ExpressionSyntaxException(ParserErrors error, String message) {
        super(message);
        this.error = error;
    }

    public ParserErrors getError() {
        return error;
    }
}
