package org.dice.simplifier.parsing;

/**
 * Created by simon.hughes on 4/14/16.
 */
public enum  ParserErrors {
    UnbalancedParentheses(1),
    MissingOperand(2),
    InsufficientOperands(3),
    UnexpectedToken(4),
    MalFormedExpression(5),
    InvalidCharacter(6);

    public int value;
    ParserErrors(int value){
        this.value = value;
    }
}
