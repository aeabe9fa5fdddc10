package org.dice.simplifier.parsing;

import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operands.Constant;
import org.dice.simplifier.parsing.ast.operands.Variable;
import org.dice.simplifier.parsing.ast.operators.And;
import org.dice.simplifier.parsing.ast.operators.Not;
import org.dice.simplifier.parsing.ast.operators.Or;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Created by simon.hughes on 4/12/16.
 *
 * Shunting-yard parser over the symbols of a {@link Lexer}. Precedence is
 * NOT > AND > OR and the binary operators are left associative, so
 * {@code !A & B | C} is {@code ((!A) & B) | C}. The tree returned by {@link #parse()}
 * is in canonical form (see {@link Canonicalizer}).
 * <p>
 * A parser instance is single use.
 */
public class OperatorPrecedenceParser {

    private final Lexer lexer;
    private int symbol;
    private final Deque<Integer> operators = new ArrayDeque<Integer>();
    private final Deque<Expression> operands = new ArrayDeque<Expression>();

    public OperatorPrecedenceParser(Lexer lexer) {
        this.lexer  = lexer;
        this.symbol = Lexer.NONE;
    }

    /**
     * Parses an expression already passed through {@link SymbolNormalizer}.
     */
    public static Expression parse(String normalizedExpression) {
        return new OperatorPrecedenceParser(new Lexer(normalizedExpression)).parse();
    }

    /**
     * @throws EmptyExpressionException if the input holds no symbol at all
     * @throws ExpressionSyntaxException if the input is not a well formed expression
     */
    public Expression parse() {
        symbol = lexer.nextSymbol();
        if (symbol == Lexer.EOF) {
            throw new EmptyExpressionException();
        }

        while (symbol != Lexer.EOF) {
            switch (symbol) {
                case Lexer.LITERAL:
                    operands.push(literal(lexer.toString()));
                    break;

                case Lexer.IDENTIFIER:
                    operands.push(new Variable(lexer.toString()));
                    break;

                case Lexer.NOT:
                    // prefix operator, binds tighter than anything already pending
                    operators.push(symbol);
                    break;

                case Lexer.AND:
                case Lexer.OR:
                    while (!operators.isEmpty() && operators.peek() != Lexer.LEFT
                            && precedence(operators.peek()) >= precedence(symbol)) {
                        apply(operators.pop());
                    }
                    operators.push(symbol);
                    break;

                case Lexer.LEFT:
                    operators.push(symbol);
                    break;

                case Lexer.RIGHT:
                    while (!operators.isEmpty() && operators.peek() != Lexer.LEFT) {
                        apply(operators.pop());
                    }
                    if (operators.isEmpty()) {
                        throw new ExpressionSyntaxException(ParserErrors.UnbalancedParentheses,
                                "Unbalanced parentheses: ')' without a matching '('");
                    }
                    operators.pop();
                    break;

                default:
                    throw unexpected();
            }
            symbol = lexer.nextSymbol();
        }

        while (!operators.isEmpty()) {
            int operator = operators.pop();
            if (operator == Lexer.LEFT) {
                throw new ExpressionSyntaxException(ParserErrors.UnbalancedParentheses,
                        "Unbalanced parentheses: '(' is never closed");
            }
            apply(operator);
        }

        if (operands.size() != 1) {
            throw new ExpressionSyntaxException(ParserErrors.MalFormedExpression,
                    String.format("Malformed expression: %d operands left without an operator", operands.size()));
        }
        return Canonicalizer.canonicalize(operands.pop());
    }

    private void apply(int operator) {
        if (operator == Lexer.NOT) {
            if (operands.isEmpty()) {
                throw new ExpressionSyntaxException(ParserErrors.MissingOperand, "Negation without an operand");
            }
            operands.push(new Not(operands.pop()));
            return;
        }

        if (operands.size() < 2) {
            throw new ExpressionSyntaxException(ParserErrors.InsufficientOperands,
                    String.format("Operator '%s' needs two operands", operator == Lexer.AND ? "&" : "|"));
        }
        // first popped is the right hand side
        Expression right = operands.pop();
        Expression left = operands.pop();
        if (operator == Lexer.AND) {
            operands.push(new And(left, right));
        }
        else {
            operands.push(new Or(left, right));
        }
    }

    private Expression literal(String token) {
        if ("1".equals(token)) {
            return Constant.TRUE;
        }
        if ("0".equals(token)) {
            return Constant.FALSE;
        }
        throw unexpected();
    }

    private ExpressionSyntaxException unexpected() {
        return new ExpressionSyntaxException(ParserErrors.UnexpectedToken,
                String.format("Unexpected token: %s", lexer.toString()));
    }

    private static int precedence(int operator) {
        switch (operator) {
            case Lexer.NOT:
                return 3;
            case Lexer.AND:
                return 2;
            case Lexer.OR:
                return 1;
            default:
                return 0;
        }
    }
}
