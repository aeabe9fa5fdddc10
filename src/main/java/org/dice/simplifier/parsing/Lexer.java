package org.dice.simplifier.parsing;

import org.apache.commons.lang.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Created by simon.hughes on 4/12/16.
 *
 * Splits a normalized expression (see {@link SymbolNormalizer}) into symbols.
 * Call {@link #nextSymbol()} until it returns {@link #EOF}; {@link #toString()}
 * holds the text of the current symbol.
 */
public class Lexer {

    private final String input;
    private int position = 0;

    private int symbol = NONE;
    private String currentToken   = "";

    public static final int EOF   = -1;
    public static final int IDENTIFIER = 999;
    public static final int LITERAL = 10;

    public static final int NONE  = 0;

    public static final int OR    = 1;
    public static final int AND   = 2;
    public static final int NOT   = 3;

    public static final int LEFT  = 6;
    public static final int RIGHT = 7;

    public Lexer(String s) {
        this.input = StringUtils.defaultString(s);
    }

    /**
     * @throws ExpressionSyntaxException on a character that can't start a symbol
     */
    public int nextSymbol() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
        if (position >= input.length()) {
            this.currentToken = "";
            this.symbol = EOF;
            return symbol;
        }

        final int start = position;
        char c = input.charAt(position++);
        switch (c) {
            case SymbolNormalizer.AND:
                symbol = AND;
                break;
            case SymbolNormalizer.OR:
                symbol = OR;
                break;
            case SymbolNormalizer.NOT:
                symbol = NOT;
                break;
            case '(':
                symbol = LEFT;
                break;
            case ')':
                symbol = RIGHT;
                break;
            default:
                if (isDigit(c)) {
                    // each digit is a literal on its own, "10" is two literals
                    symbol = LITERAL;
                }
                else if (isIdentifierStart(c)) {
                    while (position < input.length() && isIdentifierPart(input.charAt(position))) {
                        position++;
                    }
                    symbol = IDENTIFIER;
                }
                else {
                    throw new ExpressionSyntaxException(ParserErrors.InvalidCharacter,
                            String.format("Invalid character '%s' at position %d", c, start));
                }
        }
        this.currentToken = input.substring(start, position);
        return symbol;
    }

    public int getSymbol() {
        return symbol;
    }

    public static List<Integer> tokenize(String inputString){
        // create a new lexer so as not to reset this one
        Lexer temp = new Lexer(inputString);
        List<Integer> symbols = new ArrayList<Integer>();
        int symbol;
        while ( (symbol = temp.nextSymbol()) != Lexer.EOF){
            symbols.add(symbol);
        }
        return symbols;
    }

    public String toString() {
        return this.currentToken;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
