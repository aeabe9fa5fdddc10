package org.dice.simplifier.parsing;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the alias notations for the boolean operators to the characters understood
 * by the {@link Lexer} ({@code & | !}) and validates the remaining alphabet.
 */
public final class SymbolNormalizer {

    public static final char AND = '&';
    public static final char OR  = '|';
    public static final char NOT = '!';

    // word aliases are longer than the symbol aliases, so they are replaced first
    private static final Map<Pattern, String> ALIASES = ImmutableMap.<Pattern, String>builder()
            .put(word("AND"), String.valueOf(AND))
            .put(word("NOT"), String.valueOf(NOT))
            .put(word("OR"),  String.valueOf(OR))
            .put(symbols("∧•*⋅"), String.valueOf(AND))
            .put(symbols("∨+"), String.valueOf(OR))
            .put(symbols("¬~"), String.valueOf(NOT))
            .build();

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final CharMatcher ALLOWED = CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('A', 'Z'))
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.anyOf("_&|!() "))
            .precomputed();

    private SymbolNormalizer() {
    }

    /**
     * Returns the expression with every operator alias replaced and whitespace collapsed.
     *
     * @throws ValidationException if characters outside {@code [A-Za-z0-9_&|!() ]} remain
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }

        String s = raw;
        for (Map.Entry<Pattern, String> alias : ALIASES.entrySet()) {
            s = alias.getKey().matcher(s).replaceAll(Matcher.quoteReplacement(alias.getValue()));
        }
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();

        if (!ALLOWED.matchesAllOf(s)) {
            SortedSet<Character> invalid = new TreeSet<Character>();
            for (char c : ALLOWED.negate().retainFrom(s).toCharArray()) {
                invalid.add(c);
            }
            throw new ValidationException(invalid);
        }
        return s;
    }

    private static Pattern word(String alias) {
        return Pattern.compile("\\b" + alias + "\\b", Pattern.CASE_INSENSITIVE);
    }

    private static Pattern symbols(String aliases) {
        // none of the alias symbols is special inside a character class
        return Pattern.compile("[" + aliases + "]");
    }
}
