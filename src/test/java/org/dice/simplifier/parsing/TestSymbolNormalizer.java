package org.dice.simplifier.parsing;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class TestSymbolNormalizer {

    @Test
    public void replacesSymbolAliases() {
        assertEquals("A | A", SymbolNormalizer.normalize("A + A"));
        assertEquals("A & !A", SymbolNormalizer.normalize("A * !A"));
        assertEquals("A & B | !C", SymbolNormalizer.normalize("A ∧ B ∨ ¬C"));
        assertEquals("A & B & C", SymbolNormalizer.normalize("A • B ⋅ C"));
        assertEquals("!A", SymbolNormalizer.normalize("~A"));
    }

    @Test
    public void replacesWordAliasesInAnyCase() {
        assertEquals("a & b | ! c", SymbolNormalizer.normalize("a AND b or NOT c"));
        assertEquals("x & y", SymbolNormalizer.normalize("x And y"));
        assertEquals("x | y", SymbolNormalizer.normalize("x oR y"));
        assertEquals("(A)&(B)", SymbolNormalizer.normalize("(A)and(B)"));
    }

    @Test
    public void leavesIdentifiersContainingAliasesAlone() {
        assertEquals("Color | android", SymbolNormalizer.normalize("Color or android"));
        assertEquals("NOTE & x_and_y", SymbolNormalizer.normalize("NOTE and x_and_y"));
    }

    @Test
    public void collapsesWhitespace() {
        assertEquals("A & B", SymbolNormalizer.normalize("  A \t and\n   B  "));
        assertEquals("", SymbolNormalizer.normalize("   "));
        assertEquals("", SymbolNormalizer.normalize(null));
    }

    @Test
    public void keepsCanonicalInputUnchanged() {
        assertEquals("!(A_1 | b2) & 0 | 1", SymbolNormalizer.normalize("!(A_1 | b2) & 0 | 1"));
    }

    @Test
    public void reportsInvalidCharacters() {
        assertEquals(Arrays.asList('#'), getInvalidCharacters("A # B"));
        assertEquals(Arrays.asList('$', '@'), getInvalidCharacters("A @ $B $"));
        assertEquals(Arrays.asList('-', '^'), getInvalidCharacters("A ^ B - C"));
    }

    private Object getInvalidCharacters(String input) {
        try {
            SymbolNormalizer.normalize(input);
        } catch (ValidationException ex) {
            return Arrays.asList(ex.getInvalidCharacters().toArray());
        }
        fail("expected a ValidationException for " + input);
        return null;
    }
}
