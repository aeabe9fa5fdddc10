package org.dice.simplifier.parsing.ast;

import java.util.Map;
import java.util.SortedSet;

/**
 * <expression>::=<term>{<or><term>}
 * <term>::=<factor>{<and><factor>}
 * <factor>::=<constant>|<variable>|<not><factor>|(<expression>)
 * <constant>::= 0|1
 * <or>::='|'
 * <and>::='&'
 * <not>::='!'
 *
 * Implementations are immutable and compare by value.
 */
public interface Expression {

	/** Minimally parenthesized infix form, e.g. {@code A & (B | !C)}. */
	public String render();

	public boolean evaluate(Map<String, Boolean> assignment);

	public SortedSet<String> variables();

	/** Number of nodes in this tree. */
	public int size();
}
