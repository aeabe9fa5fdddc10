package org.dice.simplifier.parsing.ast.operands;

import org.dice.simplifier.parsing.ast.Expression;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Leaf of an expression tree.
 */
public abstract class Operand implements Expression {
	protected final String value;

	Operand(String value) {
		this.value = value;
	}

	public String render() {
		return value;
	}

	public SortedSet<String> variables() {
		return new TreeSet<String>();
	}

	public int size() {
		return 1;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || o.getClass() != this.getClass()) {
			return false;
		}
		return value.equals(((Operand) o).value);
	}

	@Override
	public int hashCode() {
		return 31 * getClass().hashCode() + value.hashCode();
	}

	@Override
	public String toString(){
		return this.render();
	}
}
