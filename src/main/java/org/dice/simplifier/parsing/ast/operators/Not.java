package org.dice.simplifier.parsing.ast.operators;

import org.dice.simplifier.parsing.ast.Expression;

import java.util.Map;

public class Not extends UnaryOperator {
	public Not(Expression child){
		super(child);
	}

	public String render() {
		if (child instanceof NaryOperator) {
			return String.format("!(%s)", child.render());
		}
		return String.format("!%s", child.render());
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		return !child.evaluate(assignment);
	}
}
