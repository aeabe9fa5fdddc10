package org.dice.simplifier.parsing.ast.operands;

import com.google.common.base.Preconditions;
import org.apache.commons.lang.StringUtils;

import java.util.Map;
import java.util.SortedSet;

public class Variable extends Operand {

	public Variable(String name) {
		super(name);
		Preconditions.checkArgument(StringUtils.isNotBlank(name), "variable name must not be blank");
	}

	public String getName() {
		return value;
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		Boolean state = assignment.get(value);
		if (state == null) {
			throw new IllegalArgumentException(String.format("No value assigned to variable %s", value));
		}
		return state;
	}

	@Override
	public SortedSet<String> variables() {
		SortedSet<String> names = super.variables();
		names.add(value);
		return names;
	}
}
