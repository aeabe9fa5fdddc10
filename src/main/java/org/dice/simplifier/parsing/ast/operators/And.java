package org.dice.simplifier.parsing.ast.operators;

import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operands.Constant;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class And extends NaryOperator {
	public And(List<? extends Expression> children){
		super(children);
	}

	public And(Expression... children){
		this(Arrays.asList(children));
	}

	@Override
	public And withChildren(List<? extends Expression> children) {
		return new And(children);
	}

	@Override
	public Constant identityElement() {
		return Constant.TRUE;
	}

	@Override
	public Constant absorbingElement() {
		return Constant.FALSE;
	}

	@Override
	public boolean isDual(Expression expression) {
		return expression instanceof Or;
	}

	@Override
	protected String separator() {
		return " & ";
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		for (Expression child : children) {
			if (!child.evaluate(assignment)) {
				return false;
			}
		}
		return true;
	}
}
