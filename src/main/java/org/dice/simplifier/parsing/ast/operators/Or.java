package org.dice.simplifier.parsing.ast.operators;

import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operands.Constant;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class Or extends NaryOperator {

	public Or(List<? extends Expression> children){
		super(children);
	}

	public Or(Expression... children){
		this(Arrays.asList(children));
	}

	@Override
	public Or withChildren(List<? extends Expression> children) {
		return new Or(children);
	}

	@Override
	public Constant identityElement() {
		return Constant.FALSE;
	}

	@Override
	public Constant absorbingElement() {
		return Constant.TRUE;
	}

	@Override
	public boolean isDual(Expression expression) {
		return expression instanceof And;
	}

	@Override
	protected String separator() {
		return " | ";
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		for (Expression child : children) {
			if (child.evaluate(assignment)) {
				return true;
			}
		}
		return false;
	}
}
