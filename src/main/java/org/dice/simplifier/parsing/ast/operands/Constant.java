package org.dice.simplifier.parsing.ast.operands;

import java.util.Map;

public class Constant extends Operand {

	public static final Constant TRUE = new Constant(true);
	public static final Constant FALSE = new Constant(false);

	private final boolean state;

	private Constant(boolean state) {
		super(state ? "1" : "0");
		this.state = state;
	}

	public static Constant of(boolean state) {
		return state ? TRUE : FALSE;
	}

	public boolean getState() {
		return state;
	}

	public boolean evaluate(Map<String, Boolean> assignment) {
		return state;
	}
}
