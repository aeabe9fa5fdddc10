package org.dice.simplifier.parsing.ast.operators;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.dice.simplifier.parsing.ast.Expression;
import org.dice.simplifier.parsing.ast.operands.Constant;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Associative, commutative operator over one or more children. And and Or are
 * duals of each other: each one swaps the other's identity and absorbing
 * constants.
 */
public abstract class NaryOperator implements Expression {
	protected final ImmutableList<Expression> children;

	NaryOperator(List<? extends Expression> children){
		Preconditions.checkArgument(!children.isEmpty(), "operator needs at least one child");
		this.children = ImmutableList.copyOf(children);
	}

	public ImmutableList<Expression> getChildren() {
		return children;
	}

	public int arity() {
		return children.size();
	}

	/** Same kind of operator over different children. */
	public abstract NaryOperator withChildren(List<? extends Expression> children);

	/** Constant that leaves the result unchanged: 1 for And, 0 for Or. */
	public abstract Constant identityElement();

	/** Constant that fixes the result: 0 for And, 1 for Or. */
	public abstract Constant absorbingElement();

	public abstract boolean isDual(Expression expression);

	protected abstract String separator();

	public String render() {
		List<String> parts = new ArrayList<String>(children.size());
		for (Expression child : children) {
			if (isDual(child)) {
				parts.add(String.format("(%s)", child.render()));
			}
			else {
				parts.add(child.render());
			}
		}
		return Joiner.on(separator()).join(parts);
	}

	public SortedSet<String> variables() {
		SortedSet<String> names = new TreeSet<String>();
		for (Expression child : children) {
			names.addAll(child.variables());
		}
		return names;
	}

	public int size() {
		int size = 1;
		for (Expression child : children) {
			size += child.size();
		}
		return size;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || o.getClass() != this.getClass()) {
			return false;
		}
		return children.equals(((NaryOperator) o).children);
	}

	@Override
	public int hashCode() {
		return 31 * getClass().hashCode() + children.hashCode();
	}

	@Override
	public String toString(){
		return this.render();
	}
}
