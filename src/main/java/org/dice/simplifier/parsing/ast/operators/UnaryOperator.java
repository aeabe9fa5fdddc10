package org.dice.simplifier.parsing.ast.operators;

import com.google.common.base.Preconditions;
import org.dice.simplifier.parsing.ast.Expression;

import java.util.SortedSet;

/**
 * Created by simon.hughes on 4/14/16.
 */
public abstract class UnaryOperator implements Expression {
    protected final Expression child;

    UnaryOperator(Expression child){
        this.child = Preconditions.checkNotNull(child, "child");
    }

    public Expression getChild() {
        return child;
    }

    public SortedSet<String> variables() {
        return child.variables();
    }

    public int size() {
        return 1 + child.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || o.getClass() != this.getClass()) {
            return false;
        }
        return child.equals(((UnaryOperator) o).child);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + child.hashCode();
    }

    @Override
    public String toString(){
        return this.render();
    }
}
