package com.bidscope.query;

import java.util.List;
import java.util.Objects;

/**
 * Conjunction of two or more operands.
 */
public class AndExpression implements Expression {
    private final List<Expression> operands;

    public AndExpression(List<Expression> operands) {
        if (operands == null || operands.size() < 2) {
            throw new IllegalArgumentException("AND needs at least two operands");
        }
        this.operands = List.copyOf(operands);
    }

    public List<Expression> getOperands() {
        return operands;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AndExpression)) return false;
        return operands.equals(((AndExpression) o).operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash("AND", operands);
    }

    @Override
    public String toString() {
        return "And" + operands;
    }
}
