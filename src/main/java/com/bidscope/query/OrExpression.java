package com.bidscope.query;

import java.util.List;
import java.util.Objects;

/**
 * Disjunction of two or more operands.
 */
public class OrExpression implements Expression {
    private final List<Expression> operands;

    public OrExpression(List<Expression> operands) {
        if (operands == null || operands.size() < 2) {
            throw new IllegalArgumentException("OR needs at least two operands");
        }
        this.operands = List.copyOf(operands);
    }

    public List<Expression> getOperands() {
        return operands;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrExpression)) return false;
        return operands.equals(((OrExpression) o).operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash("OR", operands);
    }

    @Override
    public String toString() {
        return "Or" + operands;
    }
}
