package com.bidscope.query;

import java.util.Objects;

/**
 * Exact match on a text column.
 */
public class EqualsExpression implements Expression {
    private final Column column;
    private final String value;

    public EqualsExpression(Column column, String value) {
        this.column = Objects.requireNonNull(column, "column");
        this.value = Objects.requireNonNull(value, "value");
    }

    public Column getColumn() {
        return column;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EqualsExpression)) return false;
        EqualsExpression other = (EqualsExpression) o;
        return column == other.column && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, value);
    }

    @Override
    public String toString() {
        return "Equals(" + column.getName() + ", '" + value + "')";
    }
}
