package com.bidscope.query;

import java.util.Objects;

/**
 * Inclusive range on a date or decimal column. A null bound leaves that side open.
 */
public class BetweenExpression implements Expression {
    private final Column column;
    private final Comparable<?> lower;
    private final Comparable<?> upper;

    public BetweenExpression(Column column, Comparable<?> lower, Comparable<?> upper) {
        if (column.getType() == Column.SqlType.TEXT) {
            throw new IllegalArgumentException("Between applies to date and decimal columns only: " + column);
        }
        if (lower == null && upper == null) {
            throw new IllegalArgumentException("Between needs at least one bound");
        }
        this.column = column;
        this.lower = lower;
        this.upper = upper;
    }

    public Column getColumn() {
        return column;
    }

    public Comparable<?> getLower() {
        return lower;
    }

    public Comparable<?> getUpper() {
        return upper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BetweenExpression)) return false;
        BetweenExpression other = (BetweenExpression) o;
        return column == other.column && Objects.equals(lower, other.lower) && Objects.equals(upper, other.upper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, lower, upper);
    }

    @Override
    public String toString() {
        return "Between(" + column.getName() + ", " + lower + ", " + upper + ")";
    }
}
