package com.bidscope.query;

import java.util.Locale;
import java.util.Objects;

/**
 * Case-insensitive substring match. A NULL column value never matches.
 */
public class ContainsExpression implements Expression {
    private final Column column;
    private final String needle;

    public ContainsExpression(Column column, String needle) {
        if (column.getType() != Column.SqlType.TEXT) {
            throw new IllegalArgumentException("Contains applies to text columns only: " + column);
        }
        if (needle == null || needle.isEmpty()) {
            throw new IllegalArgumentException("Contains needs a non-empty value");
        }
        this.column = column;
        this.needle = needle.toLowerCase(Locale.ROOT);
    }

    public Column getColumn() {
        return column;
    }

    public String getNeedle() {
        return needle;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContainsExpression)) return false;
        ContainsExpression other = (ContainsExpression) o;
        return column == other.column && needle.equals(other.needle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, needle);
    }

    @Override
    public String toString() {
        return "Contains(" + column.getName() + ", '" + needle + "')";
    }
}
