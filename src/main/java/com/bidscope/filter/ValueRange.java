package com.bidscope.filter;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inclusive bounds on contract_amount. Either bound may be open, never both.
 * Filters hold this as an {@code Optional}; an absent range means no restriction.
 */
public final class ValueRange {

    private final BigDecimal min;
    private final BigDecimal max;

    public ValueRange(BigDecimal min, BigDecimal max) {
        if (min == null && max == null) {
            throw new IllegalArgumentException("A value range needs at least one bound");
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new IllegalArgumentException("Minimum " + min + " exceeds maximum " + max);
        }
        this.min = min == null ? null : min.stripTrailingZeros();
        this.max = max == null ? null : max.stripTrailingZeros();
    }

    public BigDecimal getMin() {
        return min;
    }

    public BigDecimal getMax() {
        return max;
    }

    public boolean hasMin() {
        return min != null;
    }

    public boolean hasMax() {
        return max != null;
    }

    public Map<String, Object> toCanonicalMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("min", min == null ? null : min.toPlainString());
        map.put("max", max == null ? null : max.toPlainString());
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueRange)) return false;
        ValueRange other = (ValueRange) o;
        return Objects.equals(min, other.min) && Objects.equals(max, other.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return "ValueRange{" + (min == null ? "-inf" : min.toPlainString()) + ".."
            + (max == null ? "+inf" : max.toPlainString()) + "}";
    }
}
