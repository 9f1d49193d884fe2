package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One entity's share of a filtered result: how many contracts and how much value.
 */
public class DimensionRow {

    @JsonProperty("label")
    private String label;

    @JsonProperty("count")
    private long count;

    @JsonProperty("total_value")
    private BigDecimal totalValue;

    @JsonProperty("avg_value")
    private BigDecimal avgValue;

    public DimensionRow() {
    }

    public DimensionRow(String label, long count, BigDecimal totalValue, BigDecimal avgValue) {
        this.label = label;
        this.count = count;
        this.totalValue = totalValue;
        this.avgValue = avgValue;
    }

    public String getLabel() {
        return label;
    }

    public long getCount() {
        return count;
    }

    public BigDecimal getTotalValue() {
        return totalValue;
    }

    public BigDecimal getAvgValue() {
        return avgValue;
    }
}
