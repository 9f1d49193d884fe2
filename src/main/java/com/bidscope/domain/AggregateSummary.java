package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public class AggregateSummary {

    @JsonProperty("count")
    private long count;

    @JsonProperty("total_value")
    private BigDecimal totalValue;

    @JsonProperty("avg_value")
    private BigDecimal avgValue;

    public AggregateSummary() {
        this(0, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public AggregateSummary(long count, BigDecimal totalValue, BigDecimal avgValue) {
        this.count = count;
        this.totalValue = totalValue;
        this.avgValue = avgValue;
    }

    public static AggregateSummary empty() {
        return new AggregateSummary();
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
