package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public class HistogramBin {

    @JsonProperty("bin_number")
    private int binNumber;

    @JsonProperty("bin_start")
    private BigDecimal binStart;

    @JsonProperty("bin_end")
    private BigDecimal binEnd;

    @JsonProperty("count")
    private long count;

    @JsonProperty("total_value")
    private BigDecimal totalValue;

    @JsonProperty("avg_value")
    private BigDecimal avgValue;

    public HistogramBin() {
    }

    public HistogramBin(int binNumber, BigDecimal binStart, BigDecimal binEnd,
                        long count, BigDecimal totalValue, BigDecimal avgValue) {
        this.binNumber = binNumber;
        this.binStart = binStart;
        this.binEnd = binEnd;
        this.count = count;
        this.totalValue = totalValue;
        this.avgValue = avgValue;
    }

    public int getBinNumber() {
        return binNumber;
    }

    public BigDecimal getBinStart() {
        return binStart;
    }

    public BigDecimal getBinEnd() {
        return binEnd;
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
