package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Equal-width distribution of contract amounts.
 *
 * <p>The bins partition {@code [min_value, max_value]} without gaps or overlap, and the sum of
 * their counts always equals {@code total_contracts}. When every amount is equal there is a
 * single bin and {@code bin_width} is zero.
 */
public class HistogramResult {

    @JsonProperty("min_value")
    private BigDecimal minValue;

    @JsonProperty("max_value")
    private BigDecimal maxValue;

    @JsonProperty("bin_width")
    private BigDecimal binWidth;

    @JsonProperty("num_bins")
    private int numBins;

    @JsonProperty("total_contracts")
    private long totalContracts;

    @JsonProperty("total_value")
    private BigDecimal totalValue;

    @JsonProperty("bins")
    private List<HistogramBin> bins;

    public HistogramResult() {
        this.bins = new ArrayList<>();
    }

    public HistogramResult(BigDecimal minValue, BigDecimal maxValue, BigDecimal binWidth, int numBins,
                           long totalContracts, BigDecimal totalValue, List<HistogramBin> bins) {
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.binWidth = binWidth;
        this.numBins = numBins;
        this.totalContracts = totalContracts;
        this.totalValue = totalValue;
        this.bins = bins;
    }

    public static HistogramResult empty(int numBins) {
        return new HistogramResult(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, numBins, 0,
            BigDecimal.ZERO, new ArrayList<>());
    }

    public BigDecimal getMinValue() {
        return minValue;
    }

    public BigDecimal getMaxValue() {
        return maxValue;
    }

    public BigDecimal getBinWidth() {
        return binWidth;
    }

    public int getNumBins() {
        return numBins;
    }

    public long getTotalContracts() {
        return totalContracts;
    }

    public BigDecimal getTotalValue() {
        return totalValue;
    }

    public List<HistogramBin> getBins() {
        return bins;
    }
}
