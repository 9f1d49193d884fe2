package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Count and total of contracts awarded in one year, or one month when {@code month} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TimeBucket {

    @JsonProperty("year")
    private int year;

    @JsonProperty("month")
    private Integer month;

    @JsonProperty("label")
    private String label;

    @JsonProperty("count")
    private long count;

    @JsonProperty("total_value")
    private BigDecimal totalValue;

    public TimeBucket() {
    }

    public TimeBucket(int year, Integer month, long count, BigDecimal totalValue) {
        this.year = year;
        this.month = month;
        this.label = month == null ? String.valueOf(year) : String.format("%04d-%02d", year, month);
        this.count = count;
        this.totalValue = totalValue;
    }

    public int getYear() {
        return year;
    }

    public Integer getMonth() {
        return month;
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
}
