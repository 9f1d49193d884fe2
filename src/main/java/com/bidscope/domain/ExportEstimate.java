package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Approximate size of an export, from a row count and a fixed average row width.
 */
public class ExportEstimate {

    @JsonProperty("total_count")
    private long totalCount;

    @JsonProperty("estimated_csv_bytes")
    private long estimatedBytes;

    public ExportEstimate() {
    }

    public ExportEstimate(long totalCount, long estimatedBytes) {
        this.totalCount = totalCount;
        this.estimatedBytes = estimatedBytes;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public long getEstimatedBytes() {
        return estimatedBytes;
    }
}
