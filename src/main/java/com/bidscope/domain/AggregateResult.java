package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-dimensional breakdown of one filtered contract set.
 *
 * <p>All parts are computed from the same snapshot of the data. Dimension breakdowns exclude
 * contracts whose label is NULL, so their counts may sum to less than the summary count but never
 * more. An empty filtered set yields a zero summary and empty lists.
 */
public class AggregateResult {

    @JsonProperty("summary")
    private AggregateSummary summary = AggregateSummary.empty();

    @JsonProperty("by_year")
    private List<TimeBucket> byYear = new ArrayList<>();

    @JsonProperty("by_month")
    private List<TimeBucket> byMonth = new ArrayList<>();

    @JsonProperty("by_contractor")
    private List<DimensionRow> byContractor = new ArrayList<>();

    @JsonProperty("by_organization")
    private List<DimensionRow> byOrganization = new ArrayList<>();

    @JsonProperty("by_area")
    private List<DimensionRow> byArea = new ArrayList<>();

    @JsonProperty("by_category")
    private List<DimensionRow> byCategory = new ArrayList<>();

    public AggregateSummary getSummary() {
        return summary;
    }

    public void setSummary(AggregateSummary summary) {
        this.summary = summary;
    }

    public List<TimeBucket> getByYear() {
        return byYear;
    }

    public void setByYear(List<TimeBucket> byYear) {
        this.byYear = byYear;
    }

    public List<TimeBucket> getByMonth() {
        return byMonth;
    }

    public void setByMonth(List<TimeBucket> byMonth) {
        this.byMonth = byMonth;
    }

    public List<DimensionRow> getByContractor() {
        return byContractor;
    }

    public void setByContractor(List<DimensionRow> byContractor) {
        this.byContractor = byContractor;
    }

    public List<DimensionRow> getByOrganization() {
        return byOrganization;
    }

    public void setByOrganization(List<DimensionRow> byOrganization) {
        this.byOrganization = byOrganization;
    }

    public List<DimensionRow> getByArea() {
        return byArea;
    }

    public void setByArea(List<DimensionRow> byArea) {
        this.byArea = byArea;
    }

    public List<DimensionRow> getByCategory() {
        return byCategory;
    }

    public void setByCategory(List<DimensionRow> byCategory) {
        this.byCategory = byCategory;
    }
}
