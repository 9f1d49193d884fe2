package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body shared by the search, aggregate, distribution, export and task endpoints.
 * Filter fields are turned into a {@code FilterSpec}; the remaining fields parameterize the
 * operation and are ignored where they do not apply.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContractQueryRequest {

    @JsonProperty("contractors")
    private List<String> contractors = new ArrayList<>();

    @JsonProperty("areas")
    private List<String> areas = new ArrayList<>();

    @JsonProperty("organizations")
    private List<String> organizations = new ArrayList<>();

    @JsonProperty("business_categories")
    @JsonAlias("businessCategories")
    private List<String> businessCategories = new ArrayList<>();

    @JsonProperty("keywords")
    private List<String> keywords = new ArrayList<>();

    @JsonProperty("time_ranges")
    @JsonAlias("timeRanges")
    private List<TimeRangeRequest> timeRanges = new ArrayList<>();

    @JsonProperty("value_range")
    @JsonAlias("valueRange")
    private ValueRangeRequest valueRange;

    @JsonProperty("include_extended_dataset")
    @JsonAlias({"includeExtendedDataset", "include_flood_control"})
    private boolean includeExtendedDataset;

    @JsonProperty("page")
    private Integer page;

    @JsonProperty("page_size")
    @JsonAlias("pageSize")
    private Integer pageSize;

    @JsonProperty("sort_by")
    @JsonAlias("sortBy")
    private String sortBy;

    @JsonProperty("sort_direction")
    @JsonAlias("sortDirection")
    private String sortDirection;

    @JsonProperty("dimension")
    private String dimension;

    @JsonProperty("num_bins")
    @JsonAlias("numBins")
    private Integer numBins;

    @JsonProperty("top_n")
    @JsonAlias("topN")
    private Integer topN;

    public List<String> getContractors() {
        return contractors;
    }

    public void setContractors(List<String> contractors) {
        this.contractors = contractors;
    }

    public List<String> getAreas() {
        return areas;
    }

    public void setAreas(List<String> areas) {
        this.areas = areas;
    }

    public List<String> getOrganizations() {
        return organizations;
    }

    public void setOrganizations(List<String> organizations) {
        this.organizations = organizations;
    }

    public List<String> getBusinessCategories() {
        return businessCategories;
    }

    public void setBusinessCategories(List<String> businessCategories) {
        this.businessCategories = businessCategories;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords;
    }

    public List<TimeRangeRequest> getTimeRanges() {
        return timeRanges;
    }

    public void setTimeRanges(List<TimeRangeRequest> timeRanges) {
        this.timeRanges = timeRanges;
    }

    public ValueRangeRequest getValueRange() {
        return valueRange;
    }

    public void setValueRange(ValueRangeRequest valueRange) {
        this.valueRange = valueRange;
    }

    public boolean isIncludeExtendedDataset() {
        return includeExtendedDataset;
    }

    public void setIncludeExtendedDataset(boolean includeExtendedDataset) {
        this.includeExtendedDataset = includeExtendedDataset;
    }

    public Integer getPage() {
        return page;
    }

    public void setPage(Integer page) {
        this.page = page;
    }

    public Integer getPageSize() {
        return pageSize;
    }

    public void setPageSize(Integer pageSize) {
        this.pageSize = pageSize;
    }

    public String getSortBy() {
        return sortBy;
    }

    public void setSortBy(String sortBy) {
        this.sortBy = sortBy;
    }

    public String getSortDirection() {
        return sortDirection;
    }

    public void setSortDirection(String sortDirection) {
        this.sortDirection = sortDirection;
    }

    public String getDimension() {
        return dimension;
    }

    public void setDimension(String dimension) {
        this.dimension = dimension;
    }

    public Integer getNumBins() {
        return numBins;
    }

    public void setNumBins(Integer numBins) {
        this.numBins = numBins;
    }

    public Integer getTopN() {
        return topN;
    }

    public void setTopN(Integer topN) {
        this.topN = topN;
    }
}
