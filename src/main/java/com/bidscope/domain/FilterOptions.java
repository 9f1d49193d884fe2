package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Distinct values available for each chip filter, plus the award years present.
 */
public class FilterOptions {

    @JsonProperty("contractors")
    private List<String> contractors = new ArrayList<>();

    @JsonProperty("areas")
    private List<String> areas = new ArrayList<>();

    @JsonProperty("organizations")
    private List<String> organizations = new ArrayList<>();

    @JsonProperty("business_categories")
    private List<String> businessCategories = new ArrayList<>();

    @JsonProperty("years")
    private List<Integer> years = new ArrayList<>();

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

    public List<Integer> getYears() {
        return years;
    }

    public void setYears(List<Integer> years) {
        this.years = years;
    }
}
