package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Per-entity summary for one dimension value (a contractor, organization, area or category).
 *
 * <p>Served from the precomputed snapshot for all-time listings and recomputed from contract rows
 * otherwise. The related counts give the number of distinct entities of the other dimensions the
 * entity has dealt with; the count for the entity's own dimension is always null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EntityAggregate {

    @JsonProperty("entity")
    private String entity;

    @JsonProperty("contract_count")
    private long contractCount;

    @JsonProperty("total_value")
    private BigDecimal totalValue;

    @JsonProperty("average_value")
    private BigDecimal averageValue;

    @JsonProperty("first_contract_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate firstContractDate;

    @JsonProperty("last_contract_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate lastContractDate;

    @JsonProperty("contractor_count")
    private Long contractorCount;

    @JsonProperty("organization_count")
    private Long organizationCount;

    @JsonProperty("area_count")
    private Long areaCount;

    @JsonProperty("category_count")
    private Long categoryCount;

    public EntityAggregate() {
    }

    public String getEntity() {
        return entity;
    }

    public void setEntity(String entity) {
        this.entity = entity;
    }

    public long getContractCount() {
        return contractCount;
    }

    public void setContractCount(long contractCount) {
        this.contractCount = contractCount;
    }

    public BigDecimal getTotalValue() {
        return totalValue;
    }

    public void setTotalValue(BigDecimal totalValue) {
        this.totalValue = totalValue;
    }

    public BigDecimal getAverageValue() {
        return averageValue;
    }

    public void setAverageValue(BigDecimal averageValue) {
        this.averageValue = averageValue;
    }

    public LocalDate getFirstContractDate() {
        return firstContractDate;
    }

    public void setFirstContractDate(LocalDate firstContractDate) {
        this.firstContractDate = firstContractDate;
    }

    public LocalDate getLastContractDate() {
        return lastContractDate;
    }

    public void setLastContractDate(LocalDate lastContractDate) {
        this.lastContractDate = lastContractDate;
    }

    public Long getContractorCount() {
        return contractorCount;
    }

    public void setContractorCount(Long contractorCount) {
        this.contractorCount = contractorCount;
    }

    public Long getOrganizationCount() {
        return organizationCount;
    }

    public void setOrganizationCount(Long organizationCount) {
        this.organizationCount = organizationCount;
    }

    public Long getAreaCount() {
        return areaCount;
    }

    public void setAreaCount(Long areaCount) {
        this.areaCount = areaCount;
    }

    public Long getCategoryCount() {
        return categoryCount;
    }

    public void setCategoryCount(Long categoryCount) {
        this.categoryCount = categoryCount;
    }
}
