package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One contract award row as returned by searches.
 *
 * Rows are produced by the external ETL pipeline and are read-only here. Every field except
 * the contract number may be null in the source data.
 */
public class ContractRecord {

    @JsonProperty("contract_number")
    private String contractNumber;

    @JsonProperty("award_title")
    private String awardTitle;

    @JsonProperty("notice_title")
    private String noticeTitle;

    @JsonProperty("awardee_name")
    private String awardeeName;

    @JsonProperty("organization_name")
    private String organizationName;

    @JsonProperty("area_of_delivery")
    private String areaOfDelivery;

    @JsonProperty("business_category")
    private String businessCategory;

    @JsonProperty("contract_amount")
    private BigDecimal contractAmount;

    @JsonProperty("award_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate awardDate;

    public ContractRecord() {
    }

    public String getContractNumber() {
        return contractNumber;
    }

    public void setContractNumber(String contractNumber) {
        this.contractNumber = contractNumber;
    }

    public String getAwardTitle() {
        return awardTitle;
    }

    public void setAwardTitle(String awardTitle) {
        this.awardTitle = awardTitle;
    }

    public String getNoticeTitle() {
        return noticeTitle;
    }

    public void setNoticeTitle(String noticeTitle) {
        this.noticeTitle = noticeTitle;
    }

    public String getAwardeeName() {
        return awardeeName;
    }

    public void setAwardeeName(String awardeeName) {
        this.awardeeName = awardeeName;
    }

    public String getOrganizationName() {
        return organizationName;
    }

    public void setOrganizationName(String organizationName) {
        this.organizationName = organizationName;
    }

    public String getAreaOfDelivery() {
        return areaOfDelivery;
    }

    public void setAreaOfDelivery(String areaOfDelivery) {
        this.areaOfDelivery = areaOfDelivery;
    }

    public String getBusinessCategory() {
        return businessCategory;
    }

    public void setBusinessCategory(String businessCategory) {
        this.businessCategory = businessCategory;
    }

    public BigDecimal getContractAmount() {
        return contractAmount;
    }

    public void setContractAmount(BigDecimal contractAmount) {
        this.contractAmount = contractAmount;
    }

    public LocalDate getAwardDate() {
        return awardDate;
    }

    public void setAwardDate(LocalDate awardDate) {
        this.awardDate = awardDate;
    }
}
