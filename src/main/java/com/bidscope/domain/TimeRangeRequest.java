package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw time range as sent by clients. Which fields are required depends on {@code type}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TimeRangeRequest {

    @JsonProperty("type")
    private String type;

    @JsonProperty("year")
    private Integer year;

    @JsonProperty("quarter")
    private Integer quarter;

    @JsonProperty("start_date")
    @JsonAlias("startDate")
    private String startDate;

    @JsonProperty("end_date")
    @JsonAlias("endDate")
    private String endDate;

    public TimeRangeRequest() {
    }

    public TimeRangeRequest(String type, Integer year, Integer quarter, String startDate, String endDate) {
        this.type = type;
        this.year = year;
        this.quarter = quarter;
        this.startDate = startDate;
        this.endDate = endDate;
    }

    public static TimeRangeRequest yearly(int year) {
        return new TimeRangeRequest("yearly", year, null, null, null);
    }

    public static TimeRangeRequest quarterly(int year, int quarter) {
        return new TimeRangeRequest("quarterly", year, quarter, null, null);
    }

    public static TimeRangeRequest custom(String startDate, String endDate) {
        return new TimeRangeRequest("custom", null, null, startDate, endDate);
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Integer getYear() {
        return year;
    }

    public void setYear(Integer year) {
        this.year = year;
    }

    public Integer getQuarter() {
        return quarter;
    }

    public void setQuarter(Integer quarter) {
        this.quarter = quarter;
    }

    public String getStartDate() {
        return startDate;
    }

    public void setStartDate(String startDate) {
        this.startDate = startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public void setEndDate(String endDate) {
        this.endDate = endDate;
    }
}
