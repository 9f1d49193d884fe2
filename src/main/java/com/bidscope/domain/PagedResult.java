package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of rows together with its pagination metadata.
 */
public class PagedResult<T> {

    @JsonProperty("data")
    private List<T> data;

    @JsonProperty("pagination")
    private Pagination pagination;

    public PagedResult() {
        this.data = new ArrayList<>();
    }

    public PagedResult(List<T> data, Pagination pagination) {
        this.data = data != null ? data : new ArrayList<>();
        this.pagination = pagination;
    }

    public List<T> getData() {
        return data;
    }

    public Pagination getPagination() {
        return pagination;
    }
}
