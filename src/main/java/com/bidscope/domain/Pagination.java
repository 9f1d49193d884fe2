package com.bidscope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Page metadata returned with every paginated listing. Pages are 1-based.
 */
public class Pagination {

    @JsonProperty("page")
    private int page;

    @JsonProperty("page_size")
    private int pageSize;

    @JsonProperty("total_count")
    private long totalCount;

    @JsonProperty("total_pages")
    private int totalPages;

    @JsonProperty("has_next")
    private boolean hasNext;

    @JsonProperty("has_previous")
    private boolean hasPrevious;

    public Pagination() {
    }

    public static Pagination of(int page, int pageSize, long totalCount) {
        Pagination pagination = new Pagination();
        pagination.page = page;
        pagination.pageSize = pageSize;
        pagination.totalCount = totalCount;
        pagination.totalPages = totalCount == 0 ? 0 : (int) ((totalCount + pageSize - 1) / pageSize);
        pagination.hasNext = page < pagination.totalPages;
        pagination.hasPrevious = page > 1;
        return pagination;
    }

    public int getPage() {
        return page;
    }

    public int getPageSize() {
        return pageSize;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public boolean isHasNext() {
        return hasNext;
    }

    public boolean isHasPrevious() {
        return hasPrevious;
    }
}
