package com.bidscope.analytics;

import com.bidscope.domain.SortDirection;

import java.util.Objects;

/**
 * Validated 1-based page coordinates with a sort order.
 *
 * @param <S> the sort-field type of the listing being paged
 */
public class PageRequest<S> {
    private final int page;
    private final int pageSize;
    private final S sortBy;
    private final SortDirection direction;

    public PageRequest(int page, int pageSize, S sortBy, SortDirection direction) {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be at least 1: " + page);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be at least 1: " + pageSize);
        }
        this.page = page;
        this.pageSize = pageSize;
        this.sortBy = Objects.requireNonNull(sortBy, "sortBy");
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    public int getPage() {
        return page;
    }

    public int getPageSize() {
        return pageSize;
    }

    public long getOffset() {
        return (long) (page - 1) * pageSize;
    }

    public S getSortBy() {
        return sortBy;
    }

    public SortDirection getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        return "page=" + page + ", pageSize=" + pageSize + ", sortBy=" + sortBy + ", direction=" + direction;
    }
}
