package com.bidscope.query;

/**
 * The operation a plan is compiled for.
 */
public enum QueryTarget {
    SEARCH,
    AGGREGATE,
    HISTOGRAM,
    EXPORT,
    ENTITY_LISTING
}
