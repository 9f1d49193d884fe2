package com.bidscope.query;

/**
 * Relation a plan reads from.
 */
public enum PlanSource {
    /** Contract records of the primary partition. */
    PRIMARY,
    /** UNION ALL of the primary and extended partitions, taken before filtering. */
    PRIMARY_AND_EXTENDED,
    /** Precomputed all-time per-entity aggregates of one dimension. */
    ENTITY_SNAPSHOT
}
