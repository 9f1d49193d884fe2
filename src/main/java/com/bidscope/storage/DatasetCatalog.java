package com.bidscope.storage;

import com.bidscope.query.Dimension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Names of the relations the engines read and the columns each must expose.
 */
public class DatasetCatalog {

    /** Columns every contract partition must expose. */
    public static final List<String> CONTRACT_COLUMNS = List.of(
        "contract_number", "award_title", "notice_title", "awardee_name", "organization_name",
        "area_of_delivery", "business_category", "contract_amount", "award_date", "search_text");

    /** Columns every entity snapshot must expose, besides the related-entity counts. */
    public static final List<String> SNAPSHOT_COLUMNS = List.of(
        "entity", "contract_count", "total_contract_value", "average_contract_value",
        "first_contract_date", "last_contract_date");

    private final String primaryRelation;
    private final String extendedRelation;
    private final Map<Dimension, String> snapshotRelations;

    public DatasetCatalog(String primaryRelation, String extendedRelation, Map<Dimension, String> snapshotRelations) {
        this.primaryRelation = Objects.requireNonNull(primaryRelation, "primaryRelation");
        this.extendedRelation = Objects.requireNonNull(extendedRelation, "extendedRelation");
        EnumMap<Dimension, String> relations = new EnumMap<>(Dimension.class);
        relations.putAll(snapshotRelations);
        for (Dimension dimension : Dimension.values()) {
            if (!relations.containsKey(dimension)) {
                throw new IllegalArgumentException("No snapshot relation configured for dimension " + dimension.getValue());
            }
        }
        this.snapshotRelations = Collections.unmodifiableMap(relations);
    }

    public String getPrimaryRelation() {
        return primaryRelation;
    }

    public String getExtendedRelation() {
        return extendedRelation;
    }

    public String getSnapshotRelation(Dimension dimension) {
        return snapshotRelations.get(dimension);
    }

    public Map<Dimension, String> getSnapshotRelations() {
        return snapshotRelations;
    }

    /**
     * Columns required of the snapshot for the given dimension: the base columns plus the distinct
     * counts of every other dimension.
     */
    public static List<String> requiredSnapshotColumns(Dimension dimension) {
        List<String> columns = new ArrayList<>(SNAPSHOT_COLUMNS);
        for (Dimension other : Dimension.values()) {
            if (other != dimension) {
                columns.add(other.getCountColumn());
            }
        }
        return columns;
    }
}
