package com.bidscope.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Entity dimensions contracts can be grouped by.
 */
public enum Dimension {
    CONTRACTOR("contractor", "by_contractor", Column.AWARDEE_NAME),
    ORGANIZATION("organization", "by_organization", Column.ORGANIZATION_NAME),
    AREA("area", "by_area", Column.AREA_OF_DELIVERY),
    CATEGORY("business_category", "by_category", Column.BUSINESS_CATEGORY);

    private final String value;
    private final String resultKey;
    private final Column column;

    Dimension(String value, String resultKey, Column column) {
        this.value = value;
        this.resultKey = resultKey;
        this.column = column;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Key of this dimension's breakdown in an aggregate result, e.g. {@code by_contractor}.
     */
    public String getResultKey() {
        return resultKey;
    }

    public Column getColumn() {
        return column;
    }

    /**
     * Column of the aggregate snapshot holding the distinct count of this dimension's entities.
     */
    public String getCountColumn() {
        return this == CATEGORY ? "category_count" : value + "_count";
    }

    /**
     * Accepts the plain name ({@code contractor}), the result key ({@code by_contractor}),
     * and a few plural and short forms.
     */
    public static Dimension fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Dimension must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Dimension dimension : values()) {
            if (dimension.value.equals(normalized) || dimension.resultKey.equals(normalized)) {
                return dimension;
            }
        }
        switch (normalized) {
            case "contractors":
            case "awardee":
                return CONTRACTOR;
            case "organizations":
                return ORGANIZATION;
            case "areas":
                return AREA;
            case "category":
            case "categories":
            case "business_categories":
                return CATEGORY;
            default:
                throw new IllegalArgumentException("Unknown dimension: " + value);
        }
    }
}
