package com.bidscope.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Validated, normalized search criteria over contract awards.
 *
 * <p>Chip filters (contractors, areas, organizations, business categories) are sets whose members
 * are OR'd; different chip types are AND'd with each other and with the keyword, time and value
 * restrictions. A keyword token may join several sub-tokens with {@code &&}; all of them must then
 * occur in the record's search text.
 *
 * <p>Instances are immutable. Values are lower-cased, trimmed, de-duplicated and sorted on
 * construction so that requests differing only in ordering or case produce equal specs and equal
 * fingerprints.
 */
public final class FilterSpec {

    /** Separator joining the sub-tokens of one AND-group. */
    public static final String AND_SEPARATOR = "&&";

    private static final FilterSpec EMPTY = builder().build();

    private final SortedSet<String> contractors;
    private final SortedSet<String> areas;
    private final SortedSet<String> organizations;
    private final SortedSet<String> businessCategories;
    private final SortedSet<String> keywords;
    private final List<TimeRange> timeRanges;
    private final Optional<ValueRange> valueRange;
    private final boolean includeExtended;

    private FilterSpec(Builder builder) {
        this.contractors = normalize(builder.contractors);
        this.areas = normalize(builder.areas);
        this.organizations = normalize(builder.organizations);
        this.businessCategories = normalize(builder.businessCategories);
        this.keywords = normalize(builder.keywords);
        TreeSet<TimeRange> ranges = new TreeSet<>(TimeRange.CANONICAL_ORDER);
        ranges.addAll(builder.timeRanges);
        this.timeRanges = Collections.unmodifiableList(new ArrayList<>(ranges));
        this.valueRange = Objects.requireNonNull(builder.valueRange, "valueRange");
        this.includeExtended = builder.includeExtended;
    }

    public static FilterSpec empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SortedSet<String> getContractors() {
        return contractors;
    }

    public SortedSet<String> getAreas() {
        return areas;
    }

    public SortedSet<String> getOrganizations() {
        return organizations;
    }

    public SortedSet<String> getBusinessCategories() {
        return businessCategories;
    }

    public SortedSet<String> getKeywords() {
        return keywords;
    }

    public List<TimeRange> getTimeRanges() {
        return timeRanges;
    }

    public Optional<ValueRange> getValueRange() {
        return valueRange;
    }

    public boolean isIncludeExtended() {
        return includeExtended;
    }

    /**
     * True when no time range restricts the spec, i.e. it covers the whole dataset history.
     */
    public boolean isAllTime() {
        return timeRanges.isEmpty();
    }

    /**
     * True when any chip, keyword or value restriction is present.
     */
    public boolean hasRowFilters() {
        return !contractors.isEmpty() || !areas.isEmpty() || !organizations.isEmpty()
            || !businessCategories.isEmpty() || !keywords.isEmpty() || valueRange.isPresent();
    }

    /**
     * Splits a normalized value into its AND'd sub-tokens.
     */
    public static List<String> subTokens(String value) {
        List<String> parts = new ArrayList<>();
        for (String part : value.split(AND_SEPARATOR, -1)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    /**
     * Deterministic nested-map view with sorted keys, used for fingerprinting.
     */
    public Map<String, Object> toCanonicalMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("areas", new ArrayList<>(areas));
        map.put("business_categories", new ArrayList<>(businessCategories));
        map.put("contractors", new ArrayList<>(contractors));
        map.put("include_extended_dataset", includeExtended);
        map.put("keywords", new ArrayList<>(keywords));
        map.put("organizations", new ArrayList<>(organizations));
        List<Map<String, Object>> ranges = new ArrayList<>();
        for (TimeRange range : timeRanges) {
            ranges.add(range.toCanonicalMap());
        }
        map.put("time_ranges", ranges);
        map.put("value_range", valueRange.map(ValueRange::toCanonicalMap).orElse(null));
        return map;
    }

    private static SortedSet<String> normalize(Collection<String> values) {
        TreeSet<String> normalized = new TreeSet<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            List<String> parts = subTokens(value.toLowerCase(Locale.ROOT));
            if (!parts.isEmpty()) {
                normalized.add(String.join(AND_SEPARATOR, parts));
            }
        }
        return Collections.unmodifiableSortedSet(normalized);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterSpec)) return false;
        FilterSpec other = (FilterSpec) o;
        return includeExtended == other.includeExtended
            && contractors.equals(other.contractors)
            && areas.equals(other.areas)
            && organizations.equals(other.organizations)
            && businessCategories.equals(other.businessCategories)
            && keywords.equals(other.keywords)
            && timeRanges.equals(other.timeRanges)
            && valueRange.equals(other.valueRange);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contractors, areas, organizations, businessCategories, keywords,
            timeRanges, valueRange, includeExtended);
    }

    @Override
    public String toString() {
        return "FilterSpec{" +
            "contractors=" + contractors +
            ", areas=" + areas +
            ", organizations=" + organizations +
            ", businessCategories=" + businessCategories +
            ", keywords=" + keywords +
            ", timeRanges=" + timeRanges +
            ", valueRange=" + valueRange +
            ", includeExtended=" + includeExtended +
            '}';
    }

    public static final class Builder {
        private final List<String> contractors = new ArrayList<>();
        private final List<String> areas = new ArrayList<>();
        private final List<String> organizations = new ArrayList<>();
        private final List<String> businessCategories = new ArrayList<>();
        private final List<String> keywords = new ArrayList<>();
        private final List<TimeRange> timeRanges = new ArrayList<>();
        private Optional<ValueRange> valueRange = Optional.empty();
        private boolean includeExtended;

        private Builder() {
        }

        public Builder contractors(Collection<String> values) {
            contractors.addAll(values);
            return this;
        }

        public Builder contractor(String value) {
            contractors.add(value);
            return this;
        }

        public Builder areas(Collection<String> values) {
            areas.addAll(values);
            return this;
        }

        public Builder area(String value) {
            areas.add(value);
            return this;
        }

        public Builder organizations(Collection<String> values) {
            organizations.addAll(values);
            return this;
        }

        public Builder organization(String value) {
            organizations.add(value);
            return this;
        }

        public Builder businessCategories(Collection<String> values) {
            businessCategories.addAll(values);
            return this;
        }

        public Builder businessCategory(String value) {
            businessCategories.add(value);
            return this;
        }

        public Builder keywords(Collection<String> values) {
            keywords.addAll(values);
            return this;
        }

        public Builder keyword(String value) {
            keywords.add(value);
            return this;
        }

        public Builder timeRanges(Collection<TimeRange> values) {
            timeRanges.addAll(values);
            return this;
        }

        public Builder timeRange(TimeRange value) {
            timeRanges.add(value);
            return this;
        }

        public Builder valueRange(Optional<ValueRange> value) {
            this.valueRange = value;
            return this;
        }

        public Builder valueRange(ValueRange value) {
            this.valueRange = Optional.of(value);
            return this;
        }

        public Builder includeExtended(boolean value) {
            this.includeExtended = value;
            return this;
        }

        public FilterSpec build() {
            return new FilterSpec(this);
        }
    }
}
