package com.bidscope.filter;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A closed date interval a contract's award date must fall in.
 *
 * <p>Three variants exist: {@link Yearly}, {@link Quarterly} and {@link Custom}. Each resolves to an
 * inclusive {@code [startDate, endDate]} pair, which is all the query compiler needs. Several
 * ranges on one filter are OR'd.
 */
public abstract class TimeRange {

    /** Orders ranges by start, then end, then type; used to canonicalize filters. */
    public static final Comparator<TimeRange> CANONICAL_ORDER = Comparator
        .comparing(TimeRange::getStartDate)
        .thenComparing(TimeRange::getEndDate)
        .thenComparing(TimeRange::getType);

    public abstract String getType();

    public abstract LocalDate getStartDate();

    public abstract LocalDate getEndDate();

    /**
     * Stable key/value view used when fingerprinting a filter.
     */
    public abstract Map<String, Object> toCanonicalMap();

    public static TimeRange yearly(int year) {
        return new Yearly(year);
    }

    public static TimeRange quarterly(int year, int quarter) {
        return new Quarterly(year, quarter);
    }

    public static TimeRange custom(LocalDate startDate, LocalDate endDate) {
        return new Custom(startDate, endDate);
    }

    public static final class Yearly extends TimeRange {
        private final int year;

        Yearly(int year) {
            this.year = year;
        }

        public int getYear() {
            return year;
        }

        @Override
        public String getType() {
            return "yearly";
        }

        @Override
        public LocalDate getStartDate() {
            return LocalDate.of(year, 1, 1);
        }

        @Override
        public LocalDate getEndDate() {
            return LocalDate.of(year, 12, 31);
        }

        @Override
        public Map<String, Object> toCanonicalMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("type", getType());
            map.put("year", year);
            return map;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Yearly)) return false;
            return ((Yearly) o).year == year;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(year);
        }

        @Override
        public String toString() {
            return "Yearly{" + year + "}";
        }
    }

    public static final class Quarterly extends TimeRange {
        private final int year;
        private final int quarter;

        Quarterly(int year, int quarter) {
            if (quarter < 1 || quarter > 4) {
                throw new IllegalArgumentException("Quarter must be between 1 and 4: " + quarter);
            }
            this.year = year;
            this.quarter = quarter;
        }

        public int getYear() {
            return year;
        }

        public int getQuarter() {
            return quarter;
        }

        @Override
        public String getType() {
            return "quarterly";
        }

        @Override
        public LocalDate getStartDate() {
            return LocalDate.of(year, quarter * 3 - 2, 1);
        }

        @Override
        public LocalDate getEndDate() {
            LocalDate lastMonth = LocalDate.of(year, quarter * 3, 1);
            return lastMonth.withDayOfMonth(lastMonth.lengthOfMonth());
        }

        @Override
        public Map<String, Object> toCanonicalMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("type", getType());
            map.put("year", year);
            map.put("quarter", quarter);
            return map;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Quarterly)) return false;
            Quarterly other = (Quarterly) o;
            return other.year == year && other.quarter == quarter;
        }

        @Override
        public int hashCode() {
            return Objects.hash(year, quarter);
        }

        @Override
        public String toString() {
            return "Quarterly{" + year + "-Q" + quarter + "}";
        }
    }

    public static final class Custom extends TimeRange {
        private final LocalDate startDate;
        private final LocalDate endDate;

        Custom(LocalDate startDate, LocalDate endDate) {
            Objects.requireNonNull(startDate, "startDate");
            Objects.requireNonNull(endDate, "endDate");
            if (startDate.isAfter(endDate)) {
                throw new IllegalArgumentException("Start date " + startDate + " is after end date " + endDate);
            }
            this.startDate = startDate;
            this.endDate = endDate;
        }

        @Override
        public String getType() {
            return "custom";
        }

        @Override
        public LocalDate getStartDate() {
            return startDate;
        }

        @Override
        public LocalDate getEndDate() {
            return endDate;
        }

        @Override
        public Map<String, Object> toCanonicalMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("type", getType());
            map.put("start_date", startDate.toString());
            map.put("end_date", endDate.toString());
            return map;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Custom)) return false;
            Custom other = (Custom) o;
            return other.startDate.equals(startDate) && other.endDate.equals(endDate);
        }

        @Override
        public int hashCode() {
            return Objects.hash(startDate, endDate);
        }

        @Override
        public String toString() {
            return "Custom{" + startDate + ".." + endDate + "}";
        }
    }
}
