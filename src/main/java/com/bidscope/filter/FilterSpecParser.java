package com.bidscope.filter;

import com.bidscope.domain.ContractQueryRequest;
import com.bidscope.domain.TimeRangeRequest;
import com.bidscope.domain.ValueRangeRequest;
import com.bidscope.error.ValidationException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns a raw {@link ContractQueryRequest} into a {@link FilterSpec}.
 *
 * <p>Every rule is checked here, before anything is compiled, and a violation fails with a
 * {@link ValidationException} naming the offending field. Nothing is silently dropped except blank
 * chip values. An omitted value range stays absent and is never widened to a default range.
 */
@Component
public class FilterSpecParser {

    static final int MIN_YEAR = 1900;
    static final int MAX_YEAR = 2100;

    public FilterSpec parse(ContractQueryRequest request) {
        if (request == null) {
            return FilterSpec.empty();
        }

        return FilterSpec.builder()
            .contractors(nonNull(request.getContractors()))
            .areas(nonNull(request.getAreas()))
            .organizations(nonNull(request.getOrganizations()))
            .businessCategories(nonNull(request.getBusinessCategories()))
            .keywords(nonNull(request.getKeywords()))
            .timeRanges(parseTimeRanges(request.getTimeRanges()))
            .valueRange(parseValueRange(request.getValueRange()))
            .includeExtended(request.isIncludeExtendedDataset())
            .build();
    }

    List<TimeRange> parseTimeRanges(List<TimeRangeRequest> requests) {
        List<TimeRange> ranges = new ArrayList<>();
        if (requests == null) {
            return ranges;
        }
        for (int i = 0; i < requests.size(); i++) {
            TimeRangeRequest request = requests.get(i);
            String field = "time_ranges[" + i + "]";
            if (request == null) {
                throw new ValidationException(field, "Time range must not be null");
            }
            ranges.add(parseTimeRange(request, field));
        }
        return ranges;
    }

    private TimeRange parseTimeRange(TimeRangeRequest request, String field) {
        String type = request.getType() == null ? "" : request.getType().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "yearly":
                return TimeRange.yearly(requireYear(request.getYear(), field + ".year"));
            case "quarterly": {
                int year = requireYear(request.getYear(), field + ".year");
                Integer quarter = request.getQuarter();
                if (quarter == null) {
                    throw new ValidationException(field + ".quarter", "Quarter is required for a quarterly range");
                }
                if (quarter < 1 || quarter > 4) {
                    throw new ValidationException(field + ".quarter", "Quarter must be between 1 and 4, got " + quarter);
                }
                return TimeRange.quarterly(year, quarter);
            }
            case "custom": {
                LocalDate start = parseDate(request.getStartDate(), field + ".start_date");
                LocalDate end = parseDate(request.getEndDate(), field + ".end_date");
                if (start.isAfter(end)) {
                    throw new ValidationException(field,
                        "Start date " + start + " must not be after end date " + end);
                }
                return TimeRange.custom(start, end);
            }
            default:
                throw new ValidationException(field + ".type",
                    "Unknown time range type '" + request.getType() + "', expected yearly, quarterly or custom");
        }
    }

    Optional<ValueRange> parseValueRange(ValueRangeRequest request) {
        if (request == null || (request.getMin() == null && request.getMax() == null)) {
            return Optional.empty();
        }
        if (request.getMin() != null && request.getMax() != null
            && request.getMin().compareTo(request.getMax()) > 0) {
            throw new ValidationException("value_range",
                "Minimum " + request.getMin().toPlainString() + " exceeds maximum " + request.getMax().toPlainString());
        }
        return Optional.of(new ValueRange(request.getMin(), request.getMax()));
    }

    private static int requireYear(Integer year, String field) {
        if (year == null) {
            throw new ValidationException(field, "Year is required");
        }
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new ValidationException(field, "Year must be between " + MIN_YEAR + " and " + MAX_YEAR + ", got " + year);
        }
        return year;
    }

    private static LocalDate parseDate(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "Date is required");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException(field, "Invalid date '" + value + "', expected yyyy-MM-dd");
        }
    }

    private static List<String> nonNull(List<String> values) {
        return values == null ? List.of() : values;
    }
}
