package com.bidscope.filter;

import com.bidscope.domain.ContractQueryRequest;
import com.bidscope.domain.TimeRangeRequest;
import com.bidscope.domain.ValueRangeRequest;
import com.bidscope.error.ErrorKind;
import com.bidscope.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FilterSpecParser Tests")
class FilterSpecParserTest {

    private FilterSpecParser parser;

    @BeforeEach
    void setUp() {
        parser = new FilterSpecParser();
    }

    // ========== Normalization ==========

    @Test
    @DisplayName("Should treat a null request as the empty filter")
    void shouldParseNullRequestAsEmpty() {
        FilterSpec spec = parser.parse(null);

        assertThat(spec).isEqualTo(FilterSpec.empty());
        assertThat(spec.isAllTime()).isTrue();
        assertThat(spec.hasRowFilters()).isFalse();
    }

    @Test
    @DisplayName("Should lower-case, trim, de-duplicate and drop blank chip values")
    void shouldNormalizeChipValues() {
        // Given
        ContractQueryRequest request = new ContractQueryRequest();
        request.setContractors(Arrays.asList("  Apex Builders ", "apex builders", "", "   ", null));
        request.setAreas(List.of("Cagayan"));

        // When
        FilterSpec spec = parser.parse(request);

        // Then
        assertThat(spec.getContractors()).containsExactly("apex builders");
        assertThat(spec.getAreas()).containsExactly("cagayan");
        assertThat(spec.hasRowFilters()).isTrue();
    }

    @Test
    @DisplayName("Should produce equal specs for requests differing only in order and case")
    void shouldBeOrderAndCaseInsensitive() {
        ContractQueryRequest first = new ContractQueryRequest();
        first.setKeywords(List.of("Road", "farm"));
        first.setTimeRanges(List.of(TimeRangeRequest.yearly(2022), TimeRangeRequest.quarterly(2021, 3)));

        ContractQueryRequest second = new ContractQueryRequest();
        second.setKeywords(List.of("FARM", "road"));
        second.setTimeRanges(List.of(TimeRangeRequest.quarterly(2021, 3), TimeRangeRequest.yearly(2022)));

        assertThat(parser.parse(first)).isEqualTo(parser.parse(second));
        assertThat(parser.parse(first).hashCode()).isEqualTo(parser.parse(second).hashCode());
    }

    @Test
    @DisplayName("Should normalize spacing around && sub-tokens")
    void shouldNormalizeAndGroups() {
        ContractQueryRequest request = new ContractQueryRequest();
        request.setKeywords(List.of(" Farm && Road ", "farm&&road", "&&"));

        FilterSpec spec = parser.parse(request);

        assertThat(spec.getKeywords()).containsExactly("farm&&road");
        assertThat(FilterSpec.subTokens("farm&&road")).containsExactly("farm", "road");
    }

    // ========== Time ranges ==========

    @Test
    @DisplayName("Should resolve yearly, quarterly and custom ranges to inclusive dates")
    void shouldResolveTimeRanges() {
        ContractQueryRequest request = new ContractQueryRequest();
        request.setTimeRanges(List.of(
            TimeRangeRequest.yearly(2020),
            TimeRangeRequest.quarterly(2024, 1),
            TimeRangeRequest.custom("2019-03-15", "2019-04-01")));

        List<TimeRange> ranges = parser.parse(request).getTimeRanges();

        assertThat(ranges).hasSize(3);
        assertThat(ranges.get(0).getStartDate()).isEqualTo(LocalDate.of(2019, 3, 15));
        assertThat(ranges.get(1).getStartDate()).isEqualTo(LocalDate.of(2020, 1, 1));
        assertThat(ranges.get(1).getEndDate()).isEqualTo(LocalDate.of(2020, 12, 31));
        assertThat(ranges.get(2).getStartDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(ranges.get(2).getEndDate()).isEqualTo(LocalDate.of(2024, 3, 31));
    }

    @Test
    @DisplayName("Should end quarters on the last day of their final month")
    void shouldResolveQuarterEnds() {
        assertThat(TimeRange.quarterly(2024, 4).getEndDate()).isEqualTo(LocalDate.of(2024, 12, 31));
        assertThat(TimeRange.quarterly(2023, 2).getEndDate()).isEqualTo(LocalDate.of(2023, 6, 30));
    }

    @Test
    @DisplayName("Should reject a quarter outside 1..4 naming the field")
    void shouldRejectInvalidQuarter() {
        ContractQueryRequest request = new ContractQueryRequest();
        request.setTimeRanges(List.of(TimeRangeRequest.quarterly(2022, 5)));

        assertThatThrownBy(() -> parser.parse(request))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("time_ranges[0].quarter"));
    }

    @Test
    @DisplayName("Should reject a custom range whose start is after its end")
    void shouldRejectInvertedCustomRange() {
        ContractQueryRequest request = new ContractQueryRequest();
        request.setTimeRanges(List.of(TimeRangeRequest.custom("2022-05-01", "2022-04-30")));

        assertThatThrownBy(() -> parser.parse(request))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getKind()).isEqualTo(ErrorKind.VALIDATION));
    }

    @Test
    @DisplayName("Should reject malformed dates and unknown range types")
    void shouldRejectMalformedRanges() {
        ContractQueryRequest badDate = new ContractQueryRequest();
        badDate.setTimeRanges(List.of(TimeRangeRequest.custom("2022-13-01", "2022-12-31")));
        ContractQueryRequest badType = new ContractQueryRequest();
        badType.setTimeRanges(List.of(new TimeRangeRequest("weekly", 2022, null, null, null)));

        assertThatThrownBy(() -> parser.parse(badDate))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("time_ranges[0].start_date"));
        assertThatThrownBy(() -> parser.parse(badType))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("time_ranges[0].type"));
    }

    @Test
    @DisplayName("Should reject a null entry in the time range list")
    void shouldRejectNullTimeRange() {
        ContractQueryRequest request = new ContractQueryRequest();
        List<TimeRangeRequest> ranges = new ArrayList<>();
        ranges.add(TimeRangeRequest.yearly(2021));
        ranges.add(null);
        request.setTimeRanges(ranges);

        assertThatThrownBy(() -> parser.parse(request))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("time_ranges[1]"));
    }

    // ========== Value range ==========

    @Test
    @DisplayName("Should leave an omitted value range absent")
    void shouldKeepValueRangeAbsent() {
        ContractQueryRequest request = new ContractQueryRequest();
        request.setValueRange(new ValueRangeRequest(null, null));

        assertThat(parser.parse(request).getValueRange()).isEmpty();
        assertThat(parser.parse(new ContractQueryRequest()).getValueRange()).isEmpty();
    }

    @Test
    @DisplayName("Should accept a half-open value range")
    void shouldAcceptHalfOpenValueRange() {
        ContractQueryRequest request = new ContractQueryRequest();
        request.setValueRange(new ValueRangeRequest(new BigDecimal("4000000"), null));

        ValueRange range = parser.parse(request).getValueRange().orElseThrow();

        assertThat(range.hasMin()).isTrue();
        assertThat(range.hasMax()).isFalse();
    }

    @Test
    @DisplayName("Should reject a value range whose minimum exceeds its maximum")
    void shouldRejectInvertedValueRange() {
        ContractQueryRequest request = new ContractQueryRequest();
        request.setValueRange(new ValueRangeRequest(new BigDecimal("6000000"), new BigDecimal("4000000")));

        assertThatThrownBy(() -> parser.parse(request))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("value_range");
    }

    @Test
    @DisplayName("Should treat numerically equal bounds with different scales as the same range")
    void shouldCompareValueRangesNumerically() {
        ValueRange a = new ValueRange(new BigDecimal("4000000.00"), new BigDecimal("6000000"));
        ValueRange b = new ValueRange(new BigDecimal("4000000"), new BigDecimal("6000000.0"));

        assertThat(a).isEqualTo(b);
        assertThat(a.toCanonicalMap()).isEqualTo(b.toCanonicalMap());
    }

    // ========== Canonical form ==========

    @Test
    @DisplayName("Should expose a canonical map with sorted keys")
    void shouldExposeCanonicalMap() {
        ContractQueryRequest request = new ContractQueryRequest();
        request.setOrganizations(List.of("DPWH"));
        request.setIncludeExtendedDataset(true);

        FilterSpec spec = parser.parse(request);

        assertThat(spec.toCanonicalMap().keySet()).containsExactly(
            "areas", "business_categories", "contractors", "include_extended_dataset",
            "keywords", "organizations", "time_ranges", "value_range");
        assertThat(spec.toCanonicalMap().get("organizations")).isEqualTo(List.of("dpwh"));
        assertThat(spec.isIncludeExtended()).isTrue();
    }
}
