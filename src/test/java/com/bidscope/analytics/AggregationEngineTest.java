package com.bidscope.analytics;

import com.bidscope.analytics.AggregationEngine.DimensionSort;
import com.bidscope.analytics.AggregationEngine.EntitySort;
import com.bidscope.analytics.ContractSearchEngine.SortField;
import com.bidscope.domain.AggregateResult;
import com.bidscope.domain.ContractRecord;
import com.bidscope.domain.DimensionRow;
import com.bidscope.domain.EntityAggregate;
import com.bidscope.domain.PagedResult;
import com.bidscope.domain.SortDirection;
import com.bidscope.domain.TimeBucket;
import com.bidscope.filter.FilterSpec;
import com.bidscope.filter.TimeRange;
import com.bidscope.filter.ValueRange;
import com.bidscope.query.Dimension;
import com.bidscope.query.QueryCompiler;
import com.bidscope.query.QueryMetrics;
import com.bidscope.query.QueryPlan;
import com.bidscope.query.QueryTarget;
import com.bidscope.storage.ContractFixture;
import com.bidscope.storage.ContractFixture.Contract;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for AggregationEngine against the in-memory contract fixture.
 * Expected values are computed from the generated rows, not from SQL.
 */
@DisplayName("AggregationEngine Tests")
class AggregationEngineTest {

    private static ContractFixture fixture;

    private final QueryCompiler compiler = new QueryCompiler();
    private QueryMetrics metrics;
    private AggregationEngine engine;
    private ContractSearchEngine searchEngine;

    @BeforeAll
    static void setUpDataset() {
        fixture = ContractFixture.create();
    }

    @AfterAll
    static void tearDown() throws Exception {
        fixture.close();
    }

    @BeforeEach
    void setUp() {
        metrics = new QueryMetrics(new SimpleMeterRegistry());
        metrics.init();
        engine = new AggregationEngine(fixture.getJdbcTemplate(), fixture.getTransactionTemplate(),
            fixture.renderer(), compiler, metrics);
        searchEngine = new ContractSearchEngine(fixture.getJdbcTemplate(), fixture.getTransactionTemplate(),
            fixture.renderer(), metrics);
    }

    private QueryPlan plan(FilterSpec spec) {
        return compiler.compile(spec, QueryTarget.AGGREGATE);
    }

    private static Predicate<Contract> cagayanConcreting() {
        return c -> Contract.contains(c.areaOfDelivery, "cagayan")
            && Contract.contains(c.searchText(), "concreting")
            && c.amountBetween(4_000_000, 6_000_000);
    }

    private static FilterSpec cagayanConcretingSpec() {
        return FilterSpec.builder()
            .area("Cagayan")
            .keyword("concreting")
            .valueRange(new ValueRange(new BigDecimal("4000000"), new BigDecimal("6000000")))
            .build();
    }

    // ========== Combined filters ==========

    @Test
    @DisplayName("Should agree between search and aggregate for area, keyword and value filters")
    void shouldAgreeBetweenSearchAndAggregate() {
        // Given
        List<Contract> expected = fixture.primaryWhere(cagayanConcreting());
        QueryPlan plan = plan(cagayanConcretingSpec());

        // When
        AggregateResult aggregate = engine.aggregate(plan, 10);
        PagedResult<ContractRecord> page = searchEngine.search(compiler.compile(cagayanConcretingSpec(), QueryTarget.SEARCH),
            new PageRequest<>(1, 500, SortField.AWARD_DATE, SortDirection.DESC));

        // Then
        assertThat(expected).isNotEmpty();
        assertThat(aggregate.getSummary().getCount()).isEqualTo(expected.size());
        assertThat(aggregate.getSummary().getTotalValue()).isEqualByComparingTo(ContractFixture.total(expected));
        assertThat(page.getPagination().getTotalCount()).isEqualTo(expected.size());
        assertThat(page.getData()).extracting(ContractRecord::getContractNumber)
            .containsExactlyInAnyOrderElementsOf(expected.stream().map(c -> c.contractNumber).collect(Collectors.toList()));
        assertThat(page.getData()).allSatisfy(record -> {
            assertThat(record.getAreaOfDelivery().toLowerCase()).contains("cagayan");
            assertThat(record.getContractAmount()).isBetween(new BigDecimal("4000000"), new BigDecimal("6000000"));
        });
    }

    @Test
    @DisplayName("Should OR values within one chip type")
    void shouldOrWithinChipType() {
        FilterSpec spec = FilterSpec.builder().area("Cebu").area("Ilocos").build();

        long expected = fixture.primaryWhere(c -> Contract.contains(c.areaOfDelivery, "cebu")
            || Contract.contains(c.areaOfDelivery, "ilocos")).size();

        assertThat(engine.aggregate(plan(spec), 5).getSummary().getCount()).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should require every sub-token of a && keyword")
    void shouldAndKeywordSubTokens() {
        FilterSpec combined = FilterSpec.builder().keyword("farm&&road").build();
        FilterSpec farmOnly = FilterSpec.builder().keyword("farm").build();

        long expected = fixture.primaryWhere(c -> Contract.contains(c.searchText(), "farm")
            && Contract.contains(c.searchText(), "road")).size();
        long combinedCount = engine.aggregate(plan(combined), 5).getSummary().getCount();

        assertThat(combinedCount).isEqualTo(expected).isPositive();
        assertThat(combinedCount).isLessThanOrEqualTo(engine.aggregate(plan(farmOnly), 5).getSummary().getCount());
    }

    @Test
    @DisplayName("Should include the extended partition only when asked")
    void shouldIncludeExtendedPartition() {
        long primary = engine.aggregate(plan(FilterSpec.empty()), 5).getSummary().getCount();
        long both = engine.aggregate(plan(FilterSpec.builder().includeExtended(true).build()), 5).getSummary().getCount();

        assertThat(primary).isEqualTo(ContractFixture.PRIMARY_ROWS);
        assertThat(both).isEqualTo(ContractFixture.PRIMARY_ROWS + ContractFixture.EXTENDED_ROWS);
    }

    // ========== Aggregate structure ==========

    @Test
    @DisplayName("Should keep every breakdown within the summary")
    void shouldBoundBreakdownsBySummary() {
        AggregateResult result = engine.aggregate(plan(FilterSpec.empty()), 100);
        long count = result.getSummary().getCount();
        BigDecimal total = result.getSummary().getTotalValue();

        for (List<DimensionRow> rows : List.of(result.getByContractor(), result.getByOrganization(),
            result.getByArea(), result.getByCategory())) {
            assertThat(rows.stream().mapToLong(DimensionRow::getCount).sum()).isLessThanOrEqualTo(count);
            assertThat(rows.stream().map(DimensionRow::getTotalValue).reduce(BigDecimal.ZERO, BigDecimal::add))
                .isLessThanOrEqualTo(total);
            assertThat(rows).extracting(DimensionRow::getLabel).doesNotContainNull();
        }

        long unnamed = fixture.primaryWhere(c -> c.awardeeName == null).size();
        assertThat(result.getByContractor().stream().mapToLong(DimensionRow::getCount).sum())
            .isEqualTo(count - unnamed);
    }

    @Test
    @DisplayName("Should order top entities by total value and honor top_n")
    void shouldOrderTopEntities() {
        AggregateResult result = engine.aggregate(plan(FilterSpec.empty()), 3);

        assertThat(result.getByContractor()).hasSize(3);
        assertThat(result.getByContractor()).extracting(DimensionRow::getTotalValue)
            .isSortedAccordingTo((a, b) -> b.compareTo(a));
    }

    @Test
    @DisplayName("Should sum yearly buckets to the dated part of the summary")
    void shouldSumYearlyBuckets() {
        AggregateResult result = engine.aggregate(plan(FilterSpec.empty()), 5);

        long dated = fixture.primaryWhere(c -> c.awardDate != null).size();
        assertThat(result.getByYear().stream().mapToLong(TimeBucket::getCount).sum()).isEqualTo(dated);
        assertThat(result.getByMonth().stream().mapToLong(TimeBucket::getCount).sum()).isEqualTo(dated);
        assertThat(result.getByYear()).extracting(TimeBucket::getYear).isSorted();
    }

    @Test
    @DisplayName("Should return zeroed summary and empty breakdowns for an empty set")
    void shouldHandleEmptySet() {
        FilterSpec spec = FilterSpec.builder().keyword("no such contract anywhere").build();

        AggregateResult result = engine.aggregate(plan(spec), 5);

        assertThat(result.getSummary().getCount()).isZero();
        assertThat(result.getSummary().getTotalValue()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(result.getSummary().getAvgValue()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(result.getByYear()).isEmpty();
        assertThat(result.getByContractor()).isEmpty();
    }

    @Test
    @DisplayName("Should restrict aggregates to the OR of the requested time ranges")
    void shouldApplyTimeRanges() {
        FilterSpec spec = FilterSpec.builder()
            .timeRange(TimeRange.yearly(2016))
            .timeRange(TimeRange.quarterly(2020, 3))
            .build();

        AggregateResult result = engine.aggregate(plan(spec), 5);

        long expected = fixture.primaryWhere(c -> c.awardDate != null && (c.awardDate.getYear() == 2016
            || (c.awardDate.getYear() == 2020 && c.awardDate.getMonthValue() >= 7 && c.awardDate.getMonthValue() <= 9)))
            .size();
        assertThat(result.getSummary().getCount()).isEqualTo(expected);
        assertThat(result.getByYear()).extracting(TimeBucket::getYear).isSubsetOf(2016, 2020);
    }

    // ========== Paged dimension ==========

    @Test
    @DisplayName("Should page a dimension table without overlap")
    void shouldPageDimensionTable() {
        QueryPlan plan = plan(FilterSpec.empty());

        PagedResult<DimensionRow> first = engine.aggregateDimensionPaged(plan, Dimension.CONTRACTOR,
            new PageRequest<>(1, 4, DimensionSort.COUNT, SortDirection.DESC));
        PagedResult<DimensionRow> second = engine.aggregateDimensionPaged(plan, Dimension.CONTRACTOR,
            new PageRequest<>(2, 4, DimensionSort.COUNT, SortDirection.DESC));

        assertThat(first.getPagination().getTotalCount()).isEqualTo(ContractFixture.CONTRACTOR_COUNT);
        assertThat(first.getData()).hasSize(4);
        assertThat(second.getData()).hasSize(ContractFixture.CONTRACTOR_COUNT - 4);
        Set<String> labels = new HashSet<>();
        first.getData().forEach(row -> labels.add(row.getLabel()));
        second.getData().forEach(row -> labels.add(row.getLabel()));
        assertThat(labels).hasSize(ContractFixture.CONTRACTOR_COUNT);
        assertThat(first.getPagination().isHasNext()).isTrue();
        assertThat(second.getPagination().isHasNext()).isFalse();
    }

    // ========== Entity listings ==========

    @Test
    @DisplayName("Should give the same entity totals from the snapshot and from grouped contracts")
    void shouldMatchSnapshotAndGroupedListings() {
        // Given
        QueryPlan snapshot = compiler.compileEntityListing(Dimension.AREA, FilterSpec.empty(), null);
        FilterSpec wide = FilterSpec.builder().timeRange(TimeRange.custom(
            LocalDate.of(1900, 1, 1), LocalDate.of(2100, 12, 31))).build();
        QueryPlan grouped = compiler.compileEntityListing(Dimension.AREA, wide, null);
        PageRequest<EntitySort> page = new PageRequest<>(1, 50, EntitySort.LABEL, SortDirection.ASC);

        // When
        List<EntityAggregate> fromSnapshot = engine.entityPage(snapshot, page).getData();
        List<EntityAggregate> fromContracts = engine.entityPage(grouped, page).getData();

        // Then
        assertThat(snapshot.isSnapshot()).isTrue();
        assertThat(grouped.isSnapshot()).isFalse();
        Map<String, Long> snapshotCounts = fromSnapshot.stream()
            .collect(Collectors.toMap(EntityAggregate::getEntity, EntityAggregate::getContractCount));
        long dated = fixture.primaryWhere(c -> c.awardDate != null).size();
        assertThat(fromContracts.stream().mapToLong(EntityAggregate::getContractCount).sum()).isEqualTo(dated);
        assertThat(snapshotCounts.values().stream().mapToLong(Long::longValue).sum())
            .isEqualTo(ContractFixture.PRIMARY_ROWS);
        assertThat(fromSnapshot).allSatisfy(entity -> {
            assertThat(entity.getContractorCount()).isNotNull();
            assertThat(entity.getAreaCount()).isNull();
        });
    }

    @Test
    @DisplayName("Should filter the snapshot listing by a case-insensitive entity search")
    void shouldSearchSnapshotListing() {
        QueryPlan plan = compiler.compileEntityListing(Dimension.AREA, FilterSpec.empty(), "CAGAYAN");

        PagedResult<EntityAggregate> result = engine.entityPage(plan,
            new PageRequest<>(1, 10, EntitySort.TOTAL_VALUE, SortDirection.DESC));

        assertThat(result.getData()).extracting(EntityAggregate::getEntity)
            .containsExactlyInAnyOrder("Cagayan", "Cagayan de Oro City");
        assertThat(result.getData()).extracting(EntityAggregate::getTotalValue)
            .isSortedAccordingTo((a, b) -> b.compareTo(a));
    }

    @Test
    @DisplayName("Should list related entities among contracts with the exact source value")
    void shouldListRelatedEntities() {
        // When
        List<EntityAggregate> related = engine.relatedEntities(Dimension.AREA, "Cagayan", Dimension.CONTRACTOR, 20,
            List.of(), false);

        // Then
        List<Contract> inArea = fixture.primaryWhere(c -> "Cagayan".equals(c.areaOfDelivery) && c.awardeeName != null);
        Set<String> expectedContractors = inArea.stream().map(c -> c.awardeeName).collect(Collectors.toSet());
        assertThat(related).extracting(EntityAggregate::getEntity).containsExactlyInAnyOrderElementsOf(expectedContractors);
        assertThat(related.stream().mapToLong(EntityAggregate::getContractCount).sum()).isEqualTo(inArea.size());
        assertThat(related).allSatisfy(entity -> assertThat(entity.getAreaCount()).isEqualTo(1L));
        assertThat(related).extracting(EntityAggregate::getEntity).allMatch(Objects::nonNull);
    }

    @Test
    @DisplayName("Should count executed queries")
    void shouldRecordMetrics() {
        engine.aggregate(plan(FilterSpec.empty()), 5);

        assertThat(metrics.getQueriesExecuted().count()).isEqualTo(1.0);
        assertThat(metrics.getAggregateLatency().count()).isEqualTo(1);
    }
}
