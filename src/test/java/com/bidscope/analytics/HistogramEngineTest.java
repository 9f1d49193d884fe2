package com.bidscope.analytics;

import com.bidscope.domain.HistogramBin;
import com.bidscope.domain.HistogramResult;
import com.bidscope.error.ValidationException;
import com.bidscope.filter.FilterSpec;
import com.bidscope.filter.ValueRange;
import com.bidscope.query.QueryCompiler;
import com.bidscope.query.QueryMetrics;
import com.bidscope.query.QueryPlan;
import com.bidscope.query.QueryTarget;
import com.bidscope.query.SqlRenderer;
import com.bidscope.storage.ContractFixture;
import com.bidscope.storage.ContractFixture.Contract;
import com.bidscope.storage.DatasetCatalog;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HistogramEngine Tests")
class HistogramEngineTest {

    private static ContractFixture fixture;

    private final QueryCompiler compiler = new QueryCompiler();
    private HistogramEngine engine;

    @BeforeAll
    static void setUpDataset() {
        fixture = ContractFixture.create();
        fixture.getJdbcTemplate().execute(
            "CREATE TABLE contracts_narrow AS SELECT * FROM contracts WHERE contract_amount > 0 " +
            "ORDER BY contract_number LIMIT 2");
        fixture.getJdbcTemplate().execute(
            "UPDATE contracts_narrow SET contract_amount = CASE WHEN contract_number = " +
            "(SELECT MIN(contract_number) FROM contracts_narrow) THEN 100.00 ELSE 100.02 END");
    }

    @AfterAll
    static void tearDown() throws Exception {
        fixture.close();
    }

    @BeforeEach
    void setUp() {
        QueryMetrics metrics = new QueryMetrics(new SimpleMeterRegistry());
        metrics.init();
        engine = new HistogramEngine(fixture.getJdbcTemplate(), fixture.getTransactionTemplate(),
            fixture.renderer(), metrics);
    }

    private HistogramEngine engineOver(String primaryRelation) {
        DatasetCatalog base = fixture.getCatalog();
        DatasetCatalog catalog =
            new DatasetCatalog(primaryRelation, base.getExtendedRelation(), base.getSnapshotRelations());
        QueryMetrics metrics = new QueryMetrics(new SimpleMeterRegistry());
        metrics.init();
        return new HistogramEngine(fixture.getJdbcTemplate(), fixture.getTransactionTemplate(),
            new SqlRenderer(catalog), metrics);
    }

    private QueryPlan plan(FilterSpec spec) {
        return compiler.compile(spec, QueryTarget.HISTOGRAM);
    }

    @ParameterizedTest
    @ValueSource(ints = {10, 37, 1000})
    @DisplayName("Should account for every positive amount exactly once")
    void shouldConserveCountsAndTotals(int numBins) {
        // Given
        List<Contract> positive = fixture.primaryWhere(
            c -> c.contractAmount != null && c.contractAmount.signum() > 0);

        // When
        HistogramResult result = engine.distribution(plan(FilterSpec.empty()), numBins);

        // Then
        assertThat(result.getBins()).hasSize(numBins);
        assertThat(result.getTotalContracts()).isEqualTo(positive.size());
        assertThat(result.getBins().stream().mapToLong(HistogramBin::getCount).sum()).isEqualTo(positive.size());
        assertThat(result.getBins().stream().map(HistogramBin::getTotalValue).reduce(BigDecimal.ZERO, BigDecimal::add))
            .isEqualByComparingTo(ContractFixture.total(positive));
        assertThat(result.getBins()).extracting(HistogramBin::getBinNumber).startsWith(1).endsWith(numBins);
    }

    @Test
    @DisplayName("Should put the maximum in the last bin and span min to max")
    void shouldSpanMinToMax() {
        HistogramResult result = engine.distribution(plan(FilterSpec.empty()), 10);

        HistogramBin first = result.getBins().get(0);
        HistogramBin last = result.getBins().get(9);
        assertThat(first.getBinStart()).isEqualByComparingTo(result.getMinValue());
        assertThat(last.getBinEnd()).isEqualByComparingTo(result.getMaxValue());
        assertThat(first.getCount()).isPositive();
        assertThat(last.getCount()).isPositive();
        assertThat(result.getBinWidth()).isPositive();
    }

    @Test
    @DisplayName("Should keep the maximum in the last bin when the range is narrower than the bin count")
    void shouldBinNarrowRangeExactly() {
        // Given
        HistogramEngine narrow = engineOver("contracts_narrow");

        // When
        HistogramResult result = narrow.distribution(plan(FilterSpec.empty()), 3000);

        // Then
        List<HistogramBin> bins = result.getBins();
        assertThat(bins).hasSize(3000);
        assertThat(result.getMinValue()).isEqualByComparingTo("100.00");
        assertThat(result.getMaxValue()).isEqualByComparingTo("100.02");
        assertThat(bins.get(0).getCount()).isEqualTo(1);
        assertThat(bins.get(2999).getCount()).isEqualTo(1);
        assertThat(bins.get(2999).getBinEnd()).isEqualByComparingTo("100.02");
        assertThat(bins).allSatisfy(bin -> {
            assertThat(bin.getBinStart()).isLessThanOrEqualTo(result.getMaxValue());
            assertThat(bin.getBinEnd()).isLessThanOrEqualTo(result.getMaxValue());
            assertThat(bin.getBinStart()).isLessThanOrEqualTo(bin.getBinEnd());
        });
        assertThat(result.getBinWidth()).isPositive().isLessThan(new BigDecimal("0.0000067"));
    }

    @Test
    @DisplayName("Should return one zero-width bin when every amount is the same")
    void shouldHandleDegenerateRange() {
        // Given
        Contract sample = fixture.primaryWhere(c -> c.contractAmount != null && c.contractAmount.signum() > 0).get(0);
        FilterSpec spec = FilterSpec.builder()
            .valueRange(new ValueRange(sample.contractAmount, sample.contractAmount))
            .build();
        long matching = fixture.primaryWhere(c -> c.contractAmount != null
            && c.contractAmount.compareTo(sample.contractAmount) == 0).size();

        // When
        HistogramResult result = engine.distribution(plan(spec), 50);

        // Then
        assertThat(result.getBins()).hasSize(1);
        assertThat(result.getBinWidth()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(result.getBins().get(0).getCount()).isEqualTo(matching);
        assertThat(result.getMinValue()).isEqualByComparingTo(result.getMaxValue());
    }

    @Test
    @DisplayName("Should return an empty distribution for an empty set")
    void shouldHandleEmptySet() {
        FilterSpec spec = FilterSpec.builder().keyword("nothing matches this").build();

        HistogramResult result = engine.distribution(plan(spec), 20);

        assertThat(result.getTotalContracts()).isZero();
        assertThat(result.getBins()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 9, 10_001})
    @DisplayName("Should reject a bin count outside the allowed range")
    void shouldRejectInvalidBinCounts(int numBins) {
        assertThatThrownBy(() -> engine.distribution(plan(FilterSpec.empty()), numBins))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("num_bins"));
    }
}
