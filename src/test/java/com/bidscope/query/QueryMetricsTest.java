package com.bidscope.query;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for QueryMetrics
 * Covers engine counters, latency timers, export and task counters and the cache hit rate.
 */
@DisplayName("QueryMetrics Tests")
class QueryMetricsTest {

    private QueryMetrics queryMetrics;
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queryMetrics = new QueryMetrics(meterRegistry);
        queryMetrics.init();
    }

    @Test
    @DisplayName("Should register every meter on startup")
    void shouldInitializeAllMetrics() {
        assertThat(meterRegistry.find("bidscope.query.executed").counter()).isNotNull();
        assertThat(meterRegistry.find("bidscope.query.failed").counter()).isNotNull();
        assertThat(meterRegistry.find("bidscope.query.capacity.exceeded").counter()).isNotNull();
        assertThat(meterRegistry.find("bidscope.query.search.latency").timer()).isNotNull();
        assertThat(meterRegistry.find("bidscope.query.aggregate.latency").timer()).isNotNull();
        assertThat(meterRegistry.find("bidscope.query.histogram.latency").timer()).isNotNull();
        assertThat(meterRegistry.find("bidscope.export.latency").timer()).isNotNull();
        assertThat(meterRegistry.find("bidscope.query.result.size").summary()).isNotNull();
        assertThat(meterRegistry.find("bidscope.cache.hits").counter()).isNotNull();
        assertThat(meterRegistry.find("bidscope.task.retries").counter()).isNotNull();
    }

    @Test
    @DisplayName("Should count executed and failed operations")
    void shouldCountOperations() {
        queryMetrics.recordQueryExecuted();
        queryMetrics.recordQueryExecuted();
        queryMetrics.recordQueryFailed();
        queryMetrics.recordCapacityExceeded();

        assertThat(queryMetrics.getQueriesExecuted().count()).isEqualTo(2.0);
        assertThat(queryMetrics.getQueriesFailed().count()).isEqualTo(1.0);
        assertThat(queryMetrics.getQueriesOverCapacity().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record latency per operation")
    void shouldRecordLatency() {
        Timer.Sample sample = queryMetrics.startTimer();
        queryMetrics.recordAggregateLatency(sample);

        assertThat(queryMetrics.getAggregateLatency().count()).isEqualTo(1);
        assertThat(queryMetrics.getSearchLatency().count()).isZero();
    }

    @Test
    @DisplayName("Should track result sizes")
    void shouldTrackResultSizes() {
        queryMetrics.recordResultSize(20);
        queryMetrics.recordResultSize(100);

        assertThat(queryMetrics.getResultSize().count()).isEqualTo(2);
        assertThat(queryMetrics.getResultSize().totalAmount()).isEqualTo(120.0);
        assertThat(queryMetrics.getResultSize().max()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Should add exported rows and count cancelled exports")
    void shouldTrackExports() {
        queryMetrics.recordExportedRows(50_000);
        queryMetrics.recordExportedRows(1_234);
        queryMetrics.recordExportCancelled();

        assertThat(queryMetrics.getExportedRows().count()).isEqualTo(51_234.0);
        assertThat(queryMetrics.getExportsCancelled().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should count task outcomes")
    void shouldTrackTasks() {
        queryMetrics.recordTaskSubmitted();
        queryMetrics.recordTaskSubmitted();
        queryMetrics.recordTaskRetry();
        queryMetrics.recordTaskSucceeded();
        queryMetrics.recordTaskFailed();

        assertThat(queryMetrics.getTasksSubmitted().count()).isEqualTo(2.0);
        assertThat(queryMetrics.getTaskRetries().count()).isEqualTo(1.0);
        assertThat(queryMetrics.getTasksSucceeded().count()).isEqualTo(1.0);
        assertThat(queryMetrics.getTasksFailed().count()).isEqualTo(1.0);
        assertThat(queryMetrics.getTasksCancelled().count()).isZero();
    }

    @Test
    @DisplayName("Should calculate cache hit rate correctly")
    void shouldCalculateCacheHitRate() {
        queryMetrics.recordCacheHit();
        queryMetrics.recordCacheHit();
        queryMetrics.recordCacheHit();
        queryMetrics.recordCacheMiss();

        assertThat(queryMetrics.getCacheHitRate()).isCloseTo(75.0, within(0.01));
    }

    @Test
    @DisplayName("Should return zero hit rate when no cache operations")
    void shouldReturnZeroHitRateWithNoCacheOperations() {
        assertThat(queryMetrics.getCacheHitRate()).isEqualTo(0.0);
    }
}
