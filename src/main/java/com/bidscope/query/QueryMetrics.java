package com.bidscope.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for query, export, cache and task operations.
 * Tracks executions, failures, latencies per operation, result sizes,
 * cache hit rates and task outcomes.
 */
@Component
public class QueryMetrics {

    private final MeterRegistry meterRegistry;

    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Counter queriesOverCapacity;
    private Timer searchLatency;
    private Timer aggregateLatency;
    private Timer histogramLatency;
    private Timer exportLatency;
    private DistributionSummary resultSize;

    private Counter exportedRows;
    private Counter exportsCancelled;

    private Counter cacheHits;
    private Counter cacheMisses;
    private Counter cacheInvalidations;

    private Counter tasksSubmitted;
    private Counter tasksSucceeded;
    private Counter tasksFailed;
    private Counter tasksCancelled;
    private Counter taskRetries;

    public QueryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        queriesExecuted = Counter.builder("bidscope.query.executed")
            .description("Total number of engine operations executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("bidscope.query.failed")
            .description("Total number of engine operations that failed against the store")
            .register(meterRegistry);

        queriesOverCapacity = Counter.builder("bidscope.query.capacity.exceeded")
            .description("Interactive calls rejected for exceeding the soft timeout")
            .register(meterRegistry);

        searchLatency = latencyTimer("bidscope.query.search.latency", "Latency of paginated contract searches",
            Duration.ofSeconds(30));
        aggregateLatency = latencyTimer("bidscope.query.aggregate.latency", "Latency of aggregate computations",
            Duration.ofSeconds(60));
        histogramLatency = latencyTimer("bidscope.query.histogram.latency", "Latency of value distributions",
            Duration.ofSeconds(60));
        exportLatency = latencyTimer("bidscope.export.latency", "Duration of export streams",
            Duration.ofMinutes(30));

        resultSize = DistributionSummary.builder("bidscope.query.result.size")
            .description("Distribution of result sizes (rows)")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        exportedRows = Counter.builder("bidscope.export.rows")
            .description("Total number of rows written by exports")
            .register(meterRegistry);

        exportsCancelled = Counter.builder("bidscope.export.cancelled")
            .description("Exports stopped by client cancellation")
            .register(meterRegistry);

        cacheHits = Counter.builder("bidscope.cache.hits")
            .description("Total number of result cache hits")
            .register(meterRegistry);

        cacheMisses = Counter.builder("bidscope.cache.misses")
            .description("Total number of result cache misses")
            .register(meterRegistry);

        cacheInvalidations = Counter.builder("bidscope.cache.invalidations")
            .description("Total number of full cache invalidations")
            .register(meterRegistry);

        tasksSubmitted = Counter.builder("bidscope.task.submitted")
            .description("Tasks accepted for asynchronous execution")
            .register(meterRegistry);

        tasksSucceeded = Counter.builder("bidscope.task.succeeded")
            .register(meterRegistry);

        tasksFailed = Counter.builder("bidscope.task.failed")
            .register(meterRegistry);

        tasksCancelled = Counter.builder("bidscope.task.cancelled")
            .register(meterRegistry);

        taskRetries = Counter.builder("bidscope.task.retries")
            .description("Retry attempts after transient store failures")
            .register(meterRegistry);
    }

    private Timer latencyTimer(String name, String description, Duration max) {
        return Timer.builder(name)
            .description(description)
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(max)
            .register(meterRegistry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public void recordCapacityExceeded() {
        queriesOverCapacity.increment();
    }

    public void recordSearchLatency(Timer.Sample sample) {
        sample.stop(searchLatency);
    }

    public void recordAggregateLatency(Timer.Sample sample) {
        sample.stop(aggregateLatency);
    }

    public void recordHistogramLatency(Timer.Sample sample) {
        sample.stop(histogramLatency);
    }

    public void recordExportLatency(Timer.Sample sample) {
        sample.stop(exportLatency);
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    public void recordExportedRows(long rows) {
        exportedRows.increment(rows);
    }

    public void recordExportCancelled() {
        exportsCancelled.increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordCacheInvalidation() {
        cacheInvalidations.increment();
    }

    public void recordTaskSubmitted() {
        tasksSubmitted.increment();
    }

    public void recordTaskSucceeded() {
        tasksSucceeded.increment();
    }

    public void recordTaskFailed() {
        tasksFailed.increment();
    }

    public void recordTaskCancelled() {
        tasksCancelled.increment();
    }

    public void recordTaskRetry() {
        taskRetries.increment();
    }

    /**
     * Calculate cache hit rate as a percentage
     * @return cache hit rate (0-100) or 0 if no cache operations
     */
    public double getCacheHitRate() {
        double hits = cacheHits.count();
        double misses = cacheMisses.count();
        double total = hits + misses;

        if (total == 0) {
            return 0.0;
        }

        return (hits / total) * 100.0;
    }

    // Getter methods for testing
    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Counter getQueriesOverCapacity() {
        return queriesOverCapacity;
    }

    public Timer getSearchLatency() {
        return searchLatency;
    }

    public Timer getAggregateLatency() {
        return aggregateLatency;
    }

    public Timer getHistogramLatency() {
        return histogramLatency;
    }

    public Timer getExportLatency() {
        return exportLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }

    public Counter getExportedRows() {
        return exportedRows;
    }

    public Counter getExportsCancelled() {
        return exportsCancelled;
    }

    public Counter getCacheHits() {
        return cacheHits;
    }

    public Counter getCacheMisses() {
        return cacheMisses;
    }

    public Counter getCacheInvalidations() {
        return cacheInvalidations;
    }

    public Counter getTasksSubmitted() {
        return tasksSubmitted;
    }

    public Counter getTasksSucceeded() {
        return tasksSucceeded;
    }

    public Counter getTasksFailed() {
        return tasksFailed;
    }

    public Counter getTasksCancelled() {
        return tasksCancelled;
    }

    public Counter getTaskRetries() {
        return taskRetries;
    }
}
