package com.bidscope.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunables for the query engines, export, cache and task layers, bound from {@code bidscope.*}.
 * Defaults here are what the service runs with when nothing is configured.
 */
@Validated
@ConfigurationProperties(prefix = "bidscope")
public class BidScopeProperties {

    @Valid
    private Dataset dataset = new Dataset();

    @Valid
    private Query query = new Query();

    @Valid
    private Export export = new Export();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Tasks tasks = new Tasks();

    public Dataset getDataset() {
        return dataset;
    }

    public void setDataset(Dataset dataset) {
        this.dataset = dataset;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Tasks getTasks() {
        return tasks;
    }

    public void setTasks(Tasks tasks) {
        this.tasks = tasks;
    }

    /**
     * Relations the store reads. Values are SQL relation expressions such as a table name or
     * {@code read_parquet('...')}; they come from deployment config, never from requests.
     */
    public static class Dataset {

        @NotBlank
        private String primaryRelation = "read_parquet('data/facts_awards_all_time.parquet')";

        @NotBlank
        private String extendedRelation = "read_parquet('data/facts_awards_flood_control.parquet')";

        /**
         * Entity snapshot relation per dimension, keyed by dimension name
         * (contractor, organization, area, business_category).
         */
        private Map<String, String> snapshotRelations = defaultSnapshots();

        /** Check every relation's columns at startup and refuse to start on drift. */
        private boolean validateOnStartup = true;

        private static Map<String, String> defaultSnapshots() {
            Map<String, String> map = new LinkedHashMap<>();
            map.put("contractor", "read_parquet('data/agg_contractor.parquet')");
            map.put("organization", "read_parquet('data/agg_organization.parquet')");
            map.put("area", "read_parquet('data/agg_area.parquet')");
            map.put("business_category", "read_parquet('data/agg_business_category.parquet')");
            return map;
        }

        public String getPrimaryRelation() {
            return primaryRelation;
        }

        public void setPrimaryRelation(String primaryRelation) {
            this.primaryRelation = primaryRelation;
        }

        public String getExtendedRelation() {
            return extendedRelation;
        }

        public void setExtendedRelation(String extendedRelation) {
            this.extendedRelation = extendedRelation;
        }

        public Map<String, String> getSnapshotRelations() {
            return snapshotRelations;
        }

        public void setSnapshotRelations(Map<String, String> snapshotRelations) {
            this.snapshotRelations = snapshotRelations;
        }

        public boolean isValidateOnStartup() {
            return validateOnStartup;
        }

        public void setValidateOnStartup(boolean validateOnStartup) {
            this.validateOnStartup = validateOnStartup;
        }
    }

    public static class Query {

        @Min(1)
        private int defaultPageSize = 20;

        @Min(1)
        private int maxPageSize = 100;

        @Min(1)
        private int defaultTopN = 20;

        @Min(1)
        private int maxTopN = 100;

        @Min(1)
        private int defaultRelatedLimit = 10;

        @Min(1)
        private int maxRelatedLimit = 100;

        @Min(10)
        private int defaultNumBins = 1000;

        /** Soft limit for interactive calls; beyond it callers should submit a task. */
        @NotNull
        private Duration interactiveTimeout = Duration.ofSeconds(15);

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public int getDefaultTopN() {
            return defaultTopN;
        }

        public void setDefaultTopN(int defaultTopN) {
            this.defaultTopN = defaultTopN;
        }

        public int getMaxTopN() {
            return maxTopN;
        }

        public void setMaxTopN(int maxTopN) {
            this.maxTopN = maxTopN;
        }

        public int getDefaultRelatedLimit() {
            return defaultRelatedLimit;
        }

        public void setDefaultRelatedLimit(int defaultRelatedLimit) {
            this.defaultRelatedLimit = defaultRelatedLimit;
        }

        public int getMaxRelatedLimit() {
            return maxRelatedLimit;
        }

        public void setMaxRelatedLimit(int maxRelatedLimit) {
            this.maxRelatedLimit = maxRelatedLimit;
        }

        public int getDefaultNumBins() {
            return defaultNumBins;
        }

        public void setDefaultNumBins(int defaultNumBins) {
            this.defaultNumBins = defaultNumBins;
        }

        public Duration getInteractiveTimeout() {
            return interactiveTimeout;
        }

        public void setInteractiveTimeout(Duration interactiveTimeout) {
            this.interactiveTimeout = interactiveTimeout;
        }
    }

    public static class Export {

        @Min(1)
        private int batchSize = 50_000;

        @Min(1)
        private int averageRowBytes = 250;

        @Min(1)
        private int averageAggregateRowBytes = 120;

        /** Where asynchronous exports write their files. */
        @NotBlank
        private String directory = "exports";

        /** Export files older than this are deleted by the cleanup job. */
        @NotNull
        private Duration retention = Duration.ofHours(24);

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getAverageRowBytes() {
            return averageRowBytes;
        }

        public void setAverageRowBytes(int averageRowBytes) {
            this.averageRowBytes = averageRowBytes;
        }

        public int getAverageAggregateRowBytes() {
            return averageAggregateRowBytes;
        }

        public void setAverageAggregateRowBytes(int averageAggregateRowBytes) {
            this.averageAggregateRowBytes = averageAggregateRowBytes;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }

    public static class Cache {

        @Min(1)
        private long maximumSize = 1000;

        @NotNull
        private Duration aggregateTtl = Duration.ofMinutes(30);

        @NotNull
        private Duration searchTtl = Duration.ofMinutes(10);

        @NotNull
        private Duration histogramTtl = Duration.ofMinutes(30);

        @NotNull
        private Duration filterOptionsTtl = Duration.ofMinutes(5);

        @NotNull
        private Duration taskResultTtl = Duration.ofHours(1);

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }

        public Duration getAggregateTtl() {
            return aggregateTtl;
        }

        public void setAggregateTtl(Duration aggregateTtl) {
            this.aggregateTtl = aggregateTtl;
        }

        public Duration getSearchTtl() {
            return searchTtl;
        }

        public void setSearchTtl(Duration searchTtl) {
            this.searchTtl = searchTtl;
        }

        public Duration getHistogramTtl() {
            return histogramTtl;
        }

        public void setHistogramTtl(Duration histogramTtl) {
            this.histogramTtl = histogramTtl;
        }

        public Duration getFilterOptionsTtl() {
            return filterOptionsTtl;
        }

        public void setFilterOptionsTtl(Duration filterOptionsTtl) {
            this.filterOptionsTtl = filterOptionsTtl;
        }

        public Duration getTaskResultTtl() {
            return taskResultTtl;
        }

        public void setTaskResultTtl(Duration taskResultTtl) {
            this.taskResultTtl = taskResultTtl;
        }
    }

    public static class Tasks {

        /** Concurrent task workers; bounds heavy queries against the store. */
        @Min(1)
        private int workers = 4;

        /** Submitted tasks waiting for a worker beyond this are rejected. */
        @Min(1)
        private int queueCapacity = 100;

        @Min(0)
        private int maxRetries = 2;

        @NotNull
        private Duration retryBackoff = Duration.ofSeconds(30);

        @Min(0)
        private int exportMaxRetries = 3;

        @NotNull
        private Duration exportRetryBackoff = Duration.ofSeconds(60);

        /** How long finished tasks stay queryable. */
        @NotNull
        private Duration completedTtl = Duration.ofHours(1);

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public int getExportMaxRetries() {
            return exportMaxRetries;
        }

        public void setExportMaxRetries(int exportMaxRetries) {
            this.exportMaxRetries = exportMaxRetries;
        }

        public Duration getExportRetryBackoff() {
            return exportRetryBackoff;
        }

        public void setExportRetryBackoff(Duration exportRetryBackoff) {
            this.exportRetryBackoff = exportRetryBackoff;
        }

        public Duration getCompletedTtl() {
            return completedTtl;
        }

        public void setCompletedTtl(Duration completedTtl) {
            this.completedTtl = completedTtl;
        }
    }
}
