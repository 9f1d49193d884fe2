package com.bidscope.analytics;

import com.bidscope.analytics.AggregationEngine.DimensionSort;
import com.bidscope.analytics.AggregationEngine.EntitySort;
import com.bidscope.analytics.ContractSearchEngine.SortField;
import com.bidscope.cache.Fingerprints;
import com.bidscope.cache.ResultCache;
import com.bidscope.config.BidScopeProperties;
import com.bidscope.domain.AggregateResult;
import com.bidscope.domain.ContractQueryRequest;
import com.bidscope.domain.ContractRecord;
import com.bidscope.domain.DimensionRow;
import com.bidscope.domain.EntityAggregate;
import com.bidscope.domain.FilterOptions;
import com.bidscope.domain.HistogramResult;
import com.bidscope.domain.PagedResult;
import com.bidscope.domain.SortDirection;
import com.bidscope.error.ValidationException;
import com.bidscope.filter.FilterSpec;
import com.bidscope.filter.FilterSpecParser;
import com.bidscope.query.Dimension;
import com.bidscope.query.QueryCompiler;
import com.bidscope.query.QueryPlan;
import com.bidscope.query.QueryTarget;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entry point shared by the HTTP layer and task workers.
 *
 * <p>A {@code prepareX} call validates the request, compiles it and derives its cache key without
 * touching the store, so every {@link ValidationException} surfaces before any work is queued.
 * {@link #execute(PreparedQuery)} then serves the result from the cache or runs it under the
 * interactive guard.
 */
@Service
public class ContractExplorerService {

    private final FilterSpecParser parser;
    private final QueryCompiler compiler;
    private final ContractSearchEngine searchEngine;
    private final AggregationEngine aggregationEngine;
    private final HistogramEngine histogramEngine;
    private final FilterOptionsService filterOptionsService;
    private final ResultCache cache;
    private final InteractiveQueryGuard guard;
    private final BidScopeProperties.Query queryLimits;
    private final BidScopeProperties.Cache cacheSettings;

    public ContractExplorerService(FilterSpecParser parser,
                                   QueryCompiler compiler,
                                   ContractSearchEngine searchEngine,
                                   AggregationEngine aggregationEngine,
                                   HistogramEngine histogramEngine,
                                   FilterOptionsService filterOptionsService,
                                   ResultCache cache,
                                   InteractiveQueryGuard guard,
                                   BidScopeProperties properties) {
        this.parser = parser;
        this.compiler = compiler;
        this.searchEngine = searchEngine;
        this.aggregationEngine = aggregationEngine;
        this.histogramEngine = histogramEngine;
        this.filterOptionsService = filterOptionsService;
        this.cache = cache;
        this.guard = guard;
        this.queryLimits = properties.getQuery();
        this.cacheSettings = properties.getCache();
    }

    /**
     * Serve from cache, or run under the soft timeout and circuit breaker and cache the result.
     */
    public <T> T execute(PreparedQuery<T> query) {
        return cache.getOrCompute(query.getCacheKey(), query.getTtl(),
            () -> guard.call(query.getOperation(), query::run));
    }

    // ========== Preparation ==========

    public PreparedQuery<PagedResult<ContractRecord>> prepareSearch(ContractQueryRequest request) {
        FilterSpec spec = parser.parse(request);
        PageRequest<SortField> page = pageRequest(request, sortField(request.getSortBy()));
        QueryPlan plan = compiler.compile(spec, QueryTarget.SEARCH);

        String key = Fingerprints.key("search", spec, pageParams(page));
        return new PreparedQuery<>("search", key, cacheSettings.getSearchTtl(), () -> searchEngine.search(plan, page));
    }

    /**
     * Full aggregate, or one paged dimension table when the request names a dimension.
     */
    public PreparedQuery<?> prepareAggregateTask(ContractQueryRequest request) {
        if (request.getDimension() != null && !request.getDimension().isBlank()) {
            return prepareAggregatePaged(request);
        }
        return prepareAggregate(request);
    }

    public PreparedQuery<AggregateResult> prepareAggregate(ContractQueryRequest request) {
        FilterSpec spec = parser.parse(request);
        int topN = boundedOrDefault(request.getTopN(), queryLimits.getDefaultTopN(), queryLimits.getMaxTopN(), "top_n");
        QueryPlan plan = compiler.compile(spec, QueryTarget.AGGREGATE);

        String key = Fingerprints.key("aggregate", spec, Map.of("top_n", topN));
        return new PreparedQuery<>("aggregate", key, cacheSettings.getAggregateTtl(),
            () -> aggregationEngine.aggregate(plan, topN));
    }

    public PreparedQuery<PagedResult<DimensionRow>> prepareAggregatePaged(ContractQueryRequest request) {
        FilterSpec spec = parser.parse(request);
        Dimension dimension = dimension(request.getDimension(), "dimension");
        PageRequest<DimensionSort> page = pageRequest(request, dimensionSort(request.getSortBy()));
        QueryPlan plan = compiler.compile(spec, QueryTarget.AGGREGATE);

        Map<String, Object> params = pageParams(page);
        params.put("dimension", dimension.getValue());
        String key = Fingerprints.key("aggregate_paged", spec, params);
        return new PreparedQuery<>("aggregate_paged", key, cacheSettings.getAggregateTtl(),
            () -> aggregationEngine.aggregateDimensionPaged(plan, dimension, page));
    }

    public PreparedQuery<HistogramResult> prepareDistribution(ContractQueryRequest request) {
        FilterSpec spec = parser.parse(request);
        int numBins = request.getNumBins() == null ? queryLimits.getDefaultNumBins() : request.getNumBins();
        HistogramEngine.validateNumBins(numBins);
        QueryPlan plan = compiler.compile(spec, QueryTarget.HISTOGRAM);

        String key = Fingerprints.key("distribution", spec, Map.of("num_bins", numBins));
        return new PreparedQuery<>("distribution", key, cacheSettings.getHistogramTtl(),
            () -> histogramEngine.distribution(plan, numBins));
    }

    public PreparedQuery<PagedResult<EntityAggregate>> prepareEntities(String dimensionValue,
                                                                      ContractQueryRequest request,
                                                                      String searchQuery) {
        Dimension dimension = dimension(dimensionValue, "dimension");
        FilterSpec spec = parser.parse(request);
        PageRequest<EntitySort> page = pageRequest(request, entitySort(request.getSortBy()));
        String search = searchQuery == null ? "" : searchQuery.trim().toLowerCase(Locale.ROOT);
        QueryPlan plan = compiler.compileEntityListing(dimension, spec, search);

        Map<String, Object> params = pageParams(page);
        params.put("dimension", dimension.getValue());
        params.put("search_query", search);
        String key = Fingerprints.key("entities", spec, params);
        return new PreparedQuery<>("entities", key, cacheSettings.getAggregateTtl(),
            () -> aggregationEngine.entityPage(plan, page));
    }

    public PreparedQuery<List<EntityAggregate>> prepareRelated(String sourceDimension, String sourceValue,
                                                               String targetDimension, Integer limit,
                                                               ContractQueryRequest request) {
        Dimension source = dimension(sourceDimension, "dimension");
        Dimension target = dimension(targetDimension, "target_dimension");
        int cap = boundedOrDefault(limit, queryLimits.getDefaultRelatedLimit(), queryLimits.getMaxRelatedLimit(),
            "limit");
        FilterSpec spec = parser.parse(request);
        // fails fast on equal dimensions or a blank value
        compiler.compileRelated(source, sourceValue, target, spec.getTimeRanges(), spec.isIncludeExtended());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("source_dimension", source.getValue());
        params.put("entity_value", sourceValue.trim());
        params.put("target_dimension", target.getValue());
        params.put("limit", cap);
        String key = Fingerprints.key("related", spec, params);
        return new PreparedQuery<>("related", key, cacheSettings.getAggregateTtl(),
            () -> aggregationEngine.relatedEntities(source, sourceValue, target, cap, spec.getTimeRanges(),
                spec.isIncludeExtended()));
    }

    public PreparedQuery<FilterOptions> prepareFilterOptions(boolean includeExtended) {
        String key = Fingerprints.key("filter_options", Map.of("include_extended_dataset", includeExtended));
        return new PreparedQuery<>("filter_options", key, cacheSettings.getFilterOptionsTtl(),
            () -> filterOptionsService.options(includeExtended));
    }

    /**
     * Parse and compile an export request. Export plans are never cached.
     */
    public QueryPlan prepareExportPlan(ContractQueryRequest request) {
        return compiler.compile(parser.parse(request), QueryTarget.EXPORT);
    }

    public FilterSpec parseFilters(ContractQueryRequest request) {
        return parser.parse(request);
    }

    // ========== Request validation ==========

    public Dimension dimension(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "Dimension is required");
        }
        try {
            return Dimension.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field, e.getMessage());
        }
    }

    private <S> PageRequest<S> pageRequest(ContractQueryRequest request, S sortBy) {
        int page = request.getPage() == null ? 1 : request.getPage();
        if (page < 1) {
            throw new ValidationException("page", "Page must be at least 1, got " + page);
        }
        int pageSize = boundedOrDefault(request.getPageSize(), queryLimits.getDefaultPageSize(),
            queryLimits.getMaxPageSize(), "page_size");
        return new PageRequest<>(page, pageSize, sortBy, sortDirection(request.getSortDirection()));
    }

    private static int boundedOrDefault(Integer value, int defaultValue, int max, String field) {
        if (value == null) {
            return defaultValue;
        }
        if (value < 1 || value > max) {
            throw new ValidationException(field, "Must be between 1 and " + max + ", got " + value);
        }
        return value;
    }

    private static SortDirection sortDirection(String value) {
        if (value == null || value.isBlank()) {
            return SortDirection.DESC;
        }
        try {
            return SortDirection.fromValue(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("sort_direction", e.getMessage());
        }
    }

    private static SortField sortField(String value) {
        if (value == null || value.isBlank()) {
            return SortField.AWARD_DATE;
        }
        try {
            return SortField.fromValue(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("sort_by", e.getMessage());
        }
    }

    private static DimensionSort dimensionSort(String value) {
        if (value == null || value.isBlank()) {
            return DimensionSort.TOTAL_VALUE;
        }
        try {
            return DimensionSort.fromValue(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("sort_by", e.getMessage());
        }
    }

    private static EntitySort entitySort(String value) {
        if (value == null || value.isBlank()) {
            return EntitySort.TOTAL_VALUE;
        }
        try {
            return EntitySort.fromValue(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("sort_by", e.getMessage());
        }
    }

    private static Map<String, Object> pageParams(PageRequest<?> page) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("page", page.getPage());
        params.put("page_size", page.getPageSize());
        params.put("sort_by", String.valueOf(page.getSortBy()).toLowerCase(Locale.ROOT));
        params.put("sort_direction", page.getDirection().getValue());
        return params;
    }
}
