package com.bidscope.cache;

import com.bidscope.config.BidScopeProperties;
import com.bidscope.query.QueryMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Keyed result cache with a time-to-live per entry.
 *
 * <p>Keys come from {@link Fingerprints}. Results are immutable once stored, so a hit is returned as
 * is. Failed computations are never stored. Two callers missing on the same key at once both
 * compute; the later write wins and both values are equal.
 */
@Component
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final Cache<String, Entry> cache;
    private final QueryMetrics metrics;

    @Autowired
    public ResultCache(BidScopeProperties properties, QueryMetrics metrics) {
        this(properties.getCache().getMaximumSize(), Ticker.systemTicker(), metrics);
    }

    ResultCache(long maximumSize, Ticker ticker, QueryMetrics metrics) {
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new EntryExpiry())
            .ticker(ticker)
            .recordStats()
            .build();

        log.info("Result cache initialized (maxSize={})", maximumSize);
    }

    /**
     * Return the cached value for {@code key}, or compute, store and return it.
     * Exceptions from {@code compute} propagate and leave the cache untouched.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String key, Duration ttl, Supplier<T> compute) {
        Entry cached = cache.getIfPresent(key);
        if (cached != null) {
            metrics.recordCacheHit();
            log.debug("Cache hit for {}", key);
            return (T) cached.value;
        }

        metrics.recordCacheMiss();
        log.debug("Cache miss for {}", key);
        T value = compute.get();
        if (value != null) {
            put(key, value, ttl);
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        Entry cached = cache.getIfPresent(key);
        return cached == null ? Optional.empty() : Optional.of((T) cached.value);
    }

    public void put(String key, Object value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        cache.put(key, new Entry(value, ttl));
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    /**
     * Drop every entry, typically after the underlying dataset was refreshed.
     */
    public long invalidateAll() {
        long sizeBefore = cache.estimatedSize();
        cache.invalidateAll();
        metrics.recordCacheInvalidation();
        log.info("Invalidated result cache, removed {} entries", sizeBefore);
        return sizeBefore;
    }

    public Map<String, Object> getCacheStats() {
        CacheStats stats = cache.stats();

        Map<String, Object> statsMap = new ConcurrentHashMap<>();
        statsMap.put("hit_count", stats.hitCount());
        statsMap.put("miss_count", stats.missCount());
        statsMap.put("hit_rate", stats.hitRate());
        statsMap.put("eviction_count", stats.evictionCount());
        statsMap.put("estimated_size", cache.estimatedSize());
        return statsMap;
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static final class Entry {
        final Object value;
        final Duration ttl;

        Entry(Object value, Duration ttl) {
            this.value = value;
            this.ttl = ttl;
        }
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl.toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl.toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
