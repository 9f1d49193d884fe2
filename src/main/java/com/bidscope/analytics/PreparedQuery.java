package com.bidscope.analytics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * A validated, compiled operation that has not run yet, with the cache key and TTL its result is
 * stored under. The interactive path and task workers both execute these, so a task's result is
 * found under the same key as the equivalent interactive request.
 *
 * @param <T> result type
 */
public class PreparedQuery<T> {
    private final String operation;
    private final String cacheKey;
    private final Duration ttl;
    private final Supplier<T> work;

    public PreparedQuery(String operation, String cacheKey, Duration ttl, Supplier<T> work) {
        this.operation = operation;
        this.cacheKey = cacheKey;
        this.ttl = ttl;
        this.work = work;
    }

    public String getOperation() {
        return operation;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public Duration getTtl() {
        return ttl;
    }

    /**
     * Run against the store, bypassing cache and guard.
     */
    public T run() {
        return work.get();
    }
}
