package com.bidscope.analytics;

import com.bidscope.config.BidScopeProperties;
import com.bidscope.error.BackingStoreException;
import com.bidscope.error.CapacityException;
import com.bidscope.query.QueryMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs interactive (request/response) store calls under a soft timeout and a circuit breaker.
 *
 * <ul>
 *   <li>A call that outlives the timeout fails with {@link CapacityException} so the caller can
 *       resubmit it as a task. The store work itself is not interrupted.</li>
 *   <li>Repeated {@link BackingStoreException}s open the breaker; while open, calls fail fast.</li>
 * </ul>
 */
@Component
public class InteractiveQueryGuard {

    private static final Logger log = LoggerFactory.getLogger(InteractiveQueryGuard.class);

    private final CircuitBreaker circuitBreaker;
    private final Duration timeout;
    private final QueryMetrics metrics;

    public InteractiveQueryGuard(BidScopeProperties properties, QueryMetrics metrics) {
        this(properties.getQuery().getInteractiveTimeout(), metrics);
    }

    InteractiveQueryGuard(Duration timeout, QueryMetrics metrics) {
        this.timeout = timeout;
        this.metrics = metrics;

        // Opens when half of the last 20 calls failed in the store, half-open after 30s
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(20)
            .minimumNumberOfCalls(10)
            .recordExceptions(BackingStoreException.class)
            .build();
        this.circuitBreaker = CircuitBreaker.of("duckdb", config);
    }

    public <T> T call(String operation, Supplier<T> work) {
        return Mono.fromSupplier(work)
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .onErrorMap(TimeoutException.class, e -> {
                metrics.recordCapacityExceeded();
                log.warn("Interactive {} exceeded {}; ask the client to submit a task", operation, timeout);
                return new CapacityException("Query exceeded the interactive time limit of "
                    + timeout.toSeconds() + "s; submit it as a background task", operation, e);
            })
            .onErrorMap(CallNotPermittedException.class, e -> {
                log.warn("Circuit breaker open, rejecting {}", operation);
                return new BackingStoreException("Analytics store is temporarily unavailable", operation, e);
            })
            .block();
    }

    public CircuitBreaker.State getState() {
        return circuitBreaker.getState();
    }
}
