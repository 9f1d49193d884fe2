package com.bidscope.analytics;

import com.bidscope.error.BackingStoreException;
import com.bidscope.error.CapacityException;
import com.bidscope.error.ValidationException;
import com.bidscope.query.QueryMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InteractiveQueryGuard Tests")
class InteractiveQueryGuardTest {

    private QueryMetrics metrics;

    @BeforeEach
    void setUp() {
        metrics = new QueryMetrics(new SimpleMeterRegistry());
        metrics.init();
    }

    @Test
    @DisplayName("Should return the value of a call that finishes in time")
    void shouldReturnValue() {
        InteractiveQueryGuard guard = new InteractiveQueryGuard(Duration.ofSeconds(5), metrics);

        assertThat(guard.call("search", () -> 42)).isEqualTo(42);
        assertThat(guard.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("Should turn a slow call into a capacity error")
    void shouldRejectSlowCall() {
        InteractiveQueryGuard guard = new InteractiveQueryGuard(Duration.ofMillis(50), metrics);

        assertThatThrownBy(() -> guard.call("aggregate", () -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }))
            .isInstanceOf(CapacityException.class)
            .hasMessageContaining("submit it as a background task");
        assertThat(metrics.getQueriesOverCapacity().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should pass validation errors through unchanged")
    void shouldPropagateValidationErrors() {
        InteractiveQueryGuard guard = new InteractiveQueryGuard(Duration.ofSeconds(5), metrics);

        assertThatThrownBy(() -> guard.call("search", () -> {
            throw new ValidationException("page", "Page must be at least 1");
        })).isInstanceOf(ValidationException.class);
        assertThat(guard.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("Should open the breaker after repeated store failures and fail fast")
    void shouldOpenBreakerOnStoreFailures() {
        InteractiveQueryGuard guard = new InteractiveQueryGuard(Duration.ofSeconds(5), metrics);

        for (int i = 0; i < 10; i++) {
            assertThatThrownBy(() -> guard.call("search", () -> {
                throw new BackingStoreException("store down", "search");
            })).isInstanceOf(BackingStoreException.class);
        }

        assertThat(guard.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThatThrownBy(() -> guard.call("search", () -> "never runs"))
            .isInstanceOf(BackingStoreException.class)
            .hasMessageContaining("temporarily unavailable");
    }
}
