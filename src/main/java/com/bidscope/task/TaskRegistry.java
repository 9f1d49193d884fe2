package com.bidscope.task;

import com.bidscope.config.BidScopeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of tasks. Completed tasks are evicted once they are older than the
 * configured TTL.
 */
@Component
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final Map<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final Duration completedTtl;
    private final Clock clock;

    @Autowired
    public TaskRegistry(BidScopeProperties properties) {
        this(properties.getTasks().getCompletedTtl(), Clock.systemUTC());
    }

    TaskRegistry(Duration completedTtl, Clock clock) {
        this.completedTtl = completedTtl;
        this.clock = clock;
    }

    /**
     * Register {@code record} only while fewer than {@code limit} tasks are active. The count and
     * the insert happen under one lock, so concurrent submissions can never overshoot the limit.
     *
     * @return false if the limit was already reached and nothing was registered
     */
    synchronized boolean registerWithin(TaskRecord record, int limit) {
        long active = tasks.values().stream()
            .filter(existing -> !existing.getState().isTerminal())
            .count();
        if (active >= limit) {
            return false;
        }
        tasks.put(record.getId(), record);
        return true;
    }

    Optional<TaskRecord> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    List<TaskRecord> active() {
        return tasks.values().stream()
            .filter(record -> !record.getState().isTerminal())
            .sorted(Comparator.comparing(record -> record.snapshot().getCreatedAt()))
            .toList();
    }

    int size() {
        return tasks.size();
    }

    Instant now() {
        return clock.instant();
    }

    /**
     * Drop terminal tasks whose completion is older than the TTL.
     */
    @Scheduled(fixedDelayString = "${bidscope.tasks.sweep-interval-ms:60000}")
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(completedTtl);
        int before = tasks.size();
        tasks.values().removeIf(record -> {
            Instant completedAt = record.getCompletedAt();
            return record.getState().isTerminal() && completedAt != null && completedAt.isBefore(cutoff);
        });
        int evicted = before - tasks.size();
        if (evicted > 0) {
            log.info("Evicted {} completed tasks older than {}", evicted, completedTtl);
        }
        return evicted;
    }
}
