package com.bidscope.task;

import com.bidscope.export.CancellationToken;
import reactor.core.Disposable;

import java.time.Instant;

/**
 * Mutable state of one task, owned by the registry.
 *
 * <p>All mutators are synchronized and refuse illegal moves: a terminal state is final and
 * progress never goes down. They return whether anything changed so callers publish an event only
 * for real transitions.
 */
class TaskRecord {

    private final String id;
    private final TaskKind kind;
    private final String cacheKey;
    private final Instant createdAt;
    private final CancellationToken cancellationToken = new CancellationToken();

    private TaskState state = TaskState.PENDING;
    private int progress;
    private String message = "Queued";
    private String error;
    private Instant startedAt;
    private Instant completedAt;
    private int attempts;
    private Disposable subscription;

    TaskRecord(String id, TaskKind kind, String cacheKey, Instant createdAt) {
        this.id = id;
        this.kind = kind;
        this.cacheKey = cacheKey;
        this.createdAt = createdAt;
    }

    String getId() {
        return id;
    }

    TaskKind getKind() {
        return kind;
    }

    String getCacheKey() {
        return cacheKey;
    }

    CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    synchronized TaskState getState() {
        return state;
    }

    synchronized Instant getCompletedAt() {
        return completedAt;
    }

    synchronized void attachSubscription(Disposable subscription) {
        this.subscription = subscription;
    }

    /**
     * Called by the worker at the start of every attempt.
     */
    synchronized boolean start(Instant now) {
        attempts++;
        if (!state.canMoveTo(TaskState.STARTED)) {
            return false;
        }
        state = TaskState.STARTED;
        startedAt = now;
        message = "Started";
        return true;
    }

    synchronized boolean progress(int percent, String status) {
        if (!state.canMoveTo(TaskState.PROGRESS) || percent < progress) {
            return false;
        }
        state = TaskState.PROGRESS;
        progress = Math.min(percent, 100);
        message = status;
        return true;
    }

    synchronized boolean succeed(Instant now) {
        if (!state.canMoveTo(TaskState.SUCCESS)) {
            return false;
        }
        state = TaskState.SUCCESS;
        progress = 100;
        message = "Completed";
        completedAt = now;
        return true;
    }

    synchronized boolean fail(String errorSummary, Instant now) {
        if (!state.canMoveTo(TaskState.FAILURE)) {
            return false;
        }
        state = TaskState.FAILURE;
        error = errorSummary;
        message = "Failed";
        completedAt = now;
        return true;
    }

    /**
     * Trip the token and, for a task that has not started yet, drop its queued work.
     * A running worker notices the token at its next batch or progress boundary.
     */
    synchronized boolean cancel(Instant now) {
        if (!state.canMoveTo(TaskState.CANCELLED)) {
            return false;
        }
        boolean queued = state == TaskState.PENDING;
        state = TaskState.CANCELLED;
        message = "Cancelled";
        completedAt = now;
        cancellationToken.cancel();
        if (queued && subscription != null) {
            subscription.dispose();
        }
        return true;
    }

    synchronized TaskSnapshot snapshot() {
        return new TaskSnapshot(id, kind, state, progress, message, cacheKey, error, attempts,
            createdAt, startedAt, completedAt);
    }
}
