package com.bidscope.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Point-in-time view of a task, as returned by status polls and carried by events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskSnapshot {

    @JsonProperty("task_id")
    private final String taskId;

    @JsonProperty("kind")
    private final TaskKind kind;

    @JsonProperty("state")
    private final TaskState state;

    @JsonProperty("progress")
    private final int progress;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("cache_key")
    private final String cacheKey;

    @JsonProperty("error")
    private final String error;

    @JsonProperty("attempts")
    private final int attempts;

    @JsonProperty("created_at")
    private final Instant createdAt;

    @JsonProperty("started_at")
    private final Instant startedAt;

    @JsonProperty("completed_at")
    private final Instant completedAt;

    public TaskSnapshot(String taskId, TaskKind kind, TaskState state, int progress, String message,
                        String cacheKey, String error, int attempts,
                        Instant createdAt, Instant startedAt, Instant completedAt) {
        this.taskId = taskId;
        this.kind = kind;
        this.state = state;
        this.progress = progress;
        this.message = message;
        this.cacheKey = cacheKey;
        this.error = error;
        this.attempts = attempts;
        this.createdAt = createdAt;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskKind getKind() {
        return kind;
    }

    public TaskState getState() {
        return state;
    }

    public int getProgress() {
        return progress;
    }

    public String getMessage() {
        return message;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public String getError() {
        return error;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public String toString() {
        return "TaskSnapshot{" + taskId + ", " + kind + ", " + state + ", " + progress + "%}";
    }
}
