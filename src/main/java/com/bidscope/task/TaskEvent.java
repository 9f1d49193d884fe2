package com.bidscope.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A state or progress change of one task, pushed to subscribers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskEvent {

    @JsonProperty("task_id")
    private final String taskId;

    @JsonProperty("state")
    private final TaskState state;

    @JsonProperty("progress")
    private final int progress;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("error")
    private final String error;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    public TaskEvent(String taskId, TaskState state, int progress, String message, String error, Instant timestamp) {
        this.taskId = taskId;
        this.state = state;
        this.progress = progress;
        this.message = message;
        this.error = error;
        this.timestamp = timestamp;
    }

    static TaskEvent of(TaskSnapshot snapshot, Instant timestamp) {
        return new TaskEvent(snapshot.getTaskId(), snapshot.getState(), snapshot.getProgress(),
            snapshot.getMessage(), snapshot.getError(), timestamp);
    }

    public String getTaskId() {
        return taskId;
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

    public String getError() {
        return error;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "TaskEvent{" + taskId + " " + state + " " + progress + "%}";
    }
}
