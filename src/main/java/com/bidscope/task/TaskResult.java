package com.bidscope.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome lookup for a task. {@code ready} is true only when the task succeeded and its payload is
 * still cached.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskResult {

    @JsonProperty("task_id")
    private final String taskId;

    @JsonProperty("state")
    private final TaskState state;

    @JsonProperty("ready")
    private final boolean ready;

    @JsonProperty("result")
    private final Object result;

    @JsonProperty("error")
    private final String error;

    private TaskResult(String taskId, TaskState state, boolean ready, Object result, String error) {
        this.taskId = taskId;
        this.state = state;
        this.ready = ready;
        this.result = result;
        this.error = error;
    }

    static TaskResult ready(String taskId, Object result) {
        return new TaskResult(taskId, TaskState.SUCCESS, true, result, null);
    }

    static TaskResult notReady(String taskId, TaskState state, String error) {
        return new TaskResult(taskId, state, false, null, error);
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskState getState() {
        return state;
    }

    public boolean isReady() {
        return ready;
    }

    public Object getResult() {
        return result;
    }

    public String getError() {
        return error;
    }
}
