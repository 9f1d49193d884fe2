package com.bidscope.task;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reply to a submit: the handle to poll and the cache key the result will be stored under.
 */
public class TaskSubmission {

    @JsonProperty("task_id")
    private final String taskId;

    @JsonProperty("cache_key")
    private final String cacheKey;

    @JsonProperty("state")
    private final TaskState state;

    public TaskSubmission(String taskId, String cacheKey, TaskState state) {
        this.taskId = taskId;
        this.cacheKey = cacheKey;
        this.state = state;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public TaskState getState() {
        return state;
    }
}
