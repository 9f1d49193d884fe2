package com.bidscope.task;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Operations that can run as background tasks.
 */
public enum TaskKind {
    SEARCH("search"),
    AGGREGATE("aggregate"),
    EXPORT("export");

    private final String value;

    TaskKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static TaskKind fromValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (TaskKind kind : TaskKind.values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown task kind: " + value);
    }
}
