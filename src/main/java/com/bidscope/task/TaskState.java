package com.bidscope.task;

/**
 * Task lifecycle: {@code PENDING -> STARTED -> PROGRESS* -> SUCCESS | FAILURE | CANCELLED}.
 * A pending task may also be cancelled before it starts.
 */
public enum TaskState {
    PENDING,
    STARTED,
    PROGRESS,
    SUCCESS,
    FAILURE,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == CANCELLED;
    }

    boolean canMoveTo(TaskState next) {
        if (isTerminal()) {
            return false;
        }
        switch (next) {
            case PENDING:
                return false;
            case STARTED:
                return this == PENDING;
            case PROGRESS:
                return this == STARTED || this == PROGRESS;
            case SUCCESS:
                return this == STARTED || this == PROGRESS;
            case FAILURE:
            case CANCELLED:
                return true;
            default:
                return false;
        }
    }
}
