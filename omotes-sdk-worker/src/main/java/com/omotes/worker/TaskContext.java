package com.omotes.worker;

import java.util.Objects;

/** Identity of one task execution, assigned by the {@link TaskRunner}. */
public final class TaskContext {

    private final String taskId;
    private final String taskType;

    public TaskContext(String taskId, String taskType) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.taskType = Objects.requireNonNull(taskType, "taskType");
    }

    public String getTaskId() {
        return taskId;
    }

    public String getTaskType() {
        return taskType;
    }

    @Override
    public String toString() {
        return "TaskContext{taskId=" + taskId + ", taskType=" + taskType + "}";
    }
}
