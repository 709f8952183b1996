package com.omotes.protocol.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Progress of a job. Workers emit it per task execution; the orchestrator relays it to the SDK.
 * {@code taskId} and {@code taskType} let a consumer correlate updates of concurrent tasks that
 * share a queue.
 */
public final class JobProgressUpdate {

    private final String jobId;
    private final String taskId;
    private final String taskType;
    private final double progress;
    private final String message;

    @JsonCreator
    public JobProgressUpdate(
            @JsonProperty("job_id") String jobId,
            @JsonProperty("task_id") String taskId,
            @JsonProperty("task_type") String taskType,
            @JsonProperty("progress") double progress,
            @JsonProperty("message") String message) {
        if (progress < 0.0 || progress > 1.0) {
            throw new IllegalArgumentException("progress must be within [0, 1]: " + progress);
        }
        this.jobId = jobId;
        this.taskId = taskId;
        this.taskType = taskType;
        this.progress = progress;
        this.message = message;
    }

    @JsonProperty("job_id")
    public String getJobId() {
        return jobId;
    }

    @JsonProperty("task_id")
    public String getTaskId() {
        return taskId;
    }

    @JsonProperty("task_type")
    public String getTaskType() {
        return taskType;
    }

    /** Fraction of work done, 0.0 to 1.0. */
    @JsonProperty("progress")
    public double getProgress() {
        return progress;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobProgressUpdate that = (JobProgressUpdate) o;
        return Double.compare(progress, that.progress) == 0
                && Objects.equals(jobId, that.jobId)
                && Objects.equals(taskId, that.taskId)
                && Objects.equals(taskType, that.taskType)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, taskId, taskType, progress, message);
    }
}
