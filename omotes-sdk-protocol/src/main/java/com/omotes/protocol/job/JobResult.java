package com.omotes.protocol.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * Terminal outcome of a job: the output ESDL on success, logs in either case.
 * Exactly one result is published per job.
 */
public final class JobResult {

    public enum ResultType {
        SUCCEEDED,
        FAILED
    }

    private final String jobId;
    private final String taskId;
    private final String taskType;
    private final ResultType resultType;
    private final byte[] outputEsdl;
    private final String logs;

    @JsonCreator
    public JobResult(
            @JsonProperty("job_id") String jobId,
            @JsonProperty("task_id") String taskId,
            @JsonProperty("task_type") String taskType,
            @JsonProperty("result_type") ResultType resultType,
            @JsonProperty("output_esdl") byte[] outputEsdl,
            @JsonProperty("logs") String logs) {
        this.jobId = jobId;
        this.taskId = taskId;
        this.taskType = taskType;
        this.resultType = resultType;
        this.outputEsdl = outputEsdl != null ? outputEsdl.clone() : null;
        this.logs = logs != null ? logs : "";
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

    @JsonProperty("result_type")
    public ResultType getResultType() {
        return resultType;
    }

    /** Output document, or null when the job produced none (e.g. on failure). */
    @JsonProperty("output_esdl")
    public byte[] getOutputEsdl() {
        return outputEsdl != null ? outputEsdl.clone() : null;
    }

    @JsonProperty("logs")
    public String getLogs() {
        return logs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobResult that = (JobResult) o;
        return Objects.equals(jobId, that.jobId)
                && Objects.equals(taskId, that.taskId)
                && Objects.equals(taskType, that.taskType)
                && resultType == that.resultType
                && Arrays.equals(outputEsdl, that.outputEsdl)
                && Objects.equals(logs, that.logs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, taskId, taskType, resultType, Arrays.hashCode(outputEsdl), logs);
    }
}
