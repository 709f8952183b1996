package com.omotes.protocol.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.omotes.protocol.WireValues;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Work item dispatched by the orchestrator to the workers of one task type.
 * Carries the job id, the input ESDL and the wire-encoded workflow parameters of the submission.
 */
public final class WorkerTaskRequest {

    private final String jobId;
    private final String taskType;
    private final byte[] inputEsdl;
    private final Map<String, Object> params;

    @JsonCreator
    public WorkerTaskRequest(
            @JsonProperty("job_id") String jobId,
            @JsonProperty("task_type") String taskType,
            @JsonProperty("input_esdl") byte[] inputEsdl,
            @JsonProperty("params") Map<String, Object> params) {
        this.jobId = jobId;
        this.taskType = taskType;
        this.inputEsdl = inputEsdl != null ? inputEsdl.clone() : new byte[0];
        this.params = WireValues.normalize(params);
    }

    /** Builds the request for a received submission. */
    public static WorkerTaskRequest forSubmission(JobSubmission submission, String taskType) {
        return new WorkerTaskRequest(submission.getUuid(), taskType, submission.getEsdl(), submission.getParams());
    }

    @JsonProperty("job_id")
    public String getJobId() {
        return jobId;
    }

    @JsonProperty("task_type")
    public String getTaskType() {
        return taskType;
    }

    @JsonProperty("input_esdl")
    public byte[] getInputEsdl() {
        return inputEsdl.clone();
    }

    @JsonProperty("params")
    public Map<String, Object> getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerTaskRequest that = (WorkerTaskRequest) o;
        return Objects.equals(jobId, that.jobId)
                && Objects.equals(taskType, that.taskType)
                && Arrays.equals(inputEsdl, that.inputEsdl)
                && Objects.equals(params, that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, taskType, Arrays.hashCode(inputEsdl), params);
    }
}
