package com.omotes.protocol.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Lifecycle status change of a job, sent by the orchestrator to the SDK. */
public final class JobStatusUpdate {

    public enum JobStatus {
        REGISTERED,
        ENQUEUED,
        RUNNING,
        SUCCEEDED,
        ERROR,
        CANCELLED,
        TIMEOUT
    }

    private final String jobId;
    private final JobStatus status;

    @JsonCreator
    public JobStatusUpdate(
            @JsonProperty("job_id") String jobId,
            @JsonProperty("status") JobStatus status) {
        this.jobId = jobId;
        this.status = status;
    }

    @JsonProperty("job_id")
    public String getJobId() {
        return jobId;
    }

    @JsonProperty("status")
    public JobStatus getStatus() {
        return status;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobStatusUpdate that = (JobStatusUpdate) o;
        return Objects.equals(jobId, that.jobId) && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, status);
    }
}
