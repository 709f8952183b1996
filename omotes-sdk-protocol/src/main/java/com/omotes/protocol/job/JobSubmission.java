package com.omotes.protocol.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.omotes.protocol.WireValues;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Request to run a job: the input ESDL document plus wire-encoded workflow parameters.
 * Published by the SDK on the submission queue of the workflow type.
 */
public final class JobSubmission {

    private final String uuid;
    private final Long timeoutMs;
    private final String workflowType;
    private final byte[] esdl;
    private final Map<String, Object> params;

    @JsonCreator
    public JobSubmission(
            @JsonProperty("uuid") String uuid,
            @JsonProperty("timeout_ms") Long timeoutMs,
            @JsonProperty("workflow_type") String workflowType,
            @JsonProperty("esdl") byte[] esdl,
            @JsonProperty("params") Map<String, Object> params) {
        this.uuid = uuid;
        this.timeoutMs = timeoutMs;
        this.workflowType = workflowType;
        this.esdl = esdl != null ? esdl.clone() : new byte[0];
        this.params = WireValues.normalize(params);
    }

    @JsonProperty("uuid")
    public String getUuid() {
        return uuid;
    }

    /** Job timeout in milliseconds, or null when the job may run indefinitely. */
    @JsonProperty("timeout_ms")
    public Long getTimeoutMs() {
        return timeoutMs;
    }

    @JsonProperty("workflow_type")
    public String getWorkflowType() {
        return workflowType;
    }

    @JsonProperty("esdl")
    public byte[] getEsdl() {
        return esdl.clone();
    }

    /** Parameter values keyed by parameter key name; values are String, Boolean or Double. */
    @JsonProperty("params")
    public Map<String, Object> getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobSubmission that = (JobSubmission) o;
        return Objects.equals(uuid, that.uuid)
                && Objects.equals(timeoutMs, that.timeoutMs)
                && Objects.equals(workflowType, that.workflowType)
                && Arrays.equals(esdl, that.esdl)
                && Objects.equals(params, that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, timeoutMs, workflowType, Arrays.hashCode(esdl), params);
    }
}
