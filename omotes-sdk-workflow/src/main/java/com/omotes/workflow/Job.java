package com.omotes.workflow;

import java.util.Objects;
import java.util.UUID;

/** Handle to a submitted job: its id and the workflow type it runs. */
public final class Job {

    private final UUID id;
    private final WorkflowType workflowType;

    public Job(UUID id, WorkflowType workflowType) {
        this.id = Objects.requireNonNull(id, "id");
        this.workflowType = Objects.requireNonNull(workflowType, "workflowType");
    }

    public UUID getId() {
        return id;
    }

    public WorkflowType getWorkflowType() {
        return workflowType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Job job = (Job) o;
        return id.equals(job.id) && workflowType.equals(job.workflowType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, workflowType);
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", workflowType=" + workflowType.getWorkflowTypeName() + "}";
    }
}
