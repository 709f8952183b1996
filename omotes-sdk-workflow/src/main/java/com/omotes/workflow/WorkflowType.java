package com.omotes.workflow;

import com.omotes.workflow.parameter.WorkflowParameter;

import java.util.List;
import java.util.Objects;

/**
 * A kind of job the orchestrator can run. Identified by its technical name alone: two instances
 * with the same name are equal whatever their description or parameters, so catalogs can be
 * compared across refreshes.
 */
public final class WorkflowType {

    private final String workflowTypeName;
    private final String workflowTypeDescriptionName;
    private final List<WorkflowParameter> workflowParameters;

    public WorkflowType(String workflowTypeName, String workflowTypeDescriptionName,
                        List<WorkflowParameter> workflowParameters) {
        this.workflowTypeName = Objects.requireNonNull(workflowTypeName, "workflowTypeName");
        this.workflowTypeDescriptionName = workflowTypeDescriptionName;
        this.workflowParameters = workflowParameters != null ? List.copyOf(workflowParameters) : List.of();
    }

    public WorkflowType(String workflowTypeName, String workflowTypeDescriptionName) {
        this(workflowTypeName, workflowTypeDescriptionName, null);
    }

    /** Technical name; also the suffix of the submission queue. */
    public String getWorkflowTypeName() {
        return workflowTypeName;
    }

    /** Human-readable label. */
    public String getWorkflowTypeDescriptionName() {
        return workflowTypeDescriptionName;
    }

    /** Non-ESDL parameters in configured order; empty when the workflow takes none. */
    public List<WorkflowParameter> getWorkflowParameters() {
        return workflowParameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return workflowTypeName.equals(((WorkflowType) o).workflowTypeName);
    }

    @Override
    public int hashCode() {
        return workflowTypeName.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowType{" + workflowTypeName + "}";
    }
}
