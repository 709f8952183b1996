package com.omotes.protocol.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Catalog of every workflow type an orchestrator supports. */
public final class AvailableWorkflows {

    private final List<WorkflowMessage> workflows;

    @JsonCreator
    public AvailableWorkflows(@JsonProperty("workflows") List<WorkflowMessage> workflows) {
        this.workflows = workflows != null ? List.copyOf(workflows) : List.of();
    }

    @JsonProperty("workflows")
    public List<WorkflowMessage> getWorkflows() {
        return workflows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(workflows, ((AvailableWorkflows) o).workflows);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(workflows);
    }
}
