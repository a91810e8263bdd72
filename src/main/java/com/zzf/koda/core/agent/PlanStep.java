package com.zzf.koda.core.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.ALWAYS)
public final class PlanStep {

    private final String description;
    private final String tool;
    private volatile ExecutionStatus status = ExecutionStatus.PENDING;

    public PlanStep(String description, String tool) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("plan step description is blank");
        }
        this.description = description.trim();
        this.tool = tool == null || tool.isBlank() ? null : tool.trim();
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("tool")
    public String getTool() {
        return tool;
    }

    @JsonProperty("status")
    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    @Override
    public String toString() {
        return tool == null ? description : description + " [" + tool + "]";
    }
}
