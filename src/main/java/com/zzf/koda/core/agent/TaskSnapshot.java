package com.zzf.koda.core.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Authoritative task state served over REST; what a reconnecting client reads instead of replay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskSnapshot {

    private String id;
    private String task;
    private Phase phase;
    @JsonProperty("repo_url")
    private String repoUrl;
    private String branch;
    private String summary;
    private List<Step> plan;
    @JsonProperty("tool_calls")
    private int toolCalls;
    @JsonProperty("staged_changes")
    private int stagedChanges;
    private ErrorInfo error;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Step {
        private String description;
        private String tool;
        private String status;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorInfo {
        private String code;
        private String message;
    }

    public static TaskSnapshot of(TaskContext ctx) {
        List<Step> steps = new ArrayList<>();
        for (PlanStep step : ctx.getPlan()) {
            steps.add(new Step(step.getDescription(), step.getTool(), step.getStatus().wireName()));
        }
        Task task = ctx.getTask();
        ErrorInfo error = ctx.getErrorCode() == null ? null
                : new ErrorInfo(ctx.getErrorCode().code(), ctx.getErrorMessage());
        return TaskSnapshot.builder()
                .id(task.getId())
                .task(task.getDescription())
                .phase(ctx.getPhase())
                .repoUrl(task.getRepoUrl())
                .branch(task.getBranch())
                .summary(ctx.getSummary())
                .plan(steps)
                .toolCalls(ctx.getToolCalls().size())
                .stagedChanges(ctx.getChangeManager() == null ? 0 : ctx.getChangeManager().size())
                .error(error)
                .build();
    }
}
