package com.zzf.koda.core.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Initiating client message: {@code {task, repo_url?, branch?}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskRequest {
    @JsonProperty("task")
    private String task;
    @JsonProperty("repo_url")
    private String repoUrl;
    @JsonProperty("branch")
    private String branch;

    public TaskRequest(String task) {
        this.task = task;
    }
}
