package com.zzf.koda.core.agent;

import java.time.Instant;

/**
 * Immutable description of what the user asked for.
 */
public final class Task {

    private final String id;
    private final String description;
    private final String repoUrl;
    private final String branch;
    private final Instant createdAt;

    public Task(String id, String description, String repoUrl, String branch) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("task id is blank");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("task description is blank");
        }
        this.id = id;
        this.description = description.trim();
        this.repoUrl = repoUrl == null || repoUrl.isBlank() ? null : repoUrl.trim();
        this.branch = branch == null || branch.isBlank() ? null : branch.trim();
        this.createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public String getRepoUrl() {
        return repoUrl;
    }

    public String getBranch() {
        return branch;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean hasRepository() {
        return repoUrl != null;
    }
}
