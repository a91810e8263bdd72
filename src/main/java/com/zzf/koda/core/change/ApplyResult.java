package com.zzf.koda.core.change;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of applying a change set. Application is not transactional, so a failure part-way
 * through leaves the earlier paths written; both lists are reported as they happened.
 */
public final class ApplyResult {

    private final List<String> applied;
    private final List<Failure> failed;

    public ApplyResult(List<String> applied, List<Failure> failed) {
        this.applied = applied == null ? Collections.emptyList() : List.copyOf(applied);
        this.failed = failed == null ? Collections.emptyList() : List.copyOf(failed);
    }

    public static ApplyResult empty() {
        return new ApplyResult(Collections.emptyList(), Collections.emptyList());
    }

    @JsonProperty("applied")
    public List<String> getApplied() {
        return applied;
    }

    @JsonProperty("failed")
    public List<Failure> getFailed() {
        return failed;
    }

    @JsonIgnore
    public boolean isPartial() {
        return !failed.isEmpty();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return applied.isEmpty() && failed.isEmpty();
    }

    public String describe() {
        if (isEmpty()) {
            return "No changes to apply.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Applied ").append(applied.size()).append(" change(s)");
        if (!failed.isEmpty()) {
            sb.append(", ").append(failed.size()).append(" failed: ");
            for (int i = 0; i < failed.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(failed.get(i).getPath());
            }
        }
        return sb.toString();
    }

    public static final class Failure {
        private final String path;
        private final String reason;

        public Failure(String path, String reason) {
            this.path = path;
            this.reason = reason;
        }

        @JsonProperty("path")
        public String getPath() {
            return path;
        }

        @JsonProperty("reason")
        public String getReason() {
            return reason;
        }
    }
}
