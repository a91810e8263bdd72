package com.zzf.koda.core.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.koda.core.agent.Phase;
import com.zzf.koda.core.change.ChangeManager;
import com.zzf.koda.core.change.WorkspaceView;
import com.zzf.koda.core.repo.RepositoryAccess;
import com.zzf.koda.core.repo.RepositoryPaths;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * A capability the model may invoke. Implementations report failure by completing the future
 * exceptionally; the registry turns that into a tool-error result.
 */
public interface Tool {

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    class Context {
        private String taskID;
        private String callID;
        private Phase phase;
        private RepositoryAccess repository;
        private ChangeManager changeManager;

        public WorkspaceView workspace() {
            return new WorkspaceView(repository, changeManager);
        }

        /**
         * Canonical repository-relative form of a model-supplied path.
         *
         * @throws IllegalArgumentException if the path escapes the repository root
         */
        public String relativePath(String rawPath) {
            String relative = RepositoryPaths.relativize(repository.root(), RepositoryPaths.resolve(repository.root(), rawPath));
            return relative.isEmpty() ? "." : relative;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class Result {
        private String title;
        private Map<String, Object> metadata;
        private String output;
    }

    String getId();

    String getDescription();

    ToolSchema getSchema();

    ToolCapability getCapability();

    default Set<Phase> getPhases() {
        return getCapability().defaultPhases();
    }

    default ToolDefinition definition() {
        return new ToolDefinition(getId(), getDescription(), getSchema(), getCapability(), getPhases());
    }

    CompletableFuture<Result> execute(JsonNode args, Context ctx);

    default void cancel(String taskID, String callID) {
        // Only tools that own an external process need to react.
    }
}
