package com.zzf.koda.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.koda.core.change.StagedChange;
import com.zzf.koda.core.tool.ToolSchema.FieldType;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * write_file: stages full new content for a path. Nothing reaches the repository until approval.
 */
@Component
@RequiredArgsConstructor
public class WriteTool implements Tool {

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .required("path", FieldType.STRING, "Repository-relative path of the file to create or overwrite")
            .required("content", FieldType.STRING, "Complete new content of the file")
            .build();

    private final ResourceLoader resourceLoader;

    @Override
    public String getId() {
        return "write_file";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(resourceLoader, getId(),
                "Write the complete content of a file. The change is staged for user approval.");
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolCapability getCapability() {
        return ToolCapability.WRITE;
    }

    @Override
    public CompletableFuture<Result> execute(JsonNode args, Context ctx) {
        return CompletableFuture.supplyAsync(() -> {
            String path = ctx.relativePath(args.get("path").asText());
            if (ctx.workspace().isDirectory(path)) {
                throw new IllegalArgumentException("'" + path + "' is a directory");
            }
            StagedChange change = ctx.getChangeManager().stageWrite(path, args.get("content").asText());
            return Result.builder()
                    .title(path)
                    .metadata(Map.of("change_type", change.getChangeType().wireName()))
                    .output("Staged " + change.getChangeType().wireName() + " of '" + path + "' for approval.")
                    .build();
        });
    }
}
