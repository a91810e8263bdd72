package com.zzf.koda.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.koda.core.change.StagedChange;
import com.zzf.koda.core.tool.ToolSchema.FieldType;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class DeleteTool implements Tool {

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .required("path", FieldType.STRING, "Repository-relative path of the file to delete")
            .build();

    private final ResourceLoader resourceLoader;

    @Override
    public String getId() {
        return "delete_file";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(resourceLoader, getId(), "Delete a file. The deletion is staged for user approval.");
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
                throw new IllegalArgumentException("'" + path + "' is a directory, only files can be deleted");
            }
            Optional<StagedChange> change = ctx.getChangeManager().stageDelete(path);
            String output = change.isPresent()
                    ? "Staged delete of '" + path + "' for approval."
                    : "Dropped the staged creation of '" + path + "'; nothing to delete.";
            return Result.builder().title(path).output(output).build();
        });
    }
}
