package com.zzf.koda.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.koda.core.change.WorkspaceView;
import com.zzf.koda.core.tool.ToolSchema.FieldType;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class ListTool implements Tool {

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .required("path", FieldType.STRING, "Repository-relative directory, '.' for the root")
            .build();

    private final ResourceLoader resourceLoader;

    @Override
    public String getId() {
        return "list_directory";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(resourceLoader, getId(), "List the entries of a directory in the repository.");
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolCapability getCapability() {
        return ToolCapability.READ;
    }

    @Override
    public CompletableFuture<Result> execute(JsonNode args, Context ctx) {
        return CompletableFuture.supplyAsync(() -> {
            String path = ctx.relativePath(args.get("path").asText());
            WorkspaceView workspace = ctx.workspace();
            if (!workspace.isDirectory(path)) {
                throw new IllegalArgumentException("Directory not found: " + path);
            }
            List<String> entries;
            try {
                entries = workspace.list(path);
            } catch (IOException e) {
                throw new UncheckedIOException("Could not list " + path, e);
            }
            String output = entries.isEmpty() ? "Directory '" + path + "' is empty." : String.join("\n", entries);
            return Result.builder()
                    .title(path)
                    .metadata(Map.of("count", entries.size()))
                    .output(output)
                    .build();
        });
    }
}
