package com.zzf.koda.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.koda.config.AgentConfig;
import com.zzf.koda.core.change.WorkspaceView;
import com.zzf.koda.core.tool.ToolSchema.FieldType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * read_file: file content as the task currently sees it, staged writes included.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReadTool implements Tool {

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .required("path", FieldType.STRING, "Repository-relative path of the file to read")
            .optional("max_lines", FieldType.INTEGER, "Return at most this many lines from the start of the file")
            .build();

    private final AgentConfig config;
    private final ResourceLoader resourceLoader;

    @Override
    public String getId() {
        return "read_file";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(resourceLoader, getId(), "Read the contents of a file in the repository.");
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
            int limit = config.getMaxReadLines();
            if (args.hasNonNull("max_lines")) {
                int requested = args.get("max_lines").asInt();
                if (requested <= 0) {
                    throw new IllegalArgumentException("max_lines must be positive");
                }
                limit = Math.min(requested, limit);
            }
            WorkspaceView workspace = ctx.workspace();
            if (workspace.isDirectory(path)) {
                throw new IllegalArgumentException("'" + path + "' is a directory, use list_directory");
            }
            Optional<String> content;
            try {
                content = workspace.read(path);
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read " + path, e);
            }
            if (content.isEmpty()) {
                throw new IllegalArgumentException("File not found: " + path);
            }
            String text = content.get();
            if (text.indexOf('\0') >= 0) {
                throw new IllegalArgumentException("Cannot read binary file: " + path);
            }
            String[] lines = text.split("\n", -1);
            int total = text.endsWith("\n") ? lines.length - 1 : lines.length;
            String output = text;
            boolean truncated = total > limit;
            if (truncated) {
                output = String.join("\n", Arrays.copyOfRange(lines, 0, limit))
                        + "\n... (" + (total - limit) + " more lines)";
            }
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("lines", total);
            metadata.put("truncated", truncated);
            log.debug("tool.read taskId={} path={} lines={} truncated={}", ctx.getTaskID(), path, total, truncated);
            return Result.builder().title(path).metadata(metadata).output(output).build();
        });
    }
}
