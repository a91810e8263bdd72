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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * search_code: regex search over file contents, reported as {@code path:line: text}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GrepTool implements Tool {

    private static final int MAX_LINE_LENGTH = 300;

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .required("pattern", FieldType.STRING, "Java regular expression to search for")
            .optional("path", FieldType.STRING, "Directory or file to search, defaults to the repository root")
            .build();

    private final AgentConfig config;
    private final ResourceLoader resourceLoader;

    @Override
    public String getId() {
        return "search_code";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(resourceLoader, getId(), "Search file contents with a regular expression.");
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
            String regex = args.get("pattern").asText();
            Pattern pattern;
            try {
                pattern = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid regex: " + e.getDescription());
            }
            String path = ctx.relativePath(args.hasNonNull("path") ? args.get("path").asText() : ".");
            int cap = config.getMaxSearchMatches();
            WorkspaceView workspace = ctx.workspace();
            List<String> matches = new ArrayList<>();
            boolean capped = false;
            try {
                outer:
                for (String file : workspace.files(path)) {
                    Optional<String> content = workspace.read(file);
                    if (content.isEmpty() || content.get().indexOf('\0') >= 0) {
                        continue;
                    }
                    String[] lines = content.get().split("\n", -1);
                    for (int i = 0; i < lines.length; i++) {
                        if (pattern.matcher(lines[i]).find()) {
                            if (matches.size() >= cap) {
                                capped = true;
                                break outer;
                            }
                            matches.add(file + ":" + (i + 1) + ": " + clip(lines[i].strip()));
                        }
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Search failed under " + path, e);
            }
            log.debug("tool.search taskId={} pattern={} matches={} capped={}", ctx.getTaskID(), regex, matches.size(), capped);
            String output;
            if (matches.isEmpty()) {
                output = "No matches found for '" + regex + "'";
            } else {
                output = String.join("\n", matches);
                if (capped) {
                    output += "\n... (results capped at " + cap + " matches)";
                }
            }
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("matches", matches.size());
            metadata.put("truncated", capped);
            return Result.builder().title(regex).metadata(metadata).output(output).build();
        });
    }

    private static String clip(String line) {
        return line.length() > MAX_LINE_LENGTH ? line.substring(0, MAX_LINE_LENGTH) + "..." : line;
    }
}
