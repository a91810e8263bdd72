package com.zzf.koda.core.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.koda.config.AgentConfig;
import com.zzf.koda.core.tool.ToolSchema.FieldType;
import com.zzf.koda.shell.ShellService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * run_command: runs a shell command in the repository root. A non-zero exit or a timeout is
 * reported in the result, not as a tool error.
 */
@Slf4j
@Component
public class CommandTool implements Tool {

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .required("command", FieldType.STRING, "Shell command to run from the repository root")
            .optional("timeout", FieldType.INTEGER, "Timeout in seconds (default 30)")
            .build();

    private final AgentConfig config;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final CommandExecutor executor;

    public CommandTool(AgentConfig config, ObjectMapper objectMapper, ResourceLoader resourceLoader, ShellService shellService) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.executor = new CommandExecutor(shellService);
    }

    @Override
    public String getId() {
        return "run_command";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(resourceLoader, getId(),
                "Run a shell command in the repository root and return stdout, stderr and the exit code.");
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolCapability getCapability() {
        return ToolCapability.EXEC;
    }

    @Override
    public CompletableFuture<Result> execute(JsonNode args, Context ctx) {
        return CompletableFuture.supplyAsync(() -> {
            String command = args.get("command").asText();
            if (command.isBlank()) {
                throw new IllegalArgumentException("command is blank");
            }
            long timeoutMs = timeoutMs(args);
            CommandExecutor.ExecutionResult run;
            try {
                run = executor.execute(command, ctx.getRepository().root(), timeoutMs, ctx.getTaskID(), ctx.getCallID());
            } catch (IOException e) {
                throw new UncheckedIOException("Could not start command: " + e.getMessage(), e);
            }
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("stdout", run.stdout);
            payload.put("stderr", run.stderr);
            payload.put("exit_code", run.exitCode);
            payload.put("timed_out", run.timedOut);
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("exit_code", run.exitCode);
            metadata.put("timed_out", run.timedOut);
            metadata.put("duration_ms", run.durationMs);
            try {
                return Result.builder()
                        .title(command)
                        .metadata(metadata)
                        .output(objectMapper.writeValueAsString(payload))
                        .build();
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Could not encode command result", e);
            }
        });
    }

    @Override
    public void cancel(String taskID, String callID) {
        executor.cancel(taskID, callID);
    }

    private long timeoutMs(JsonNode args) {
        long timeoutMs = config.getCommandTimeoutMs();
        if (args.hasNonNull("timeout")) {
            int seconds = args.get("timeout").asInt();
            if (seconds <= 0) {
                throw new IllegalArgumentException("timeout must be a positive number of seconds");
            }
            timeoutMs = seconds * 1000L;
        }
        return Math.min(timeoutMs, config.getMaxCommandTimeoutMs());
    }
}
