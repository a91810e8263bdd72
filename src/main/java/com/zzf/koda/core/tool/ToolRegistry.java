package com.zzf.koda.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.koda.config.AgentConfig;
import com.zzf.koda.core.agent.Phase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Name-to-implementation table for every tool, plus the validation gate in front of them.
 * Stateless after construction and shared by all tasks.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, Tool> tools = new LinkedHashMap<>();
    private final int maxObservationChars;

    public ToolRegistry(List<Tool> tools, AgentConfig config) {
        for (Tool tool : tools) {
            String id = tool.getId();
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("tool without id: " + tool.getClass().getName());
            }
            if (this.tools.putIfAbsent(id, tool) != null) {
                throw new IllegalStateException("duplicate tool id: " + id);
            }
        }
        this.maxObservationChars = config.getMaxObservationChars();
        log.info("tool.registry tools={}", this.tools.keySet());
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }

    public List<ToolDefinition> definitionsFor(Phase phase) {
        List<ToolDefinition> out = new ArrayList<>();
        for (Tool tool : tools.values()) {
            ToolDefinition definition = tool.definition();
            if (definition.isCallableIn(phase)) {
                out.add(definition);
            }
        }
        return out;
    }

    /**
     * Runs one call through eligibility and schema checks, then the implementation. Never throws
     * for tool-level problems: every failure comes back as an error outcome for the model.
     */
    public ToolOutcome dispatch(String name, JsonNode args, Tool.Context ctx) {
        Phase phase = ctx.getPhase();
        Tool tool = name == null ? null : tools.get(name);
        if (tool == null) {
            log.warn("tool.reject taskId={} tool={} reason=unknown", ctx.getTaskID(), name);
            return ToolOutcome.rejected("Unknown tool '" + name + "'. Available tools: " + namesFor(phase));
        }
        if (!tool.getPhases().contains(phase)) {
            log.warn("tool.reject taskId={} tool={} phase={} reason=ineligible", ctx.getTaskID(), name, phase.wireName());
            return ToolOutcome.rejected("Tool '" + name + "' is not available in the " + phase.wireName()
                    + " phase. Available tools: " + namesFor(phase));
        }
        List<String> violations = tool.getSchema().validate(args);
        if (!violations.isEmpty()) {
            log.warn("tool.invalid taskId={} tool={} violations={}", ctx.getTaskID(), name, violations);
            return ToolOutcome.invalidArguments("Invalid arguments for '" + name + "': " + String.join("; ", violations));
        }

        try {
            Tool.Result result = tool.execute(args, ctx).get();
            String output = result == null || result.getOutput() == null ? "" : result.getOutput();
            return ToolOutcome.executed(sanitize(output));
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            log.warn("tool.fail taskId={} tool={} id={} err={}", ctx.getTaskID(), name, ctx.getCallID(), cause.toString());
            return ToolOutcome.toolError(sanitize(messageOf(cause)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tool.cancel(ctx.getTaskID(), ctx.getCallID());
            return ToolOutcome.toolError("Tool call interrupted");
        } catch (RuntimeException e) {
            log.warn("tool.fail taskId={} tool={} id={} err={}", ctx.getTaskID(), name, ctx.getCallID(), e.toString());
            return ToolOutcome.toolError(sanitize(messageOf(e)));
        }
    }

    public void cancel(String taskID, String callID) {
        for (Tool tool : tools.values()) {
            tool.cancel(taskID, callID);
        }
    }

    private String namesFor(Phase phase) {
        List<String> names = new ArrayList<>();
        for (ToolDefinition definition : definitionsFor(phase)) {
            names.add(definition.getName());
        }
        return String.join(", ", names);
    }

    private String sanitize(String output) {
        return ToolOutputSanitizer.truncate(ToolOutputSanitizer.mask(output), maxObservationChars);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
