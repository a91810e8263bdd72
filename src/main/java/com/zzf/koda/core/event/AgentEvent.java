package com.zzf.koda.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.koda.core.agent.Phase;
import com.zzf.koda.core.agent.PlanStep;
import com.zzf.koda.core.change.ApplyResult;
import com.zzf.koda.core.change.StagedChange;
import com.zzf.koda.core.error.ErrorCode;

import java.util.List;
import java.util.Objects;

/**
 * One unit of the task event stream, serialized as {@code {type, data}}.
 */
public final class AgentEvent {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final EventType type;
    private final ObjectNode data;

    public AgentEvent(EventType type, ObjectNode data) {
        this.type = Objects.requireNonNull(type, "type");
        this.data = data == null ? NODES.objectNode() : data;
    }

    public EventType getType() {
        return type;
    }

    public ObjectNode getData() {
        return data;
    }

    public static AgentEvent task(String taskId) {
        ObjectNode data = NODES.objectNode();
        data.put("task_id", taskId);
        return new AgentEvent(EventType.TASK, data);
    }

    public static AgentEvent phase(Phase phase) {
        ObjectNode data = NODES.objectNode();
        data.put("phase", phase.wireName());
        return new AgentEvent(EventType.PHASE, data);
    }

    public static AgentEvent toolCall(String id, String name, JsonNode args) {
        ObjectNode data = NODES.objectNode();
        data.put("id", id);
        data.put("name", name);
        data.set("args", args == null ? NODES.objectNode() : args.deepCopy());
        return new AgentEvent(EventType.TOOL_CALL, data);
    }

    public static AgentEvent toolResult(String id, String name, String result, boolean isError) {
        ObjectNode data = NODES.objectNode();
        data.put("id", id);
        data.put("name", name);
        data.put("result", result == null ? "" : result);
        data.put("is_error", isError);
        return new AgentEvent(EventType.TOOL_RESULT, data);
    }

    public static AgentEvent summary(String text) {
        ObjectNode data = NODES.objectNode();
        data.put("text", text == null ? "" : text);
        return new AgentEvent(EventType.SUMMARY, data);
    }

    public static AgentEvent plan(List<PlanStep> steps) {
        ObjectNode data = NODES.objectNode();
        ArrayNode array = data.putArray("steps");
        for (PlanStep step : steps) {
            ObjectNode node = array.addObject();
            node.put("description", step.getDescription());
            if (step.getTool() == null) {
                node.putNull("tool");
            } else {
                node.put("tool", step.getTool());
            }
            node.put("status", step.getStatus().wireName());
        }
        return new AgentEvent(EventType.PLAN, data);
    }

    public static AgentEvent complete(Phase phase, List<StagedChange> changes, ApplyResult applyResult) {
        ObjectNode data = NODES.objectNode();
        data.put("phase", phase.wireName());
        ArrayNode array = data.putArray("changes");
        for (StagedChange change : changes) {
            ObjectNode node = array.addObject();
            node.put("path", change.getPath());
            node.put("change_type", change.getChangeType().wireName());
            if (change.getOriginalContent() == null) {
                node.putNull("original_content");
            } else {
                node.put("original_content", change.getOriginalContent());
            }
            node.put("new_content", change.getNewContent());
        }
        if (applyResult != null) {
            ArrayNode applied = data.putArray("applied");
            applyResult.getApplied().forEach(applied::add);
            ArrayNode failed = data.putArray("failed");
            for (ApplyResult.Failure failure : applyResult.getFailed()) {
                failed.addObject().put("path", failure.getPath()).put("reason", failure.getReason());
            }
        }
        return new AgentEvent(EventType.COMPLETE, data);
    }

    public static AgentEvent error(ErrorCode code, String message) {
        ObjectNode data = NODES.objectNode();
        data.put("message", message == null ? "" : message);
        data.put("code", code.code());
        return new AgentEvent(EventType.ERROR, data);
    }

    @Override
    public String toString() {
        return type.wireName() + data;
    }
}
