package com.zzf.koda.core.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.koda.core.error.InvalidRequestException;

/**
 * JSON envelope codec for the task channel: server events as {@code {type, data}} and the
 * client's initiating {@link TaskRequest}.
 */
public final class EventCodec {

    private final ObjectMapper mapper;

    public EventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(AgentEvent event) {
        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("type", event.getType().wireName());
        envelope.set("data", event.getData());
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode event " + event.getType().wireName(), e);
        }
    }

    public AgentEvent decode(String text) {
        JsonNode root = readTree(text);
        if (!root.isObject() || !root.path("type").isTextual()) {
            throw new IllegalArgumentException("Event envelope must be an object with a string 'type'");
        }
        EventType type = EventType.fromWire(root.get("type").asText());
        JsonNode data = root.path("data");
        return new AgentEvent(type, data.isObject() ? (ObjectNode) data : mapper.createObjectNode());
    }

    public String encodeRequest(TaskRequest request) {
        try {
            return mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode task request", e);
        }
    }

    public TaskRequest decodeRequest(String text) {
        JsonNode root;
        try {
            root = readTree(text);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Initiating message is not valid JSON");
        }
        if (!root.isObject()) {
            throw new InvalidRequestException("Initiating message must be a JSON object");
        }
        JsonNode task = root.path("task");
        if (!task.isTextual() || task.asText().isBlank()) {
            throw new InvalidRequestException("No task provided");
        }
        TaskRequest request = new TaskRequest(task.asText().trim());
        request.setRepoUrl(optionalText(root, "repo_url"));
        request.setBranch(optionalText(root, "branch"));
        return request;
    }

    private JsonNode readTree(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("message is blank");
        }
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("message is not valid JSON", e);
        }
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.path(field);
        if (!node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText().trim();
    }
}
