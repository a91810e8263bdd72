package com.zzf.koda.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.zzf.koda.config.LlmConfig;
import com.zzf.koda.core.agent.Phase;
import com.zzf.koda.core.error.LlmGatewayException;
import com.zzf.koda.core.tool.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * {@link LlmGateway} over an OpenAI-compatible {@code /chat/completions} endpoint. Transient
 * failures (I/O, 429, 5xx) are retried a bounded number of times with doubling backoff.
 */
@Slf4j
@Service
public class OpenAiCompatibleGateway implements LlmGateway {

    private static final int MAX_TOOL_DESCRIPTION_LENGTH = 1024;
    private static final int MAX_ERROR_BODY_LENGTH = 1200;

    private final LlmConfig config;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public OpenAiCompatibleGateway(LlmConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .build();
    }

    @Override
    public LlmResponse request(List<LlmMessage> messages, List<ToolDefinition> tools, Phase phase) {
        String model = config.modelFor(phase);
        String body;
        try {
            body = objectMapper.writeValueAsString(buildRequestBody(model, messages, tools));
        } catch (JsonProcessingException e) {
            throw new LlmGatewayException("Could not encode model request", e);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(trimSlash(config.getBaseUrl()) + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.getApiKey())
                .timeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        int attempts = Math.max(0, config.getMaxRetries()) + 1;
        LlmGatewayException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            long startedAt = System.currentTimeMillis();
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                log.info("llm.request phase={} model={} status={} attempt={} durationMs={}",
                        phase.wireName(), model, status, attempt, System.currentTimeMillis() - startedAt);
                if (status == 200) {
                    return parseResponse(response.body());
                }
                last = new LlmGatewayException("Model endpoint returned " + status + ": " + truncate(response.body()));
                if (status != 429 && status < 500) {
                    throw last;
                }
            } catch (IOException e) {
                log.warn("llm.request.fail phase={} model={} attempt={} err={}", phase.wireName(), model, attempt, e.toString());
                last = new LlmGatewayException("Model endpoint unreachable: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LlmGatewayException("Model request interrupted", e);
            }
            if (attempt < attempts) {
                sleepBackoff(attempt);
            }
        }
        throw last;
    }

    ObjectNode buildRequestBody(String model, List<LlmMessage> messages, List<ToolDefinition> tools) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        root.put("max_tokens", config.getMaxTokens());
        ArrayNode wireMessages = root.putArray("messages");
        for (LlmMessage message : messages) {
            wireMessages.add(toWire(message));
        }
        if (tools != null && !tools.isEmpty()) {
            ArrayNode wireTools = root.putArray("tools");
            for (ToolDefinition tool : tools) {
                ObjectNode wire = wireTools.addObject();
                wire.put("type", "function");
                ObjectNode function = wire.putObject("function");
                function.put("name", tool.getName());
                String description = tool.getDescription();
                if (description.length() > MAX_TOOL_DESCRIPTION_LENGTH) {
                    description = description.substring(0, MAX_TOOL_DESCRIPTION_LENGTH);
                }
                function.put("description", description);
                function.set("parameters", tool.getSchema().toJson());
            }
            root.put("tool_choice", "auto");
        }
        return root;
    }

    LlmResponse parseResponse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LlmGatewayException("Model response is not JSON", e);
        }
        JsonNode choice = root.path("choices").path(0);
        JsonNode message = choice.path("message");
        if (!message.isObject()) {
            throw new LlmGatewayException("Model response has no message");
        }
        String text = message.path("content").isTextual() ? message.get("content").asText() : null;
        List<LlmToolCall> calls = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.path("function");
            String name = function.path("name").asText("");
            if (name.isEmpty()) {
                throw new LlmGatewayException("Model requested a tool call without a name");
            }
            String id = call.path("id").asText("");
            if (id.isEmpty()) {
                id = "call_" + UUID.randomUUID();
            }
            calls.add(new LlmToolCall(id, name, parseArguments(function.path("arguments"))));
        }
        StopReason stopReason = StopReason.fromFinishReason(choice.path("finish_reason").asText(null), !calls.isEmpty());
        return LlmResponse.builder().stopReason(stopReason).text(text).toolCalls(calls).build();
    }

    private JsonNode parseArguments(JsonNode raw) {
        if (raw.isObject()) {
            return raw;
        }
        String text = raw.asText("");
        if (text.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("llm.arguments.malformed raw={}", truncate(text));
            return TextNode.valueOf(text);
        }
    }

    private ObjectNode toWire(LlmMessage message) {
        ObjectNode wire = objectMapper.createObjectNode();
        wire.put("role", message.getRole().name().toLowerCase(Locale.ROOT));
        if (message.getRole() == LlmMessage.Role.TOOL) {
            wire.put("tool_call_id", message.getToolCallId());
        }
        if (message.getContent() != null) {
            wire.put("content", message.getContent());
        } else {
            wire.putNull("content");
        }
        if (message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
            ArrayNode calls = wire.putArray("tool_calls");
            for (LlmToolCall call : message.getToolCalls()) {
                ObjectNode wireCall = calls.addObject();
                wireCall.put("id", call.getId());
                wireCall.put("type", "function");
                ObjectNode function = wireCall.putObject("function");
                function.put("name", call.getName());
                JsonNode args = call.getArguments();
                function.put("arguments", args == null ? "{}" : args.isTextual() ? args.asText() : args.toString());
            }
        }
        return wire;
    }

    private void sleepBackoff(int attempt) {
        long delay = config.getRetryBackoffMs() * (1L << Math.min(attempt - 1, 10));
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmGatewayException("Model request interrupted", e);
        }
    }

    private static String trimSlash(String url) {
        String value = url == null ? "" : url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_ERROR_BODY_LENGTH ? text : text.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }
}
