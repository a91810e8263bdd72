package com.zzf.koda.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.koda.core.error.PlanParseException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the planning model's answer into plan steps. Accepts a JSON array of strings or
 * {@code {description, tool}} objects, optionally inside a Markdown code fence, or a numbered or
 * bulleted list. Anything else, including an empty list, is a parse failure.
 */
@Component
public class PlanParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*\\n?(.*?)```", Pattern.DOTALL);
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:\\d+[.)]|[-*•])\\s+(.+)$");
    private static final Pattern TOOL_HINT = Pattern.compile("\\s*[(\\[]\\s*tool\\s*:\\s*([A-Za-z_][\\w]*)\\s*[)\\]]\\s*$",
            Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public PlanParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<PlanStep> parse(String text) {
        if (text == null || text.isBlank()) {
            throw new PlanParseException("Plan is empty");
        }
        String body = text.trim();
        Matcher fence = CODE_FENCE.matcher(body);
        if (fence.find()) {
            body = fence.group(1).trim();
        }
        if (body.startsWith("[")) {
            return fromJson(body);
        }
        int arrayStart = body.indexOf('[');
        int arrayEnd = body.lastIndexOf(']');
        if (arrayStart >= 0 && arrayEnd > arrayStart && looksLikeJsonArray(body.substring(arrayStart, arrayEnd + 1))) {
            return fromJson(body.substring(arrayStart, arrayEnd + 1));
        }
        return fromList(body);
    }

    private boolean looksLikeJsonArray(String candidate) {
        try {
            return objectMapper.readTree(candidate).isArray();
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private List<PlanStep> fromJson(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PlanParseException("Plan is not valid JSON: " + e.getOriginalMessage());
        }
        if (!root.isArray()) {
            throw new PlanParseException("Plan JSON must be an array");
        }
        List<PlanStep> steps = new ArrayList<>();
        int index = 0;
        for (JsonNode item : root) {
            index++;
            if (item.isTextual()) {
                steps.add(step(item.asText(), null, index));
            } else if (item.isObject()) {
                JsonNode description = item.hasNonNull("description") ? item.get("description") : item.get("step");
                if (description == null || !description.isTextual()) {
                    throw new PlanParseException("Plan step " + index + " has no description");
                }
                JsonNode tool = item.get("tool");
                steps.add(step(description.asText(), tool != null && tool.isTextual() ? tool.asText() : null, index));
            } else {
                throw new PlanParseException("Plan step " + index + " must be a string or an object");
            }
        }
        if (steps.isEmpty()) {
            throw new PlanParseException("Plan has no steps");
        }
        return steps;
    }

    private List<PlanStep> fromList(String body) {
        List<PlanStep> steps = new ArrayList<>();
        for (String line : body.split("\\r?\\n")) {
            Matcher item = LIST_ITEM.matcher(line);
            if (!item.matches()) {
                continue;
            }
            String description = item.group(1).trim();
            String tool = null;
            Matcher hint = TOOL_HINT.matcher(description);
            if (hint.find()) {
                tool = hint.group(1);
                description = description.substring(0, hint.start()).trim();
            }
            steps.add(step(description, tool, steps.size() + 1));
        }
        if (steps.isEmpty()) {
            throw new PlanParseException("Plan is neither a JSON array nor a numbered or bulleted list");
        }
        return steps;
    }

    private static PlanStep step(String description, String tool, int index) {
        if (description == null || description.isBlank()) {
            throw new PlanParseException("Plan step " + index + " has an empty description");
        }
        return new PlanStep(description, tool);
    }
}
