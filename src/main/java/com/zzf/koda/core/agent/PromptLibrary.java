package com.zzf.koda.core.agent;

import lombok.RequiredArgsConstructor;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Phase prompts from {@code classpath:prompts/<name>.txt} with {@code {{key}}} placeholders.
 */
@Component
@RequiredArgsConstructor
public class PromptLibrary {

    public static final String UNDERSTANDING = "understanding";
    public static final String PLANNING = "planning";
    public static final String PLANNING_REQUEST = "planning_request";
    public static final String PLAN_CORRECTION = "plan_correction";
    public static final String EXECUTING = "executing";
    public static final String EXECUTING_REQUEST = "executing_request";

    private final ResourceLoader resourceLoader;
    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public String render(String name, Map<String, String> values) {
        String text = templates.computeIfAbsent(name, this::load);
        for (Map.Entry<String, String> entry : values.entrySet()) {
            text = text.replace("{{" + entry.getKey() + "}}", entry.getValue() == null ? "" : entry.getValue());
        }
        return text;
    }

    private String load(String name) {
        Resource resource = resourceLoader.getResource("classpath:prompts/" + name + ".txt");
        if (!resource.exists()) {
            throw new IllegalStateException("Missing prompt template: prompts/" + name + ".txt");
        }
        try {
            return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read prompt template " + name, e);
        }
    }
}
