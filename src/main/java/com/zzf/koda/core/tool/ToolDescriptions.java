package com.zzf.koda.core.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads tool descriptions from {@code classpath:prompts/tool/<id>.txt}.
 */
@Slf4j
final class ToolDescriptions {

    private ToolDescriptions() {
    }

    static String load(ResourceLoader resourceLoader, String toolId, String fallback) {
        if (resourceLoader == null) {
            return fallback;
        }
        try {
            Resource resource = resourceLoader.getResource("classpath:prompts/tool/" + toolId + ".txt");
            if (resource.exists()) {
                return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8).trim();
            }
        } catch (IOException e) {
            log.error("Failed to load {} tool description", toolId, e);
        }
        return fallback;
    }
}
