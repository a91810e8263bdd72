package com.zzf.koda.config;

import com.zzf.koda.core.agent.Phase;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Connection and model-routing settings for the OpenAI-compatible gateway.
 * Understanding runs on the exploration model; planning and executing on their own models.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "koda.llm")
public class LlmConfig {
    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey = "";
    private String explorationModel = "gpt-4o-mini";
    private String planningModel = "gpt-4o";
    private String executionModel = "gpt-4o";
    private long connectTimeoutMs = 30_000L;
    private long requestTimeoutMs = 120_000L;
    private int maxTokens = 4096;
    private int maxRetries = 2;
    private long retryBackoffMs = 1_000L;

    public String modelFor(Phase phase) {
        if (phase == Phase.UNDERSTANDING) {
            return explorationModel;
        }
        if (phase == Phase.PLANNING) {
            return planningModel;
        }
        return executionModel;
    }
}
