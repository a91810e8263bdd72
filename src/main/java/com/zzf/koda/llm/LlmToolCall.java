package com.zzf.koda.llm;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tool invocation requested by the model. {@code arguments} holds the parsed JSON, or a text
 * node with the raw string when the model sent something that is not JSON.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LlmToolCall {
    private String id;
    private String name;
    private JsonNode arguments;
}
