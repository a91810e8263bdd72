package com.zzf.koda.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmMessage {

    public enum Role {
        SYSTEM, USER, ASSISTANT, TOOL
    }

    private Role role;
    private String content;
    private List<LlmToolCall> toolCalls;
    private String toolCallId;

    public static LlmMessage system(String content) {
        return LlmMessage.builder().role(Role.SYSTEM).content(content).build();
    }

    public static LlmMessage user(String content) {
        return LlmMessage.builder().role(Role.USER).content(content).build();
    }

    public static LlmMessage assistant(String content, List<LlmToolCall> toolCalls) {
        return LlmMessage.builder()
                .role(Role.ASSISTANT)
                .content(content)
                .toolCalls(toolCalls == null || toolCalls.isEmpty() ? null : List.copyOf(toolCalls))
                .build();
    }

    public static LlmMessage toolResult(String toolCallId, String content) {
        return LlmMessage.builder().role(Role.TOOL).toolCallId(toolCallId).content(content).build();
    }
}
