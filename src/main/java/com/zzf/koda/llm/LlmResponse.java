package com.zzf.koda.llm;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class LlmResponse {
    private StopReason stopReason;
    private String text;
    private List<LlmToolCall> toolCalls;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static LlmResponse text(String text) {
        return LlmResponse.builder().stopReason(StopReason.END_TURN).text(text).toolCalls(List.of()).build();
    }

    public static LlmResponse toolCalls(String text, List<LlmToolCall> calls) {
        return LlmResponse.builder().stopReason(StopReason.TOOL_USE).text(text).toolCalls(List.copyOf(calls)).build();
    }
}
