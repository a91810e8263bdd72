package com.zzf.koda.llm;

public enum StopReason {
    END_TURN,
    TOOL_USE,
    MAX_TOKENS;

    /**
     * Maps an OpenAI-style {@code finish_reason}.
     */
    public static StopReason fromFinishReason(String finishReason, boolean hasToolCalls) {
        if (hasToolCalls || "tool_calls".equals(finishReason) || "function_call".equals(finishReason)) {
            return TOOL_USE;
        }
        if ("length".equals(finishReason)) {
            return MAX_TOKENS;
        }
        return END_TURN;
    }
}
