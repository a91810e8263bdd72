package com.zzf.koda.llm;

import com.zzf.koda.core.agent.Phase;
import com.zzf.koda.core.tool.ToolDefinition;

import java.util.List;

/**
 * Boundary to the language model: message and tool context in, final text or tool calls out.
 * Implementations are shared across tasks and hold no per-task state.
 */
public interface LlmGateway {

    /**
     * @param tools tools offered for this turn; empty for a plain generation
     * @throws com.zzf.koda.core.error.LlmGatewayException when the model cannot be reached or answers malformed
     */
    LlmResponse request(List<LlmMessage> messages, List<ToolDefinition> tools, Phase phase);
}
