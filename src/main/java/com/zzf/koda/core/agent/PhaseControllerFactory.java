package com.zzf.koda.core.agent;

import com.zzf.koda.config.AgentConfig;
import com.zzf.koda.core.repo.RepositoryCloner;
import com.zzf.koda.core.repo.SummaryCache;
import com.zzf.koda.core.tool.ToolRegistry;
import com.zzf.koda.llm.LlmGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Wires a fresh {@link PhaseController} per task around the shared, stateless collaborators.
 */
@Component
@RequiredArgsConstructor
public class PhaseControllerFactory {

    private final LlmGateway gateway;
    private final ToolUseLoop loop;
    private final ToolRegistry registry;
    private final PlanParser planParser;
    private final PromptLibrary prompts;
    private final RepositoryCloner cloner;
    private final SummaryCache summaryCache;
    private final AgentConfig config;

    public PhaseController create(TaskContext ctx) {
        return new PhaseController(ctx, gateway, loop, registry, planParser, prompts, cloner, summaryCache, config);
    }
}
