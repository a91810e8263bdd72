package com.zzf.koda.core.agent;

import com.zzf.koda.config.AgentConfig;
import com.zzf.koda.core.error.LoopBudgetExceededException;
import com.zzf.koda.core.error.ValidationExhaustedException;
import com.zzf.koda.core.event.AgentEvent;
import com.zzf.koda.core.tool.Tool;
import com.zzf.koda.core.tool.ToolCall;
import com.zzf.koda.core.tool.ToolDefinition;
import com.zzf.koda.core.tool.ToolOutcome;
import com.zzf.koda.core.tool.ToolOutputSanitizer;
import com.zzf.koda.core.tool.ToolRegistry;
import com.zzf.koda.llm.LlmGateway;
import com.zzf.koda.llm.LlmMessage;
import com.zzf.koda.llm.LlmResponse;
import com.zzf.koda.llm.LlmToolCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one phase's conversation: ask the model, run the tools it asks for in request order, feed
 * the results back, and stop when it answers without tool calls. Bounded by an iteration cap, a
 * wall-clock deadline and a per-tool budget of schema violations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolUseLoop {

    private final LlmGateway gateway;
    private final ToolRegistry registry;
    private final AgentConfig config;

    public LoopResult run(TaskContext ctx, Phase phase, List<LlmMessage> seed) {
        List<LlmMessage> messages = new ArrayList<>(seed);
        List<ToolDefinition> tools = registry.definitionsFor(phase);
        Map<String, Integer> violations = new HashMap<>();
        long deadline = System.currentTimeMillis() + config.getPhaseTimeoutMs();
        int maxIterations = config.getMaxIterations();
        int calls = 0;

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            ctx.checkCancelled();
            checkDeadline(deadline, phase);
            LlmResponse response = gateway.request(messages, tools, phase);
            ctx.checkCancelled();
            checkDeadline(deadline, phase);

            if (!response.hasToolCalls()) {
                log.info("loop.end taskId={} phase={} iterations={} toolCalls={} stop={}",
                        ctx.getTaskId(), phase.wireName(), iteration, calls, response.getStopReason());
                return new LoopResult(response.getText(), iteration, calls);
            }

            messages.add(LlmMessage.assistant(response.getText(), response.getToolCalls()));
            for (LlmToolCall requested : response.getToolCalls()) {
                ctx.checkCancelled();
                checkDeadline(deadline, phase);
                ToolOutcome outcome = execute(ctx, phase, requested);
                calls++;
                messages.add(LlmMessage.toolResult(requested.getId(), outcome.getOutput()));
                if (outcome.getKind() == ToolOutcome.Kind.INVALID_ARGUMENTS) {
                    int count = violations.merge(requested.getName(), 1, Integer::sum);
                    if (count > config.getMaxValidationAttempts()) {
                        throw new ValidationExhaustedException(requested.getName(), count);
                    }
                }
            }
        }
        throw new LoopBudgetExceededException("Iteration cap of " + maxIterations + " reached in the "
                + phase.wireName() + " phase");
    }

    private ToolOutcome execute(TaskContext ctx, Phase phase, LlmToolCall requested) {
        ToolCall call = new ToolCall(requested.getId(), requested.getName(), requested.getArguments(), phase);
        ctx.recordToolCall(call);
        ctx.emit(AgentEvent.toolCall(call.getId(), call.getName(), call.getArgs()));
        log.info("tool.call taskId={} tool={} id={}", ctx.getTaskId(), call.getName(), call.getId());
        call.markRunning();

        long startedAt = System.currentTimeMillis();
        Tool.Context toolCtx = Tool.Context.builder()
                .taskID(ctx.getTaskId())
                .callID(call.getId())
                .phase(phase)
                .repository(ctx.getRepository())
                .changeManager(ctx.getChangeManager())
                .build();
        ToolOutcome outcome = registry.dispatch(call.getName(), call.getArgs(), toolCtx);
        call.finish(outcome.getOutput(), outcome.isError());

        log.info("tool.result taskId={} tool={} id={} status={} kind={} durationMs={}", ctx.getTaskId(), call.getName(),
                call.getId(), call.getStatus().wireName(), outcome.getKind(), System.currentTimeMillis() - startedAt);
        ctx.emit(AgentEvent.toolResult(call.getId(), call.getName(),
                ToolOutputSanitizer.truncate(outcome.getOutput(), config.getMaxEventResultChars()), outcome.isError()));
        return outcome;
    }

    private static void checkDeadline(long deadline, Phase phase) {
        if (System.currentTimeMillis() > deadline) {
            throw new LoopBudgetExceededException("Wall-clock budget exhausted in the " + phase.wireName() + " phase");
        }
    }
}
