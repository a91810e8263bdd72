package com.zzf.koda.core.agent;

import com.zzf.koda.config.AgentConfig;
import com.zzf.koda.core.change.ApplyResult;
import com.zzf.koda.core.change.ChangeManager;
import com.zzf.koda.core.change.StagedChange;
import com.zzf.koda.core.error.AgentException;
import com.zzf.koda.core.error.ErrorCode;
import com.zzf.koda.core.error.PlanParseException;
import com.zzf.koda.core.error.TaskCancelledException;
import com.zzf.koda.core.event.AgentEvent;
import com.zzf.koda.core.repo.LocalRepositoryAccess;
import com.zzf.koda.core.repo.RepositoryCloner;
import com.zzf.koda.core.repo.SummaryCache;
import com.zzf.koda.core.tool.ToolRegistry;
import com.zzf.koda.llm.LlmGateway;
import com.zzf.koda.llm.LlmMessage;
import com.zzf.koda.llm.LlmResponse;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State machine of one task. {@link #run} drives the task from idle until it completes, errors or
 * suspends awaiting approval; {@link #approve} and {@link #reject} resume a suspended task.
 * One instance per task, created by {@link PhaseControllerFactory}.
 */
@Slf4j
public class PhaseController {

    private final TaskContext ctx;
    private final LlmGateway gateway;
    private final ToolUseLoop loop;
    private final ToolRegistry registry;
    private final PlanParser planParser;
    private final PromptLibrary prompts;
    private final RepositoryCloner cloner;
    private final SummaryCache summaryCache;
    private final AgentConfig config;

    private final Object runnerLock = new Object();
    private Thread runner;

    PhaseController(TaskContext ctx, LlmGateway gateway, ToolUseLoop loop, ToolRegistry registry, PlanParser planParser,
                    PromptLibrary prompts, RepositoryCloner cloner, SummaryCache summaryCache, AgentConfig config) {
        this.ctx = ctx;
        this.gateway = gateway;
        this.loop = loop;
        this.registry = registry;
        this.planParser = planParser;
        this.prompts = prompts;
        this.cloner = cloner;
        this.summaryCache = summaryCache;
        this.config = config;
    }

    public TaskContext getContext() {
        return ctx;
    }

    public Phase getPhase() {
        return ctx.getPhase();
    }

    public void run() {
        synchronized (runnerLock) {
            if (ctx.getPhase() != Phase.IDLE || runner != null) {
                throw new IllegalStateException("Task " + ctx.getTaskId() + " already started");
            }
            runner = Thread.currentThread();
        }
        try {
            prepareRepository();
            understand();
            plan();
            execute();
        } catch (AgentException e) {
            onFailure(e.getCode(), e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("task.fail taskId={} phase={} unexpected", ctx.getTaskId(), ctx.getPhase().wireName(), e);
            onFailure(ErrorCode.INTERNAL_ERROR, "Internal error", e);
        } finally {
            synchronized (runnerLock) {
                runner = null;
                Thread.interrupted();
            }
        }
    }

    /**
     * Applies the staged change set and completes the task.
     *
     * @throws IllegalStateException when the task is not awaiting approval
     */
    public synchronized ApplyResult approve() {
        requireAwaitingApproval("approve");
        ChangeManager changes = ctx.getChangeManager();
        List<StagedChange> approved = changes.getChangeSet();
        ApplyResult result = changes.apply(approved);
        if (result.isPartial()) {
            log.warn("task.apply.partial taskId={} applied={} failed={}", ctx.getTaskId(),
                    result.getApplied().size(), result.getFailed().size());
            ctx.recordError(ErrorCode.PARTIAL_APPLY_ERROR, result.describe());
            ctx.emit(AgentEvent.error(ErrorCode.PARTIAL_APPLY_ERROR, result.describe()));
        }
        ctx.transition(Phase.COMPLETE);
        ctx.emit(AgentEvent.complete(Phase.COMPLETE, approved, result));
        log.info("task.approved taskId={} applied={} failed={}", ctx.getTaskId(), result.getApplied().size(),
                result.getFailed().size());
        return result;
    }

    /**
     * Discards the staged change set without touching the repository and completes the task.
     *
     * @throws IllegalStateException when the task is not awaiting approval
     */
    public synchronized ApplyResult reject() {
        requireAwaitingApproval("reject");
        int discarded = ctx.getChangeManager().discard();
        ctx.transition(Phase.COMPLETE);
        ApplyResult result = ApplyResult.empty();
        ctx.emit(AgentEvent.complete(Phase.COMPLETE, List.of(), result));
        log.info("task.rejected taskId={} discarded={}", ctx.getTaskId(), discarded);
        return result;
    }

    /**
     * Requests cancellation. Takes effect at the next tool-call or phase boundary; a running
     * external process is killed at once. No effect on a suspended or finished task.
     *
     * @return whether the request was accepted
     */
    public boolean cancel() {
        Phase phase = ctx.getPhase();
        if (phase.isTerminal() || phase == Phase.AWAITING_APPROVAL) {
            return false;
        }
        if (!ctx.cancel()) {
            return false;
        }
        log.info("task.cancel taskId={} phase={}", ctx.getTaskId(), phase.wireName());
        registry.cancel(ctx.getTaskId(), null);
        synchronized (runnerLock) {
            if (runner != null) {
                runner.interrupt();
            }
        }
        return true;
    }

    private void prepareRepository() {
        ctx.checkCancelled();
        Task task = ctx.getTask();
        Path root;
        if (task.hasRepository()) {
            ctx.transition(Phase.CLONING);
            root = cloner.cloneInto(task.getId(), task.getRepoUrl(), task.getBranch());
        } else {
            root = Paths.get(config.getRepoRoot()).toAbsolutePath().normalize();
        }
        ctx.attachRepository(new LocalRepositoryAccess(root));
        log.info("task.repository taskId={} root={}", task.getId(), root);
    }

    private void understand() {
        ctx.checkCancelled();
        ctx.transition(Phase.UNDERSTANDING);
        Task task = ctx.getTask();
        Path root = ctx.getRepository().root();
        Optional<String> cached = summaryCache.lookup(root, task.getRepoUrl(), task.getDescription());
        String summary;
        if (cached.isPresent()) {
            summary = cached.get();
            log.info("task.summary.cached taskId={} root={}", task.getId(), root);
        } else {
            List<LlmMessage> seed = List.of(
                    LlmMessage.system(prompts.render(PromptLibrary.UNDERSTANDING, Map.of())),
                    LlmMessage.user(task.getDescription()));
            LoopResult result = loop.run(ctx, Phase.UNDERSTANDING, seed);
            summary = result.getText().trim();
            summaryCache.store(root, task.getRepoUrl(), task.getDescription(), summary);
        }
        ctx.setSummary(summary);
        ctx.emit(AgentEvent.summary(summary));
    }

    private void plan() {
        ctx.checkCancelled();
        ctx.transition(Phase.PLANNING);
        List<LlmMessage> messages = new ArrayList<>();
        messages.add(LlmMessage.system(prompts.render(PromptLibrary.PLANNING, Map.of())));
        messages.add(LlmMessage.user(prompts.render(PromptLibrary.PLANNING_REQUEST, Map.of(
                "task", ctx.getTask().getDescription(),
                "summary", ctx.getSummary() == null ? "" : ctx.getSummary()))));
        LlmResponse first = gateway.request(messages, List.of(), Phase.PLANNING);
        List<PlanStep> steps;
        try {
            steps = planParser.parse(first.getText());
        } catch (PlanParseException e) {
            log.warn("task.plan.retry taskId={} err={}", ctx.getTaskId(), e.getMessage());
            ctx.checkCancelled();
            messages.add(LlmMessage.assistant(first.getText(), null));
            messages.add(LlmMessage.user(prompts.render(PromptLibrary.PLAN_CORRECTION, Map.of("error", e.getMessage()))));
            LlmResponse second = gateway.request(messages, List.of(), Phase.PLANNING);
            steps = planParser.parse(second.getText());
        }
        ctx.setPlan(steps);
        log.info("task.plan taskId={} steps={}", ctx.getTaskId(), steps.size());
        ctx.emit(AgentEvent.plan(steps));
    }

    private void execute() {
        ctx.checkCancelled();
        ctx.transition(Phase.EXECUTING);
        ctx.markOpenSteps(ExecutionStatus.RUNNING);
        ctx.emit(AgentEvent.plan(ctx.getPlan()));
        List<LlmMessage> seed = List.of(
                LlmMessage.system(prompts.render(PromptLibrary.EXECUTING, Map.of())),
                LlmMessage.user(prompts.render(PromptLibrary.EXECUTING_REQUEST, Map.of(
                        "task", ctx.getTask().getDescription(),
                        "summary", ctx.getSummary() == null ? "" : ctx.getSummary(),
                        "plan", renderPlan(ctx.getPlan())))));
        LoopResult result = loop.run(ctx, Phase.EXECUTING, seed);
        ctx.markOpenSteps(ExecutionStatus.COMPLETE);
        ctx.emit(AgentEvent.plan(ctx.getPlan()));
        log.info("task.executed taskId={} iterations={} toolCalls={} staged={}", ctx.getTaskId(),
                result.getIterations(), result.getToolCalls(), ctx.getChangeManager().size());
        finishExecuting();
    }

    private synchronized void finishExecuting() {
        ChangeManager changes = ctx.getChangeManager();
        if (changes.isEmpty()) {
            ctx.transition(Phase.COMPLETE);
            ctx.emit(AgentEvent.complete(Phase.COMPLETE, List.of(), null));
            return;
        }
        ctx.transition(Phase.AWAITING_APPROVAL);
        ctx.emit(AgentEvent.complete(Phase.AWAITING_APPROVAL, changes.getChangeSet(), null));
    }

    private void onFailure(ErrorCode code, String message, Exception cause) {
        Phase phase = ctx.getPhase();
        if (phase.isTerminal() || phase == Phase.AWAITING_APPROVAL) {
            log.warn("task.fail.ignored taskId={} phase={} code={}", ctx.getTaskId(), phase.wireName(), code.code());
            return;
        }
        if (ctx.isCancelled() || cause instanceof TaskCancelledException) {
            onCancelled(phase);
            return;
        }
        if (phase == Phase.EXECUTING) {
            ctx.markOpenSteps(ExecutionStatus.ERROR);
            ctx.emit(AgentEvent.plan(ctx.getPlan()));
        }
        fail(code, message);
    }

    private void onCancelled(Phase phase) {
        if (phase == Phase.EXECUTING) {
            ctx.markOpenSteps(ExecutionStatus.ERROR);
            ctx.emit(AgentEvent.plan(ctx.getPlan()));
            if (ctx.hasStagedChanges()) {
                log.info("task.cancelled taskId={} staged={} next=awaiting_approval", ctx.getTaskId(),
                        ctx.getChangeManager().size());
                finishExecuting();
                return;
            }
        }
        log.info("task.cancelled taskId={} phase={}", ctx.getTaskId(), phase.wireName());
        fail(ErrorCode.CANCELLED, "Task was cancelled");
    }

    private void fail(ErrorCode code, String message) {
        log.error("task.error taskId={} phase={} code={} message={}", ctx.getTaskId(), ctx.getPhase().wireName(),
                code.code(), message);
        ctx.recordError(code, message);
        ctx.transition(Phase.ERROR);
        ctx.emit(AgentEvent.error(code, message));
    }

    private void requireAwaitingApproval(String action) {
        if (ctx.getPhase() != Phase.AWAITING_APPROVAL) {
            throw new IllegalStateException("Cannot " + action + " task " + ctx.getTaskId() + " in phase "
                    + ctx.getPhase().wireName());
        }
    }

    static String renderPlan(List<PlanStep> steps) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < steps.size(); i++) {
            PlanStep step = steps.get(i);
            sb.append(i + 1).append(". ").append(step.getDescription());
            if (step.getTool() != null) {
                sb.append(" (tool: ").append(step.getTool()).append(')');
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }
}
