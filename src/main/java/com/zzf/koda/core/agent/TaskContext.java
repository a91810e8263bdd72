package com.zzf.koda.core.agent;

import com.zzf.koda.core.change.ChangeManager;
import com.zzf.koda.core.error.ErrorCode;
import com.zzf.koda.core.error.TaskCancelledException;
import com.zzf.koda.core.event.AgentEvent;
import com.zzf.koda.core.event.EventSink;
import com.zzf.koda.core.repo.RepositoryAccess;
import com.zzf.koda.core.tool.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything one task owns: its phase, repository, staging area, plan, tool-call history and the
 * sink its events go to. Phase changes go through {@link #transition} only.
 */
@Slf4j
public class TaskContext {

    private final Task task;
    private final EventSink events;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<ToolCall> toolCalls = new CopyOnWriteArrayList<>();

    private volatile Phase phase = Phase.IDLE;
    private volatile long phaseChangedAt = System.currentTimeMillis();
    private volatile RepositoryAccess repository;
    private volatile ChangeManager changeManager;
    private volatile String summary;
    private volatile List<PlanStep> plan = List.of();
    private volatile ErrorCode errorCode;
    private volatile String errorMessage;

    public TaskContext(Task task, EventSink events) {
        this.task = task;
        this.events = events;
    }

    public Task getTask() {
        return task;
    }

    public String getTaskId() {
        return task.getId();
    }

    public Phase getPhase() {
        return phase;
    }

    /**
     * Epoch millis of the last phase change, or of creation while still idle.
     */
    public long getPhaseChangedAt() {
        return phaseChangedAt;
    }

    /**
     * Moves to the next phase and emits its {@code phase} event.
     *
     * @throws IllegalStateException for a transition the state machine does not allow
     */
    public synchronized void transition(Phase next) {
        Phase current = phase;
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal phase transition " + current.wireName() + " -> " + next.wireName());
        }
        phase = next;
        phaseChangedAt = System.currentTimeMillis();
        log.info("task.phase taskId={} from={} to={}", task.getId(), current.wireName(), next.wireName());
        events.emit(AgentEvent.phase(next));
    }

    public void emit(AgentEvent event) {
        events.emit(event);
    }

    public void attachRepository(RepositoryAccess repository) {
        if (this.repository != null) {
            throw new IllegalStateException("repository already attached");
        }
        this.repository = repository;
        this.changeManager = new ChangeManager(task.getId(), repository);
    }

    public RepositoryAccess getRepository() {
        return repository;
    }

    /**
     * @return the staging area, or null before the repository is known
     */
    public ChangeManager getChangeManager() {
        return changeManager;
    }

    public boolean hasStagedChanges() {
        ChangeManager cm = changeManager;
        return cm != null && !cm.isEmpty();
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public List<PlanStep> getPlan() {
        return plan;
    }

    public void setPlan(List<PlanStep> plan) {
        this.plan = List.copyOf(plan);
    }

    /**
     * Sets every non-terminal plan step to the given status.
     */
    public void markOpenSteps(ExecutionStatus status) {
        for (PlanStep step : plan) {
            if (!step.getStatus().isTerminal()) {
                step.setStatus(status);
            }
        }
    }

    public void recordToolCall(ToolCall call) {
        toolCalls.add(call);
    }

    public List<ToolCall> getToolCalls() {
        return new ArrayList<>(toolCalls);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void recordError(ErrorCode code, String message) {
        this.errorCode = code;
        this.errorMessage = message;
    }

    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void checkCancelled() {
        if (cancelled.get()) {
            throw new TaskCancelledException();
        }
    }
}
