package com.zzf.koda.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.koda.core.agent.ExecutionStatus;
import com.zzf.koda.core.agent.Phase;

/**
 * One model-requested tool invocation. Terminal once its result is recorded.
 */
public final class ToolCall {

    private final String id;
    private final String name;
    private final JsonNode args;
    private final Phase phase;
    private volatile ExecutionStatus status = ExecutionStatus.PENDING;
    private volatile String result;

    public ToolCall(String id, String name, JsonNode args, Phase phase) {
        this.id = id;
        this.name = name;
        this.args = args;
        this.phase = phase;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public JsonNode getArgs() {
        return args;
    }

    public Phase getPhase() {
        return phase;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public String getResult() {
        return result;
    }

    public void markRunning() {
        if (status.isTerminal()) {
            throw new IllegalStateException("tool call " + id + " already finished");
        }
        status = ExecutionStatus.RUNNING;
    }

    public void finish(String result, boolean error) {
        if (status.isTerminal()) {
            throw new IllegalStateException("tool call " + id + " already finished");
        }
        this.result = result;
        this.status = error ? ExecutionStatus.ERROR : ExecutionStatus.COMPLETE;
    }
}
