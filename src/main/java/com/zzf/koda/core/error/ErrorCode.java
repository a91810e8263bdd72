package com.zzf.koda.core.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable machine-readable codes carried by {@code error} events and REST error bodies.
 */
public enum ErrorCode {
    VALIDATION_ERROR("ValidationError"),
    LOOP_BUDGET_EXCEEDED("LoopBudgetExceeded"),
    PLAN_PARSE_ERROR("PlanParseError"),
    TOOL_EXECUTION_ERROR("ToolExecutionError"),
    TRANSPORT_ERROR("TransportError"),
    PARTIAL_APPLY_ERROR("PartialApplyError"),
    CLONE_ERROR("CloneError"),
    LLM_GATEWAY_ERROR("LlmGatewayError"),
    CANCELLED("Cancelled"),
    TASK_ALREADY_ACTIVE("TaskAlreadyActive"),
    INVALID_REQUEST("InvalidRequest"),
    TASK_NOT_FOUND("TaskNotFound"),
    INVALID_STATE("InvalidState"),
    INTERNAL_ERROR("InternalError");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
