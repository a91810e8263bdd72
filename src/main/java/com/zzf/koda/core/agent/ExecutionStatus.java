package com.zzf.koda.core.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle shared by tool calls and plan steps.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
