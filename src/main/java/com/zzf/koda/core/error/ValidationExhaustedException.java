package com.zzf.koda.core.error;

public class ValidationExhaustedException extends AgentException {

    private final String toolName;
    private final int attempts;

    public ValidationExhaustedException(String toolName, int attempts) {
        super(ErrorCode.VALIDATION_ERROR,
                "Arguments for tool '" + toolName + "' were still invalid after " + attempts + " correction attempts");
        this.toolName = toolName;
        this.attempts = attempts;
    }

    public String getToolName() {
        return toolName;
    }

    public int getAttempts() {
        return attempts;
    }
}
