package com.zzf.koda.core.error;

/**
 * Phase-level failure. The message is shown to the client, so it must not carry
 * internal state, stack traces or credentials.
 */
public class AgentException extends RuntimeException {

    private final ErrorCode code;

    public AgentException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AgentException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
