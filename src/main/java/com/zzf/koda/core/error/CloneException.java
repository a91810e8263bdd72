package com.zzf.koda.core.error;

public class CloneException extends AgentException {

    public CloneException(String message, Throwable cause) {
        super(ErrorCode.CLONE_ERROR, message, cause);
    }
}
