package com.zzf.koda.core.error;

public class InvalidRequestException extends AgentException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
