package com.zzf.koda.core.error;

public class LlmGatewayException extends AgentException {

    public LlmGatewayException(String message) {
        super(ErrorCode.LLM_GATEWAY_ERROR, message);
    }

    public LlmGatewayException(String message, Throwable cause) {
        super(ErrorCode.LLM_GATEWAY_ERROR, message, cause);
    }
}
