package com.zzf.koda.core.error;

public class PlanParseException extends AgentException {

    public PlanParseException(String message) {
        super(ErrorCode.PLAN_PARSE_ERROR, message);
    }
}
