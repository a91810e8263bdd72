package com.zzf.koda.core.error;

public class LoopBudgetExceededException extends AgentException {

    public LoopBudgetExceededException(String message) {
        super(ErrorCode.LOOP_BUDGET_EXCEEDED, message);
    }
}
