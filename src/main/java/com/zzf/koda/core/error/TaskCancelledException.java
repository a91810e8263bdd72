package com.zzf.koda.core.error;

public class TaskCancelledException extends AgentException {

    public TaskCancelledException() {
        super(ErrorCode.CANCELLED, "Task was cancelled");
    }
}
