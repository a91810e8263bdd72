package com.zzf.koda.core.error;

public class TaskNotFoundException extends AgentException {

    public TaskNotFoundException(String taskId) {
        super(ErrorCode.TASK_NOT_FOUND, "Task not found: " + taskId);
    }
}
