package com.zzf.koda.session;

import com.zzf.koda.core.agent.PhaseController;
import com.zzf.koda.core.agent.TaskContext;
import com.zzf.koda.core.event.EventStream;

/**
 * A live task as the session service tracks it.
 */
public final class TaskSession {

    private final TaskContext context;
    private final PhaseController controller;
    private final EventStream events;

    TaskSession(TaskContext context, PhaseController controller, EventStream events) {
        this.context = context;
        this.controller = controller;
        this.events = events;
    }

    public String getId() {
        return context.getTaskId();
    }

    public TaskContext getContext() {
        return context;
    }

    public PhaseController getController() {
        return controller;
    }

    public EventStream getEvents() {
        return events;
    }

    public boolean isFinished() {
        return context.getPhase().isTerminal();
    }
}
