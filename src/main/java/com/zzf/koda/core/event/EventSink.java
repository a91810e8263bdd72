package com.zzf.koda.core.event;

@FunctionalInterface
public interface EventSink {

    void emit(AgentEvent event);
}
