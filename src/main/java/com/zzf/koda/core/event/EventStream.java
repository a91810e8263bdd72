package com.zzf.koda.core.event;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Per-task event channel. Every subscriber receives events on one delivery thread, in emission
 * order. Nothing is stored for replay: a subscriber that attaches late only sees later events.
 */
@Slf4j
public final class EventStream implements EventSink {

    private final String taskId;
    private final Map<String, EventSink> subscribers = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public EventStream(String taskId) {
        this.taskId = taskId;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "koda-events-" + taskId);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void emit(AgentEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event is null");
        }
        try {
            executor.submit(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.debug("event.drop taskId={} type={} reason=closed", taskId, event.getType().wireName());
        }
    }

    public void subscribe(String subscriberId, EventSink subscriber) {
        if (subscriberId == null || subscriberId.trim().isEmpty()) {
            throw new IllegalArgumentException("subscriberId is blank");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber is null");
        }
        if (subscribers.putIfAbsent(subscriberId.trim(), subscriber) != null) {
            throw new IllegalStateException("subscriber already exists");
        }
    }

    public void unsubscribe(String subscriberId) {
        if (subscriberId == null || subscriberId.trim().isEmpty()) {
            return;
        }
        subscribers.remove(subscriberId.trim());
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Blocks until every event emitted before this call has been handed to the subscribers.
     */
    public boolean flush(long timeoutMs) {
        try {
            Future<?> marker = executor.submit(() -> { });
            marker.get(timeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException | TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.warn("event.flush.fail taskId={} err={}", taskId, e.toString());
            return false;
        }
    }

    public void close() {
        executor.shutdown();
        subscribers.clear();
    }

    private void deliver(AgentEvent event) {
        for (Map.Entry<String, EventSink> entry : subscribers.entrySet()) {
            try {
                entry.getValue().emit(event);
            } catch (RuntimeException e) {
                log.warn("event.deliver.fail taskId={} subscriber={} type={} err={}",
                        taskId, entry.getKey(), event.getType().wireName(), e.toString());
            }
        }
    }
}
