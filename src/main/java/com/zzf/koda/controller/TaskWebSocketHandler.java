package com.zzf.koda.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.koda.core.error.ErrorCode;
import com.zzf.koda.core.error.InvalidRequestException;
import com.zzf.koda.core.event.AgentEvent;
import com.zzf.koda.core.event.EventCodec;
import com.zzf.koda.core.event.TaskRequest;
import com.zzf.koda.session.TaskSession;
import com.zzf.koda.session.TaskSessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Task channel: the first text message starts a task, whose events are then streamed back as
 * {@code {type, data}} envelopes. One task per channel.
 */
@Slf4j
@Component
public class TaskWebSocketHandler extends TextWebSocketHandler {

    static final String TASK_ATTRIBUTE = "koda.taskId";
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_BYTES = 512 * 1024;

    private final TaskSessionService tasks;
    private final EventCodec codec;
    private final Map<String, WebSocketSession> outbound = new ConcurrentHashMap<>();

    public TaskWebSocketHandler(TaskSessionService tasks, ObjectMapper objectMapper) {
        this.tasks = tasks;
        this.codec = new EventCodec(objectMapper);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        outbound.put(session.getId(), new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_BYTES));
        log.info("ws.open session={} remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSession out = outbound.getOrDefault(session.getId(), session);
        Object active = session.getAttributes().get(TASK_ATTRIBUTE);
        if (active != null) {
            log.warn("ws.reject session={} taskId={} reason=task_already_active", session.getId(), active);
            send(out, AgentEvent.error(ErrorCode.TASK_ALREADY_ACTIVE, "A task is already active on this channel"));
            return;
        }
        TaskRequest request;
        try {
            request = codec.decodeRequest(message.getPayload());
        } catch (InvalidRequestException e) {
            log.warn("ws.reject session={} reason=invalid_request err={}", session.getId(), e.getMessage());
            send(out, AgentEvent.error(ErrorCode.INVALID_REQUEST, e.getMessage()));
            return;
        }
        TaskSession task = tasks.start(request, session.getId(), event -> send(out, event));
        session.getAttributes().put(TASK_ATTRIBUTE, task.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("ws.transport.error session={} err={}", session.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        outbound.remove(session.getId());
        Object taskId = session.getAttributes().get(TASK_ATTRIBUTE);
        log.info("ws.close session={} taskId={} status={}", session.getId(), taskId, status.getCode());
        if (taskId != null) {
            tasks.detach(taskId.toString(), session.getId());
        }
    }

    private void send(WebSocketSession out, AgentEvent event) {
        if (!out.isOpen()) {
            log.debug("ws.send.skip session={} type={} reason=closed", out.getId(), event.getType().wireName());
            return;
        }
        try {
            out.sendMessage(new TextMessage(codec.encode(event)));
        } catch (IOException | IllegalStateException e) {
            log.warn("ws.send.fail session={} type={} err={}", out.getId(), event.getType().wireName(), e.toString());
        }
    }
}
