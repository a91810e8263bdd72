package com.zzf.koda.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.koda.core.agent.Phase;
import com.zzf.koda.core.agent.TaskSnapshot;
import com.zzf.koda.core.error.ErrorCode;
import com.zzf.koda.core.event.AgentEvent;
import com.zzf.koda.core.event.EventCodec;
import com.zzf.koda.core.event.EventType;
import com.zzf.koda.core.event.TaskRequest;
import com.zzf.koda.session.ChangeSetView;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client side of the task channel. Opens the WebSocket, sends the initiating request and decodes
 * events for a {@link TaskStreamListener}. When the channel drops unexpectedly it retries under a
 * {@link ReconnectPolicy}: before the server has assigned a task id it reopens the channel and
 * resends the request; afterwards it re-queries the task over REST (its phase, and its staged
 * changes when it is awaiting approval), since the server never replays events.
 */
@Slf4j
public class TaskStreamClient implements AutoCloseable {

    static final String STREAM_PATH = "/api/ws/task";

    private final URI baseUri;
    private final ObjectMapper objectMapper;
    private final EventCodec codec;
    private final ReconnectPolicy policy;
    private final HttpClient httpClient;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "koda-stream-client");
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile TaskRequest request;
    private volatile TaskStreamListener listener;
    private volatile WebSocket socket;
    private volatile String taskId;
    private volatile boolean finished;

    public TaskStreamClient(URI baseUri, ObjectMapper objectMapper, ReconnectPolicy policy) {
        this(baseUri, objectMapper, policy, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    TaskStreamClient(URI baseUri, ObjectMapper objectMapper, ReconnectPolicy policy, HttpClient httpClient) {
        this.baseUri = baseUri;
        this.objectMapper = objectMapper;
        this.codec = new EventCodec(objectMapper);
        this.policy = policy;
        this.httpClient = httpClient;
    }

    /**
     * Opens the channel and sends the initiating message.
     *
     * @return completes once the request has been sent
     */
    public CompletableFuture<Void> start(TaskRequest request, TaskStreamListener listener) {
        if (this.request != null) {
            throw new IllegalStateException("client already started");
        }
        this.request = request;
        this.listener = listener;
        return open();
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskSnapshot fetchSnapshot() throws IOException, InterruptedException {
        String id = requireTaskId();
        HttpResponse<String> response = httpClient.send(
                HttpRequest.newBuilder(restUri("/api/tasks/" + id)).timeout(Duration.ofSeconds(10)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("GET task " + id + " returned " + response.statusCode());
        }
        return objectMapper.readValue(response.body(), TaskSnapshot.class);
    }

    public ChangeSetView fetchChanges() throws IOException, InterruptedException {
        String id = requireTaskId();
        HttpResponse<String> response = httpClient.send(
                HttpRequest.newBuilder(restUri("/api/tasks/" + id + "/changes")).timeout(Duration.ofSeconds(10)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("GET changes of " + id + " returned " + response.statusCode());
        }
        return objectMapper.readValue(response.body(), ChangeSetView.class);
    }

    /**
     * Approves or rejects the staged changes of the task on this channel.
     *
     * @return the response body ({@code phase}, {@code applied}, {@code failed})
     */
    public JsonNode decide(boolean approved) throws IOException, InterruptedException {
        String id = requireTaskId();
        String body = objectMapper.createObjectNode().put("approved", approved).toString();
        HttpResponse<String> response = httpClient.send(
                HttpRequest.newBuilder(restUri("/api/tasks/" + id + "/approval"))
                        .timeout(Duration.ofSeconds(30))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        JsonNode json = objectMapper.readTree(response.body());
        if (response.statusCode() != 200) {
            throw new IOException("Approval rejected (" + response.statusCode() + "): " + json.path("message").asText());
        }
        return json;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        WebSocket ws = socket;
        if (ws != null) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "client closed");
        }
        scheduler.shutdownNow();
    }

    static URI streamUri(URI baseUri) {
        String scheme = "https".equalsIgnoreCase(baseUri.getScheme()) ? "wss" : "ws";
        String path = baseUri.getPath() == null ? "" : baseUri.getPath().replaceAll("/+$", "");
        return URI.create(scheme + "://" + baseUri.getAuthority() + path + STREAM_PATH);
    }

    private CompletableFuture<Void> open() {
        return httpClient.newWebSocketBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .buildAsync(streamUri(baseUri), new ChannelListener())
                .thenCompose(ws -> {
                    socket = ws;
                    return ws.sendText(codec.encodeRequest(request), true);
                })
                .thenAccept(ws -> log.info("client.open uri={}", streamUri(baseUri)));
    }

    private void onChannelLost(String reason) {
        if (closed.get() || finished) {
            listener.onClosed();
            return;
        }
        log.warn("client.channel.lost taskId={} reason={}", taskId, reason);
        schedule(1);
    }

    private void schedule(int attempt) {
        if (!policy.allows(attempt)) {
            listener.onError(ErrorCode.TRANSPORT_ERROR, "Connection lost and " + policy.getMaxAttempts()
                    + " reconnect attempts failed");
            return;
        }
        long delay = policy.delayForAttempt(attempt);
        listener.onReconnecting(attempt, delay);
        scheduler.schedule(() -> reconnect(attempt), delay, TimeUnit.MILLISECONDS);
    }

    private void reconnect(int attempt) {
        if (closed.get()) {
            return;
        }
        if (taskId == null) {
            open().whenComplete((ok, error) -> {
                if (error != null) {
                    log.warn("client.reconnect.fail attempt={} err={}", attempt, error.toString());
                    schedule(attempt + 1);
                }
            });
            return;
        }
        try {
            TaskSnapshot snapshot = fetchSnapshot();
            finished = snapshot.getPhase() != null && snapshot.getPhase().isTerminal();
            listener.onSnapshot(snapshot);
            if (snapshot.getPhase() == Phase.AWAITING_APPROVAL) {
                listener.onChanges(fetchChanges());
            }
        } catch (IOException e) {
            log.warn("client.requery.fail taskId={} attempt={} err={}", taskId, attempt, e.toString());
            schedule(attempt + 1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void handle(String text) {
        AgentEvent event;
        try {
            event = codec.decode(text);
        } catch (IllegalArgumentException e) {
            log.warn("client.decode.fail err={}", e.getMessage());
            return;
        }
        if (event.getType() == EventType.TASK) {
            taskId = event.getData().path("task_id").asText(null);
        } else if (event.getType() == EventType.PHASE) {
            try {
                finished = Phase.fromWire(event.getData().path("phase").asText()).isTerminal();
            } catch (IllegalArgumentException e) {
                log.warn("client.phase.unknown value={}", event.getData().path("phase").asText());
            }
        }
        listener.onEvent(event);
    }

    private String requireTaskId() {
        String id = taskId;
        if (id == null) {
            throw new IllegalStateException("task id not received yet");
        }
        return id;
    }

    private URI restUri(String path) {
        String base = baseUri.toString().replaceAll("/+$", "");
        return URI.create(base + path);
    }

    private final class ChannelListener implements WebSocket.Listener {

        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                handle(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            onChannelLost("closed " + statusCode + (reason == null || reason.isEmpty() ? "" : " " + reason));
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            onChannelLost(error.toString());
        }
    }
}
