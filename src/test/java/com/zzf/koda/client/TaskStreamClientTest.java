package com.zzf.koda.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.koda.core.agent.Phase;
import com.zzf.koda.core.agent.TaskSnapshot;
import com.zzf.koda.core.change.ChangeType;
import com.zzf.koda.core.error.ErrorCode;
import com.zzf.koda.core.event.AgentEvent;
import com.zzf.koda.core.event.EventCodec;
import com.zzf.koda.core.event.TaskRequest;
import com.zzf.koda.session.ChangeSetView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskStreamClientTest {

    private static final URI BASE = URI.create("http://localhost:18080");
    private static final String SNAPSHOT = "{\"id\":\"task-1\",\"task\":\"Create hello.txt\",\"phase\":\"awaiting_approval\","
            + "\"staged_changes\":1}";
    private static final String CHANGES = "{\"changes\":[{\"path\":\"hello.txt\",\"change_type\":\"create\","
            + "\"original_content\":null,\"new_content\":\"hi\"}],\"diff\":\"+hi\",\"summary\":\"Staged: 1 file(s) to create\"}";

    private final ObjectMapper mapper = new ObjectMapper();
    private final EventCodec codec = new EventCodec(mapper);
    private final HttpClient httpClient = mock(HttpClient.class);
    private final WebSocket.Builder builder = mock(WebSocket.Builder.class, RETURNS_SELF);
    private final WebSocket socket = mock(WebSocket.class);
    private final TaskStreamListener listener = mock(TaskStreamListener.class);
    private final AtomicReference<WebSocket.Listener> channel = new AtomicReference<>();
    private final List<String> requestedPaths = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        when(httpClient.newWebSocketBuilder()).thenReturn(builder);
        when(builder.buildAsync(any(), any())).thenAnswer(inv -> {
            channel.set(inv.getArgument(1));
            return CompletableFuture.completedFuture(socket);
        });
        when(socket.sendText(any(), anyBoolean())).thenReturn(CompletableFuture.completedFuture(socket));
    }

    @Test
    void shouldDeriveStreamUriFromBaseUri() {
        assertEquals(URI.create("ws://localhost:18080/api/ws/task"),
                TaskStreamClient.streamUri(URI.create("http://localhost:18080")));
        assertEquals(URI.create("wss://agent.example.com/koda/api/ws/task"),
                TaskStreamClient.streamUri(URI.create("https://agent.example.com/koda/")));
    }

    @Test
    void shouldRequireTaskIdBeforeRestCalls() {
        try (TaskStreamClient client = new TaskStreamClient(BASE, mapper, ReconnectPolicy.defaults())) {
            assertNull(client.getTaskId());
            assertThrows(IllegalStateException.class, client::fetchSnapshot);
            assertThrows(IllegalStateException.class, client::fetchChanges);
            assertThrows(IllegalStateException.class, () -> client.decide(true));
        }
    }

    @Test
    void shouldRequeryPhaseAndChangesAfterDropInsteadOfReopening() throws Exception {
        answerRest(200);
        try (TaskStreamClient client = new TaskStreamClient(BASE, mapper, new ReconnectPolicy(3, 10, 50), httpClient)) {
            client.start(new TaskRequest("Create hello.txt"), listener).get();
            receive(AgentEvent.task("task-1"));
            receive(AgentEvent.phase(Phase.EXECUTING));

            channel.get().onClose(socket, 1006, "");

            ArgumentCaptor<ChangeSetView> changes = ArgumentCaptor.forClass(ChangeSetView.class);
            verify(listener, timeout(2000)).onChanges(changes.capture());
            ArgumentCaptor<TaskSnapshot> snapshot = ArgumentCaptor.forClass(TaskSnapshot.class);
            verify(listener).onSnapshot(snapshot.capture());
            verify(listener).onReconnecting(1, 10);
            assertEquals(Phase.AWAITING_APPROVAL, snapshot.getValue().getPhase());
            assertEquals(1, snapshot.getValue().getStagedChanges());
            assertEquals("hello.txt", changes.getValue().getChanges().get(0).getPath());
            assertEquals(ChangeType.CREATE, changes.getValue().getChanges().get(0).getChangeType());
            assertNull(changes.getValue().getChanges().get(0).getOriginalContent());
            assertEquals(List.of("/api/tasks/task-1", "/api/tasks/task-1/changes"), requestedPaths);
            verify(builder, times(1)).buildAsync(any(), any());
            verify(listener, times(2)).onEvent(any());
        }
    }

    @Test
    void shouldReportTransportErrorWhenRequeryKeepsFailing() throws Exception {
        answerRest(503);
        try (TaskStreamClient client = new TaskStreamClient(BASE, mapper, new ReconnectPolicy(2, 10, 50), httpClient)) {
            client.start(new TaskRequest("Create hello.txt"), listener).get();
            receive(AgentEvent.task("task-1"));

            channel.get().onError(socket, new IOException("connection reset"));

            verify(listener, timeout(2000)).onError(eq(ErrorCode.TRANSPORT_ERROR), anyString());
            verify(listener).onReconnecting(1, 10);
            verify(listener).onReconnecting(2, 20);
            verify(listener, never()).onSnapshot(any());
            assertEquals(2, requestedPaths.size());
        }
    }

    @Test
    void shouldReopenChannelAndResendRequestBeforeTaskIdArrives() throws Exception {
        try (TaskStreamClient client = new TaskStreamClient(BASE, mapper, new ReconnectPolicy(3, 10, 50), httpClient)) {
            client.start(new TaskRequest("Create hello.txt"), listener).get();

            channel.get().onClose(socket, 1006, "");

            verify(builder, timeout(2000).times(2)).buildAsync(eq(TaskStreamClient.streamUri(BASE)), any());
            verify(socket, timeout(2000).times(2)).sendText(eq(codec.encodeRequest(new TaskRequest("Create hello.txt"))), eq(true));
            verify(listener).onReconnecting(1, 10);
            assertTrue(requestedPaths.isEmpty());
        }
    }

    @Test
    void shouldNotReconnectAfterTerminalPhase() throws Exception {
        try (TaskStreamClient client = new TaskStreamClient(BASE, mapper, new ReconnectPolicy(3, 10, 50), httpClient)) {
            client.start(new TaskRequest("Explain the readme"), listener).get();
            receive(AgentEvent.task("task-1"));
            receive(AgentEvent.phase(Phase.COMPLETE));

            channel.get().onClose(socket, 1000, "done");

            verify(listener).onClosed();
            verify(listener, never()).onReconnecting(anyInt(), anyLong());
            verify(builder, times(1)).buildAsync(any(), any());
        }
    }

    private void receive(AgentEvent event) {
        channel.get().onText(socket, codec.encode(event), true);
    }

    @SuppressWarnings("unchecked")
    private void answerRest(int status) throws Exception {
        doAnswer(inv -> {
            HttpRequest request = inv.getArgument(0);
            String path = request.uri().getPath();
            requestedPaths.add(path);
            HttpResponse<String> response = mock(HttpResponse.class);
            when(response.statusCode()).thenReturn(status);
            when(response.body()).thenReturn(path.endsWith("/changes") ? CHANGES : SNAPSHOT);
            return response;
        }).when(httpClient).send(any(), any());
    }
}
