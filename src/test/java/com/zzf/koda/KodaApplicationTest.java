package com.zzf.koda;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.koda.client.ReconnectPolicy;
import com.zzf.koda.client.TaskStreamClient;
import com.zzf.koda.client.TaskStreamListener;
import com.zzf.koda.core.event.AgentEvent;
import com.zzf.koda.core.event.EventType;
import com.zzf.koda.core.event.TaskRequest;
import com.zzf.koda.llm.LlmGateway;
import com.zzf.koda.llm.LlmResponse;
import com.zzf.koda.llm.LlmToolCall;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@AutoConfigureObservability
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class KodaApplicationTest {

    private static final Path REPO_ROOT;
    private static final Path WORKSPACES;

    static {
        try {
            REPO_ROOT = Files.createTempDirectory("koda-repo");
            WORKSPACES = Files.createTempDirectory("koda-workspaces");
            Files.writeString(REPO_ROOT.resolve("README.md"), "demo", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void agentProperties(DynamicPropertyRegistry registry) {
        registry.add("koda.agent.repo-root", REPO_ROOT::toString);
        registry.add("koda.agent.workspace-dir", WORKSPACES::toString);
        registry.add("koda.agent.summary-cache-dir", () -> WORKSPACES.resolve("cache").toString());
    }

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private LlmGateway gateway;

    @Test
    void shouldExposeHealthEndpoints() {
        ResponseEntity<String> actuator = restTemplate.getForEntity(url("/actuator/health"), String.class);
        assertEquals(HttpStatus.OK, actuator.getStatusCode());
        assertTrue(actuator.getBody().contains("\"status\""));

        ResponseEntity<String> api = restTemplate.getForEntity(url("/api/health"), String.class);
        assertEquals(HttpStatus.OK, api.getStatusCode());
        assertTrue(api.getBody().contains("ok"));
    }

    @Test
    void shouldExposePrometheusMetrics() {
        ResponseEntity<String> resp = restTemplate.getForEntity(url("/actuator/prometheus"), String.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertTrue(resp.getBody().contains("# TYPE"));
    }

    @Test
    void shouldReturnNotFoundForUnknownTask() {
        ResponseEntity<String> resp = restTemplate.getForEntity(url("/api/tasks/missing"), String.class);
        assertEquals(HttpStatus.NOT_FOUND, resp.getStatusCode());
        assertTrue(resp.getBody().contains("TaskNotFound"));
    }

    @Test
    void shouldStageFileOverChannelAndApplyOnApproval() throws Exception {
        JsonNode writeArgs = objectMapper.readTree("{\"path\":\"hello.txt\",\"content\":\"hi\"}");
        when(gateway.request(any(), any(), any())).thenReturn(
                LlmResponse.text("A one-file demo repository."),
                LlmResponse.text("1. Create hello.txt (tool: write_file)"),
                LlmResponse.toolCalls("", List.of(new LlmToolCall("call_1", "write_file", writeArgs))),
                LlmResponse.text("Created hello.txt."));

        List<AgentEvent> events = new CopyOnWriteArrayList<>();
        CountDownLatch suspended = new CountDownLatch(1);
        TaskStreamListener listener = event -> {
            events.add(event);
            if (event.getType() == EventType.COMPLETE
                    && "awaiting_approval".equals(event.getData().path("phase").asText())) {
                suspended.countDown();
            }
        };

        try (TaskStreamClient client = new TaskStreamClient(URI.create(url("")), objectMapper,
                new ReconnectPolicy(2, 100, 500))) {
            client.start(new TaskRequest("Create hello.txt containing hi"), listener).get(10, TimeUnit.SECONDS);

            assertTrue(suspended.await(20, TimeUnit.SECONDS), "task never reached awaiting_approval: " + events);
            assertEquals(EventType.TASK, events.get(0).getType());
            assertFalse(Files.exists(REPO_ROOT.resolve("hello.txt")));

            ResponseEntity<String> changes = restTemplate.getForEntity(
                    url("/api/tasks/" + client.getTaskId() + "/changes"), String.class);
            assertEquals(HttpStatus.OK, changes.getStatusCode());
            assertTrue(changes.getBody().contains("hello.txt"));

            JsonNode decision = client.decide(true);

            assertEquals("complete", decision.path("phase").asText());
            assertEquals("hello.txt", decision.path("applied").get(0).asText());
            assertEquals("hi", Files.readString(REPO_ROOT.resolve("hello.txt")));
            assertEquals("complete", client.fetchSnapshot().getPhase().wireName());
        }
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }
}
