package com.zzf.koda.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.koda.config.AgentConfig;
import com.zzf.koda.core.agent.Phase;
import com.zzf.koda.core.tool.ToolSchema.FieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolRegistryTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private Tool reader;
    private Tool writer;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        reader = stubTool("read_file", ToolCapability.READ);
        writer = stubTool("write_file", ToolCapability.WRITE);
        AgentConfig config = new AgentConfig();
        config.setMaxObservationChars(50);
        registry = new ToolRegistry(List.of(reader, writer), config);
    }

    @Test
    void shouldExposeOnlyPhaseEligibleDefinitions() {
        assertEquals(List.of("read_file"), names(registry.definitionsFor(Phase.PLANNING)));
        assertEquals(List.of("read_file", "write_file"), names(registry.definitionsFor(Phase.EXECUTING)));
    }

    @Test
    void shouldDispatchValidCall() throws Exception {
        when(reader.execute(any(), any())).thenReturn(CompletableFuture.completedFuture(
                Tool.Result.builder().output("content").build()));

        ToolOutcome outcome = registry.dispatch("read_file", args("{\"path\":\"a.txt\"}"), context(Phase.UNDERSTANDING));

        assertEquals(ToolOutcome.Kind.EXECUTED, outcome.getKind());
        assertEquals("content", outcome.getOutput());
    }

    @Test
    void shouldNotInvokeToolWithInvalidArguments() throws Exception {
        ToolOutcome outcome = registry.dispatch("read_file", args("{\"file\":\"a.txt\"}"), context(Phase.UNDERSTANDING));

        assertEquals(ToolOutcome.Kind.INVALID_ARGUMENTS, outcome.getKind());
        assertTrue(outcome.getOutput().contains("missing required field 'path'"));
        assertTrue(outcome.getOutput().contains("unknown field 'file'"));
        verify(reader, never()).execute(any(), any());
    }

    @Test
    void shouldRejectToolOutsideItsPhases() throws Exception {
        ToolOutcome outcome = registry.dispatch("write_file", args("{\"path\":\"a.txt\"}"), context(Phase.PLANNING));

        assertEquals(ToolOutcome.Kind.REJECTED, outcome.getKind());
        assertTrue(outcome.getOutput().contains("not available in the planning phase"));
        assertTrue(outcome.getOutput().contains("read_file"));
        verify(writer, never()).execute(any(), any());
    }

    @Test
    void shouldRejectUnknownTool() throws Exception {
        ToolOutcome outcome = registry.dispatch("rm_rf", args("{}"), context(Phase.EXECUTING));

        assertEquals(ToolOutcome.Kind.REJECTED, outcome.getKind());
        assertTrue(outcome.getOutput().startsWith("Unknown tool 'rm_rf'"));
    }

    @Test
    void shouldTurnFailedFutureIntoToolError() throws Exception {
        when(reader.execute(any(), any())).thenReturn(
                CompletableFuture.failedFuture(new IllegalArgumentException("File not found: a.txt")));

        ToolOutcome outcome = registry.dispatch("read_file", args("{\"path\":\"a.txt\"}"), context(Phase.EXECUTING));

        assertEquals(ToolOutcome.Kind.TOOL_ERROR, outcome.getKind());
        assertEquals("File not found: a.txt", outcome.getOutput());
    }

    @Test
    void shouldMaskAndTruncateObservations() throws Exception {
        when(reader.execute(any(), any())).thenReturn(CompletableFuture.completedFuture(
                Tool.Result.builder().output("password=hunter2 " + "x".repeat(200)).build()));

        ToolOutcome outcome = registry.dispatch("read_file", args("{\"path\":\"a.txt\"}"), context(Phase.EXECUTING));

        assertFalse(outcome.getOutput().contains("hunter2"));
        assertTrue(outcome.getOutput().contains("(truncated"));
    }

    @Test
    void shouldRefuseDuplicateToolIds() {
        Tool duplicate = stubTool("read_file", ToolCapability.READ);

        assertThrows(IllegalStateException.class, () -> new ToolRegistry(List.of(reader, duplicate), new AgentConfig()));
    }

    private Tool stubTool(String id, ToolCapability capability) {
        ToolSchema schema = ToolSchema.builder().required("path", FieldType.STRING, "path").build();
        ToolDefinition definition = new ToolDefinition(id, id, schema, capability, capability.defaultPhases());
        Tool tool = mock(Tool.class);
        when(tool.getId()).thenReturn(id);
        when(tool.getCapability()).thenReturn(capability);
        when(tool.getPhases()).thenReturn(EnumSet.copyOf(capability.defaultPhases()));
        when(tool.getSchema()).thenReturn(schema);
        when(tool.definition()).thenReturn(definition);
        return tool;
    }

    private JsonNode args(String json) throws Exception {
        return mapper.readTree(json);
    }

    private static Tool.Context context(Phase phase) {
        return Tool.Context.builder().taskID("t1").callID("c1").phase(phase).build();
    }

    private static List<String> names(List<ToolDefinition> definitions) {
        return definitions.stream().map(ToolDefinition::getName).toList();
    }
}
