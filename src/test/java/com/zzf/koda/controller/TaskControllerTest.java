package com.zzf.koda.controller;

import com.zzf.koda.core.agent.Phase;
import com.zzf.koda.core.agent.TaskSnapshot;
import com.zzf.koda.core.change.ApplyResult;
import com.zzf.koda.core.error.TaskNotFoundException;
import com.zzf.koda.session.TaskSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TaskControllerTest {

    private final TaskSessionService tasks = mock(TaskSessionService.class);
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new TaskController(tasks))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void shouldServeTaskSnapshot() throws Exception {
        when(tasks.snapshot("t1")).thenReturn(TaskSnapshot.builder()
                .id("t1").task("Fix").phase(Phase.AWAITING_APPROVAL).stagedChanges(2).build());

        mvc.perform(get("/api/tasks/t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("awaiting_approval"))
                .andExpect(jsonPath("$.staged_changes").value(2));
    }

    @Test
    void shouldReturnNotFoundForUnknownTask() throws Exception {
        when(tasks.snapshot("nope")).thenThrow(new TaskNotFoundException("nope"));

        mvc.perform(get("/api/tasks/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TaskNotFound"));
    }

    @Test
    void shouldApplyApprovedChanges() throws Exception {
        when(tasks.decide("t1", true)).thenReturn(new ApplyResult(List.of("a.txt"),
                List.of(new ApplyResult.Failure("b.txt", "read-only"))));
        when(tasks.snapshot("t1")).thenReturn(TaskSnapshot.builder().id("t1").phase(Phase.COMPLETE).build());

        mvc.perform(post("/api/tasks/t1/approval").contentType(MediaType.APPLICATION_JSON).content("{\"approved\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("complete"))
                .andExpect(jsonPath("$.applied[0]").value("a.txt"))
                .andExpect(jsonPath("$.failed[0].path").value("b.txt"));
    }

    @Test
    void shouldRejectDecisionOutsideAwaitingApproval() throws Exception {
        when(tasks.decide("t1", false)).thenThrow(new IllegalStateException("Cannot reject task t1 in phase executing"));

        mvc.perform(post("/api/tasks/t1/approval").contentType(MediaType.APPLICATION_JSON).content("{\"approved\":false}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("InvalidState"));
    }

    @Test
    void shouldRequireApprovedField() throws Exception {
        mvc.perform(post("/api/tasks/t1/approval").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("InvalidRequest"));
        verify(tasks, never()).decide(anyString(), anyBoolean());
    }

    @Test
    void shouldCancelTask() throws Exception {
        when(tasks.cancel("t1")).thenReturn(Phase.EXECUTING);

        mvc.perform(post("/api/tasks/t1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("executing"));
    }
}
