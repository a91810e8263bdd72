package com.zzf.koda.session;

import com.zzf.koda.config.AgentConfig;
import com.zzf.koda.core.agent.Phase;
import com.zzf.koda.core.agent.PhaseController;
import com.zzf.koda.core.agent.PhaseControllerFactory;
import com.zzf.koda.core.agent.TaskContext;
import com.zzf.koda.core.change.ApplyResult;
import com.zzf.koda.core.error.TaskNotFoundException;
import com.zzf.koda.core.event.AgentEvent;
import com.zzf.koda.core.event.EventType;
import com.zzf.koda.core.event.TaskRequest;
import com.zzf.koda.core.repo.LocalRepositoryAccess;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskSessionServiceTest {

    private final PhaseControllerFactory factory = mock(PhaseControllerFactory.class);
    private final PhaseController controller = mock(PhaseController.class);
    private final AgentConfig config = new AgentConfig();
    private TaskSessionService service;

    @BeforeEach
    void setUp() {
        when(factory.create(any(TaskContext.class))).thenReturn(controller);
        service = new TaskSessionService(factory, config);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void shouldSendTaskEventFirst() {
        List<AgentEvent> received = new CopyOnWriteArrayList<>();

        TaskSession session = service.start(new TaskRequest("Fix the bug"), "ws-1", received::add);

        assertTrue(session.getEvents().flush(2000));
        assertEquals(EventType.TASK, received.get(0).getType());
        assertEquals(session.getId(), received.get(0).getData().get("task_id").asText());
        assertEquals(Phase.IDLE, service.snapshot(session.getId()).getPhase());
        assertEquals("Fix the bug", service.snapshot(session.getId()).getTask());
    }

    @Test
    void shouldFailForUnknownTask() {
        assertThrows(TaskNotFoundException.class, () -> service.snapshot("nope"));
        assertThrows(TaskNotFoundException.class, () -> service.decide("nope", true));
    }

    @Test
    void shouldRouteDecisionsToController() {
        TaskSession session = service.start(new TaskRequest("Fix the bug"), "ws-1", e -> { });
        when(controller.approve()).thenReturn(new ApplyResult(List.of("a.txt"), List.of()));
        when(controller.reject()).thenReturn(ApplyResult.empty());

        assertEquals(List.of("a.txt"), service.decide(session.getId(), true).getApplied());
        assertTrue(service.decide(session.getId(), false).isEmpty());
    }

    @Test
    void shouldCancelWorkingTaskWhenSubscriberLeaves() {
        TaskSession session = service.start(new TaskRequest("Fix the bug"), "ws-1", e -> { });
        session.getContext().transition(Phase.UNDERSTANDING);

        service.detach(session.getId(), "ws-1");

        verify(controller).cancel();
        assertEquals(0, session.getEvents().subscriberCount());
    }

    @Test
    void shouldKeepSuspendedTaskWhenSubscriberLeaves(@TempDir Path root) {
        TaskSession session = service.start(new TaskRequest("Fix the bug"), "ws-1", e -> { });
        TaskContext ctx = session.getContext();
        ctx.attachRepository(new LocalRepositoryAccess(root));
        ctx.transition(Phase.UNDERSTANDING);
        ctx.transition(Phase.PLANNING);
        ctx.transition(Phase.EXECUTING);
        ctx.getChangeManager().stageWrite("a.txt", "a");
        ctx.transition(Phase.AWAITING_APPROVAL);

        service.detach(session.getId(), "ws-1");

        verify(controller, never()).cancel();
        assertEquals(1, service.changes(session.getId()).getChanges().size());
        assertTrue(service.changes(session.getId()).getDiff().contains("+++ b/a.txt"));
    }

    @Test
    void shouldEvictFinishedTasksBeyondRetention() {
        config.setRetainedTasks(1);
        TaskSession first = service.start(new TaskRequest("one"), "ws-1", e -> { });
        first.getContext().transition(Phase.ERROR);

        service.start(new TaskRequest("two"), "ws-2", e -> { });

        assertEquals(1, service.size());
        assertThrows(TaskNotFoundException.class, () -> service.get(first.getId()));
    }

    @Test
    void shouldRejectAndDropTaskWaitingPastApprovalTtl(@TempDir Path root) throws Exception {
        config.setApprovalTtlMs(1);
        TaskSession session = service.start(new TaskRequest("Fix the bug"), "ws-1", e -> { });
        suspend(session, root);
        Thread.sleep(20);

        assertEquals(1, service.expireApprovals());

        verify(controller).reject();
        assertThrows(TaskNotFoundException.class, () -> service.get(session.getId()));
        assertEquals(0, session.getEvents().subscriberCount());
    }

    @Test
    void shouldExpireSuspendedTaskWhenNextTaskStarts(@TempDir Path root) throws Exception {
        config.setApprovalTtlMs(1);
        TaskSession first = service.start(new TaskRequest("one"), "ws-1", e -> { });
        suspend(first, root);
        Thread.sleep(20);

        service.start(new TaskRequest("two"), "ws-2", e -> { });

        assertEquals(1, service.size());
        assertThrows(TaskNotFoundException.class, () -> service.get(first.getId()));
    }

    @Test
    void shouldKeepSuspendedTaskWithinTtlAndWorkingTasks(@TempDir Path root) {
        TaskSession waiting = service.start(new TaskRequest("one"), "ws-1", e -> { });
        suspend(waiting, root);
        TaskSession working = service.start(new TaskRequest("two"), "ws-2", e -> { });
        working.getContext().transition(Phase.UNDERSTANDING);

        assertEquals(0, service.expireApprovals());

        config.setApprovalTtlMs(0);
        assertEquals(0, service.expireApprovals());
        verify(controller, never()).reject();
        assertEquals(2, service.size());
    }

    private static void suspend(TaskSession session, Path root) {
        TaskContext ctx = session.getContext();
        ctx.attachRepository(new LocalRepositoryAccess(root));
        ctx.transition(Phase.UNDERSTANDING);
        ctx.transition(Phase.PLANNING);
        ctx.transition(Phase.EXECUTING);
        ctx.getChangeManager().stageWrite("a.txt", "a");
        ctx.transition(Phase.AWAITING_APPROVAL);
    }
}
