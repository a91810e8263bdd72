package com.zzf.koda.session;

import com.zzf.koda.config.AgentConfig;
import com.zzf.koda.core.agent.Phase;
import com.zzf.koda.core.agent.PhaseController;
import com.zzf.koda.core.agent.PhaseControllerFactory;
import com.zzf.koda.core.agent.Task;
import com.zzf.koda.core.agent.TaskContext;
import com.zzf.koda.core.agent.TaskSnapshot;
import com.zzf.koda.core.change.ApplyResult;
import com.zzf.koda.core.change.ChangeManager;
import com.zzf.koda.core.change.DiffRenderer;
import com.zzf.koda.core.change.StagedChange;
import com.zzf.koda.core.error.TaskNotFoundException;
import com.zzf.koda.core.event.AgentEvent;
import com.zzf.koda.core.event.EventSink;
import com.zzf.koda.core.event.EventStream;
import com.zzf.koda.core.event.TaskRequest;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory registry of tasks. Each task runs its phases on its own worker thread; finished
 * tasks are kept for state queries until the retention cap evicts the oldest of them. A task
 * left awaiting approval longer than {@code koda.agent.approval-ttl-ms} is rejected and dropped.
 */
@Slf4j
@Service
public class TaskSessionService {

    private final PhaseControllerFactory controllers;
    private final AgentConfig config;
    private final Map<String, TaskSession> sessions = new LinkedHashMap<>();
    private final AtomicInteger workerIds = new AtomicInteger();
    private final ExecutorService workers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "koda-task-" + workerIds.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public TaskSessionService(PhaseControllerFactory controllers, AgentConfig config) {
        this.controllers = controllers;
        this.config = config;
    }

    /**
     * Creates a task, attaches the subscriber and starts it. The subscriber sees the {@code task}
     * event before anything else.
     */
    public TaskSession start(TaskRequest request, String subscriberId, EventSink subscriber) {
        String id = UUID.randomUUID().toString();
        Task task = new Task(id, request.getTask(), request.getRepoUrl(), request.getBranch());
        EventStream events = new EventStream(id);
        if (subscriber != null) {
            events.subscribe(subscriberId, subscriber);
        }
        events.emit(AgentEvent.task(id));

        TaskContext context = new TaskContext(task, events);
        PhaseController controller = controllers.create(context);
        TaskSession session = new TaskSession(context, controller, events);
        expireApprovals();
        synchronized (sessions) {
            sessions.put(id, session);
            evictFinished();
        }
        log.info("task.start taskId={} repo={} branch={}", id, task.getRepoUrl(), task.getBranch());
        workers.execute(controller::run);
        return session;
    }

    public TaskSession get(String taskId) {
        TaskSession session;
        synchronized (sessions) {
            session = taskId == null ? null : sessions.get(taskId);
        }
        if (session == null) {
            throw new TaskNotFoundException(taskId);
        }
        return session;
    }

    public TaskSnapshot snapshot(String taskId) {
        return TaskSnapshot.of(get(taskId).getContext());
    }

    public ChangeSetView changes(String taskId) {
        ChangeManager changes = get(taskId).getContext().getChangeManager();
        if (changes == null) {
            return new ChangeSetView(List.of(), "", "No staged changes.");
        }
        List<StagedChange> changeSet = changes.getChangeSet();
        return new ChangeSetView(changeSet, DiffRenderer.render(changeSet), changes.summary());
    }

    /**
     * @throws IllegalStateException when the task is not awaiting approval
     */
    public ApplyResult decide(String taskId, boolean approved) {
        PhaseController controller = get(taskId).getController();
        log.info("task.decision taskId={} approved={}", taskId, approved);
        return approved ? controller.approve() : controller.reject();
    }

    public Phase cancel(String taskId) {
        TaskSession session = get(taskId);
        session.getController().cancel();
        return session.getContext().getPhase();
    }

    /**
     * Detaches a subscriber whose channel went away. A task still working is cancelled; a task
     * awaiting approval stays suspended for a later decision over REST.
     */
    public void detach(String taskId, String subscriberId) {
        TaskSession session;
        synchronized (sessions) {
            session = sessions.get(taskId);
        }
        if (session == null) {
            return;
        }
        session.getEvents().unsubscribe(subscriberId);
        Phase phase = session.getContext().getPhase();
        if (!phase.isTerminal() && phase != Phase.AWAITING_APPROVAL) {
            log.info("task.detach taskId={} phase={} action=cancel", taskId, phase.wireName());
            session.getController().cancel();
        }
    }

    public int size() {
        synchronized (sessions) {
            return sessions.size();
        }
    }

    /**
     * Rejects and drops tasks that have waited for a decision longer than the approval TTL. Their
     * staged changes are discarded and the repository is left untouched. A TTL of zero or less
     * disables expiry.
     *
     * @return number of tasks expired
     */
    @Scheduled(fixedDelayString = "${koda.agent.approval-sweep-ms:60000}")
    public int expireApprovals() {
        long ttl = config.getApprovalTtlMs();
        if (ttl <= 0) {
            return 0;
        }
        long now = System.currentTimeMillis();
        List<TaskSession> expired = new ArrayList<>();
        synchronized (sessions) {
            Iterator<TaskSession> it = sessions.values().iterator();
            while (it.hasNext()) {
                TaskSession candidate = it.next();
                TaskContext ctx = candidate.getContext();
                if (ctx.getPhase() == Phase.AWAITING_APPROVAL && now - ctx.getPhaseChangedAt() >= ttl) {
                    it.remove();
                    expired.add(candidate);
                }
            }
        }
        for (TaskSession session : expired) {
            try {
                session.getController().reject();
            } catch (IllegalStateException e) {
                // decided between the sweep and the reject
                log.debug("task.expire.skip taskId={} reason={}", session.getId(), e.getMessage());
            }
            session.getEvents().flush(1000);
            session.getEvents().close();
            log.info("task.expire taskId={} ttlMs={}", session.getId(), ttl);
        }
        return expired.size();
    }

    private void evictFinished() {
        int excess = sessions.size() - Math.max(1, config.getRetainedTasks());
        Iterator<TaskSession> it = sessions.values().iterator();
        while (excess > 0 && it.hasNext()) {
            TaskSession candidate = it.next();
            if (candidate.isFinished()) {
                it.remove();
                candidate.getEvents().close();
                excess--;
                log.debug("task.evict taskId={}", candidate.getId());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        List<TaskSession> live;
        synchronized (sessions) {
            live = new ArrayList<>(sessions.values());
        }
        for (TaskSession session : live) {
            session.getController().cancel();
            session.getEvents().close();
        }
        workers.shutdownNow();
    }
}
