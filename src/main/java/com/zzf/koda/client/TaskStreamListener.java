package com.zzf.koda.client;

import com.zzf.koda.core.agent.TaskSnapshot;
import com.zzf.koda.core.error.ErrorCode;
import com.zzf.koda.core.event.AgentEvent;
import com.zzf.koda.session.ChangeSetView;

/**
 * Callbacks of {@link TaskStreamClient}. Invoked on the client's internal threads.
 */
public interface TaskStreamListener {

    void onEvent(AgentEvent event);

    /**
     * Authoritative state fetched after the channel dropped; events missed meanwhile are not replayed.
     */
    default void onSnapshot(TaskSnapshot snapshot) {
    }

    /**
     * Staged changes re-queried after a drop, delivered after {@link #onSnapshot} when the task
     * is awaiting approval.
     */
    default void onChanges(ChangeSetView changes) {
    }

    default void onReconnecting(int attempt, long delayMs) {
    }

    default void onError(ErrorCode code, String message) {
    }

    default void onClosed() {
    }
}
