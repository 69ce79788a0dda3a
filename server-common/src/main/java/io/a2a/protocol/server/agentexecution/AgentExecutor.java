package io.a2a.protocol.server.agentexecution;

import io.a2a.protocol.model.A2AError;
import io.a2a.protocol.server.tasks.TaskUpdater;

/**
 * The business logic of an agent.
 * <p>
 * {@link #execute} is called for every message accepted by {@code tasks/send} and {@code tasks/sendSubscribe},
 * on the calling thread, with the task already stored as submitted (or resumed as working). The executor
 * reports progress only through the {@link TaskUpdater}. A protocol error thrown here is answered to the client
 * as is; any other exception fails the task.
 */
public interface AgentExecutor {

    void execute(RequestContext context, TaskUpdater updater) throws A2AError;

    /**
     * Called after a task was canceled so that the executor can release whatever it holds for it. The task is
     * already in its canceled state and can no longer be updated.
     */
    void cancel(RequestContext context) throws A2AError;
}
