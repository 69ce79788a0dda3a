package io.a2a.protocol.server.tasks;

import java.util.function.UnaryOperator;

import io.a2a.protocol.model.Task;
import org.jspecify.annotations.Nullable;

/**
 * Storage of task snapshots, keyed by task id.
 * <p>
 * Tasks are immutable, so a store only ever swaps whole snapshots. {@link #update(String, UnaryOperator)} is the
 * one read-decide-publish primitive: implementations must run it atomically per task id, so that at most one
 * transition of a given task is in flight and readers never observe a snapshot that was decided on stale state.
 */
public interface TaskStore {

    void save(Task task);

    @Nullable Task get(String taskId);

    /**
     * Atomically replaces the snapshot of a task.
     *
     * @param taskId the task id
     * @param updateFunction receives the current snapshot, or {@code null} if there is none, and returns the next
     *                       one; an exception thrown here leaves the stored snapshot unchanged
     * @return the stored snapshot
     */
    Task update(String taskId, UnaryOperator<@Nullable Task> updateFunction);
}
