package io.a2a.protocol.server.tasks;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

import io.a2a.protocol.model.Task;
import io.a2a.protocol.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * In-memory implementation of {@link TaskStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * {@link #update(String, UnaryOperator)} relies on {@link ConcurrentHashMap#compute}, which runs the update of a
 * given key while holding that key's bin, giving the single-writer-per-task-id discipline the store requires.
 * Update functions must therefore be short and must not touch the store themselves. Tasks are lost on restart.
 */
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentMap<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        Assert.checkNotNullParam("task", task);
        tasks.put(task.id(), task);
    }

    @Override
    public @Nullable Task get(String taskId) {
        return tasks.get(taskId);
    }

    @Override
    public Task update(String taskId, UnaryOperator<@Nullable Task> updateFunction) {
        Assert.checkNotNullParam("taskId", taskId);
        Task updated = tasks.compute(taskId, (id, current) -> {
            Task next = updateFunction.apply(current);
            if (next != null && !id.equals(next.id())) {
                throw new IllegalStateException("Update of task " + id + " produced task " + next.id());
            }
            return next;
        });
        if (updated == null) {
            throw new IllegalStateException("Update of task " + taskId + " produced no task");
        }
        return updated;
    }
}
