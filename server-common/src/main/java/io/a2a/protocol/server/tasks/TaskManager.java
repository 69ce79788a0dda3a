package io.a2a.protocol.server.tasks;

import static io.a2a.protocol.util.Assert.checkNotNullParam;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.a2a.protocol.model.Artifact;
import io.a2a.protocol.model.InvalidParamsError;
import io.a2a.protocol.model.Message;
import io.a2a.protocol.model.Part;
import io.a2a.protocol.model.Task;
import io.a2a.protocol.model.TaskNotCancelableError;
import io.a2a.protocol.model.TaskNotFoundError;
import io.a2a.protocol.model.TaskSendParams;
import io.a2a.protocol.model.TaskState;
import io.a2a.protocol.model.TaskStatus;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the lifecycle of the tasks kept in a {@link TaskStore}.
 * <p>
 * Every change goes through {@link TaskStore#update}, so deciding the next snapshot from the current one and
 * publishing it happen atomically per task. The legal transitions are:
 * <pre>
 * submitted      -> working | canceled | failed
 * working        -> working | input-required | completed | canceled | failed
 * input-required -> working | canceled | failed
 * unknown        -> working | canceled | failed
 * </pre>
 * Terminal states (completed, canceled, failed) lead nowhere. Every status created here is stamped by the
 * injected {@link Clock}.
 */
public class TaskManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskManager.class);

    private static final Map<TaskState, Set<TaskState>> TRANSITIONS = new EnumMap<>(TaskState.class);

    static {
        TRANSITIONS.put(TaskState.SUBMITTED, EnumSet.of(TaskState.WORKING, TaskState.CANCELED, TaskState.FAILED));
        TRANSITIONS.put(TaskState.WORKING, EnumSet.of(TaskState.WORKING, TaskState.INPUT_REQUIRED,
                TaskState.COMPLETED, TaskState.CANCELED, TaskState.FAILED));
        TRANSITIONS.put(TaskState.INPUT_REQUIRED, EnumSet.of(TaskState.WORKING, TaskState.CANCELED, TaskState.FAILED));
        TRANSITIONS.put(TaskState.UNKNOWN, EnumSet.of(TaskState.WORKING, TaskState.CANCELED, TaskState.FAILED));
        TRANSITIONS.put(TaskState.COMPLETED, EnumSet.noneOf(TaskState.class));
        TRANSITIONS.put(TaskState.CANCELED, EnumSet.noneOf(TaskState.class));
        TRANSITIONS.put(TaskState.FAILED, EnumSet.noneOf(TaskState.class));
    }

    private final TaskStore taskStore;
    private final Clock clock;

    public TaskManager(TaskStore taskStore) {
        this(taskStore, Clock.systemUTC());
    }

    public TaskManager(TaskStore taskStore, Clock clock) {
        this.taskStore = checkNotNullParam("taskStore", taskStore);
        this.clock = checkNotNullParam("clock", clock);
    }

    /**
     * @param from the current state
     * @param to the requested state
     * @return whether a task in {@code from} may move to {@code to}
     */
    public static boolean isLegalTransition(TaskState from, TaskState to) {
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * Accepts a message sent to a task.
     * <p>
     * An unknown task id creates the task in {@link TaskState#SUBMITTED}. A task waiting in
     * {@link TaskState#INPUT_REQUIRED} is resumed to {@link TaskState#WORKING}. Any other existing task is
     * refused.
     *
     * @param params the send parameters
     * @return the stored snapshot
     * @throws InvalidParamsError if the task is already in progress or has finished
     */
    public Task submit(TaskSendParams params) {
        checkNotNullParam("params", params);
        Task task = taskStore.update(params.taskId(), current -> {
            if (current == null) {
                return Task.builder()
                        .id(params.taskId())
                        .sessionId(params.sessionId())
                        .status(new TaskStatus(TaskState.SUBMITTED, params.message(), clock))
                        .metadata(params.metadata())
                        .build();
            }
            if (current.state() == TaskState.INPUT_REQUIRED) {
                return Task.builder(current)
                        .status(new TaskStatus(TaskState.WORKING, params.message(), clock))
                        .build();
            }
            if (current.state().isTerminal()) {
                throw new InvalidParamsError("Task " + current.id() + " is in terminal state " + current.state());
            }
            throw new InvalidParamsError("Task " + current.id() + " is already " + current.state());
        });
        LOGGER.debug("Task {} accepted in state {}", task.id(), task.state());
        return task;
    }

    /**
     * Moves a task to a new state.
     *
     * @param taskId the task id
     * @param state the new state
     * @param message optional message for the new status
     * @return the stored snapshot
     * @throws TaskNotFoundError if there is no such task
     * @throws InvalidTaskTransitionException if the current state cannot lead to {@code state}
     */
    public Task transition(String taskId, TaskState state, @Nullable Message message) {
        checkNotNullParam("taskId", taskId);
        checkNotNullParam("state", state);
        Task task = taskStore.update(taskId, current -> {
            Task existing = requireExisting(taskId, current);
            if (!isLegalTransition(existing.state(), state)) {
                throw new InvalidTaskTransitionException(taskId, existing.state(), state);
            }
            return Task.builder(existing)
                    .status(new TaskStatus(state, message, clock))
                    .build();
        });
        LOGGER.debug("Task {} moved to {}", taskId, state);
        return task;
    }

    /**
     * Adds an artifact to a task that has not finished.
     * <p>
     * An artifact with {@code append} set extends the parts of the artifact already stored at the same index and
     * takes over its {@code lastChunk} flag; when there is none to extend, the chunk is stored as a new artifact.
     * Any other artifact replaces the one stored at its index, or is added after the existing ones.
     *
     * @param taskId the task id
     * @param artifact the artifact or chunk
     * @return the stored snapshot
     * @throws TaskNotFoundError if there is no such task
     * @throws InvalidTaskTransitionException if the task is in a terminal state
     */
    public Task addArtifact(String taskId, Artifact artifact) {
        checkNotNullParam("taskId", taskId);
        checkNotNullParam("artifact", artifact);
        return taskStore.update(taskId, current -> {
            Task existing = requireExisting(taskId, current);
            if (existing.state().isTerminal()) {
                throw new InvalidTaskTransitionException(taskId, existing.state(),
                        "Task " + taskId + " is in terminal state " + existing.state() + " and accepts no artifact");
            }
            return Task.builder(existing)
                    .artifacts(mergeArtifact(existing.artifacts(), artifact))
                    .build();
        });
    }

    /**
     * Cancels a task that has not finished.
     *
     * @param taskId the task id
     * @return the canceled snapshot
     * @throws TaskNotFoundError if there is no such task
     * @throws TaskNotCancelableError if the task is in a terminal state
     */
    public Task cancel(String taskId) {
        checkNotNullParam("taskId", taskId);
        Task task = taskStore.update(taskId, current -> {
            Task existing = requireExisting(taskId, current);
            if (existing.state().isTerminal()) {
                LOGGER.debug("Refusing to cancel task {} in state {}", taskId, existing.state());
                throw new TaskNotCancelableError();
            }
            return Task.builder(existing)
                    .status(new TaskStatus(TaskState.CANCELED, null, clock))
                    .build();
        });
        LOGGER.debug("Task {} canceled", taskId);
        return task;
    }

    public @Nullable Task getTask(String taskId) {
        return taskStore.get(taskId);
    }

    /**
     * @param taskId the task id
     * @return the stored snapshot
     * @throws TaskNotFoundError if there is no such task
     */
    public Task requireTask(String taskId) {
        Task task = taskStore.get(taskId);
        if (task == null) {
            throw new TaskNotFoundError();
        }
        return task;
    }

    private static Task requireExisting(String taskId, @Nullable Task current) {
        if (current == null) {
            throw new TaskNotFoundError();
        }
        return current;
    }

    private static List<Artifact> mergeArtifact(@Nullable List<Artifact> artifacts, Artifact artifact) {
        List<Artifact> merged = artifacts == null ? new ArrayList<>() : new ArrayList<>(artifacts);
        int position = -1;
        for (int i = 0; i < merged.size(); i++) {
            if (merged.get(i).index() == artifact.index()) {
                position = i;
                break;
            }
        }
        if (position < 0) {
            merged.add(artifact);
        } else if (Boolean.TRUE.equals(artifact.append())) {
            Artifact previous = merged.get(position);
            List<Part> parts = new ArrayList<>(previous.parts());
            parts.addAll(artifact.parts());
            merged.set(position, Artifact.builder(previous)
                    .parts(parts)
                    .lastChunk(artifact.lastChunk())
                    .build());
        } else {
            merged.set(position, artifact);
        }
        return merged;
    }
}
