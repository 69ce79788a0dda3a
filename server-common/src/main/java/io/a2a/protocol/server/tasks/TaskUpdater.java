package io.a2a.protocol.server.tasks;

import static io.a2a.protocol.util.Assert.checkNotNullParam;

import java.util.List;
import java.util.function.Consumer;

import io.a2a.protocol.model.Artifact;
import io.a2a.protocol.model.Message;
import io.a2a.protocol.model.StreamingEventKind;
import io.a2a.protocol.model.Task;
import io.a2a.protocol.model.TaskArtifactUpdateEvent;
import io.a2a.protocol.model.TaskState;
import io.a2a.protocol.model.TaskStatusUpdateEvent;
import org.jspecify.annotations.Nullable;

/**
 * The way an {@link io.a2a.protocol.server.agentexecution.AgentExecutor} advances the task it works on.
 * <p>
 * Each call goes through the {@link TaskManager}, so illegal transitions are refused, and then reports the
 * stored change to the event sink, which feeds the stream of a {@code tasks/sendSubscribe} call. A status event
 * is marked final when the task reaches a terminal state or waits for input.
 */
public class TaskUpdater {

    private final TaskManager taskManager;
    private final String taskId;
    private final Consumer<StreamingEventKind> eventSink;

    public TaskUpdater(TaskManager taskManager, String taskId) {
        this(taskManager, taskId, event -> {
        });
    }

    public TaskUpdater(TaskManager taskManager, String taskId, Consumer<StreamingEventKind> eventSink) {
        this.taskManager = checkNotNullParam("taskManager", taskManager);
        this.taskId = checkNotNullParam("taskId", taskId);
        this.eventSink = checkNotNullParam("eventSink", eventSink);
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * @return the current snapshot of the task
     */
    public Task getTask() {
        return taskManager.requireTask(taskId);
    }

    public Task updateStatus(TaskState state, @Nullable Message message) {
        Task task = taskManager.transition(taskId, state, message);
        boolean isFinal = state.isTerminal() || state == TaskState.INPUT_REQUIRED;
        eventSink.accept(new TaskStatusUpdateEvent(taskId, task.status(), isFinal));
        return task;
    }

    public Task startWork() {
        return startWork(null);
    }

    public Task startWork(@Nullable Message message) {
        return updateStatus(TaskState.WORKING, message);
    }

    public Task requireInput(Message message) {
        return updateStatus(TaskState.INPUT_REQUIRED, checkNotNullParam("message", message));
    }

    public Task complete() {
        return complete(null);
    }

    public Task complete(@Nullable Message message) {
        return updateStatus(TaskState.COMPLETED, message);
    }

    public Task fail() {
        return fail(null);
    }

    public Task fail(@Nullable Message message) {
        return updateStatus(TaskState.FAILED, message);
    }

    public Task addArtifact(Artifact artifact) {
        Task task = taskManager.addArtifact(taskId, artifact);
        eventSink.accept(new TaskArtifactUpdateEvent(taskId, artifact));
        return task;
    }

    /**
     * @param parts {@link io.a2a.protocol.model.Part} instances or part projections
     * @return the stored snapshot
     */
    public Task addArtifact(List<?> parts) {
        return addArtifact(Artifact.builder().parts(parts).build());
    }

    /**
     * @param text the text
     * @return a message from the agent holding {@code text}
     */
    public Message newAgentMessage(String text) {
        return Message.text(Message.Role.AGENT, text);
    }
}
