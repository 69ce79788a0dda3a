package io.a2a.protocol.server.tasks;

import io.a2a.protocol.model.TaskState;

/**
 * Raised when a task is asked to move to a state its current state cannot lead to, or to change once it has
 * reached a terminal state.
 */
public class InvalidTaskTransitionException extends IllegalStateException {

    private final String taskId;
    private final TaskState from;
    private final TaskState to;

    public InvalidTaskTransitionException(String taskId, TaskState from, TaskState to) {
        super("Task " + taskId + " cannot move from " + from + " to " + to);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public InvalidTaskTransitionException(String taskId, TaskState from, String message) {
        super(message);
        this.taskId = taskId;
        this.from = from;
        this.to = from;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskState getFrom() {
        return from;
    }

    public TaskState getTo() {
        return to;
    }
}
