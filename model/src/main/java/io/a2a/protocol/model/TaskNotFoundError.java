package io.a2a.protocol.model;

import static io.a2a.protocol.model.A2AErrorCodes.TASK_NOT_FOUND_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * The task referenced by the request does not exist, or is no longer retained by the server.
 */
public class TaskNotFoundError extends A2AError {

    public static final String DEFAULT_MESSAGE = "Task not found";

    public TaskNotFoundError() {
        this(DEFAULT_MESSAGE);
    }

    public TaskNotFoundError(String message) {
        this(message, null);
    }

    public TaskNotFoundError(String message, @Nullable Object data) {
        super(TASK_NOT_FOUND_ERROR_CODE, message, data);
    }
}
