package io.a2a.protocol.model;

import static io.a2a.protocol.model.A2AErrorCodes.TASK_NOT_CANCELABLE_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * A cancellation was requested for a task that already reached a terminal state
 * ({@link TaskState#COMPLETED}, {@link TaskState#CANCELED} or {@link TaskState#FAILED}).
 */
public class TaskNotCancelableError extends A2AError {

    public static final String DEFAULT_MESSAGE = "Task cannot be canceled";

    public TaskNotCancelableError() {
        this(DEFAULT_MESSAGE);
    }

    public TaskNotCancelableError(String message) {
        this(message, null);
    }

    public TaskNotCancelableError(String message, @Nullable Object data) {
        super(TASK_NOT_CANCELABLE_ERROR_CODE, message, data);
    }
}
