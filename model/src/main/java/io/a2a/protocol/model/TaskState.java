package io.a2a.protocol.model;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

/**
 * Defines the lifecycle states of a {@link Task}.
 * <p>
 * <b>Transitional states:</b>
 * <ul>
 *   <li><b>submitted:</b> the task has been received and is queued for processing</li>
 *   <li><b>working:</b> the agent is actively processing the task</li>
 *   <li><b>input-required:</b> the agent needs additional input from the user to continue</li>
 *   <li><b>unknown:</b> the state cannot be determined</li>
 * </ul>
 * <p>
 * <b>Terminal states:</b>
 * <ul>
 *   <li><b>completed:</b> the task finished successfully</li>
 *   <li><b>canceled:</b> the task was canceled by the user or the system</li>
 *   <li><b>failed:</b> the task failed during execution</li>
 * </ul>
 * <p>
 * The narrative lifecycle is {@code submitted -> working -> (input-required <-> working) -> completed | failed |
 * canceled}. This type does not enforce it; producers of tasks do.
 *
 * @see TaskStatus
 * @see Task
 */
public enum TaskState {
    SUBMITTED("submitted", false),
    WORKING("working", false),
    INPUT_REQUIRED("input-required", false),
    COMPLETED("completed", true),
    CANCELED("canceled", true),
    FAILED("failed", true),
    UNKNOWN("unknown", false);

    private final String state;
    private final boolean terminal;

    TaskState(String state, boolean terminal) {
        this.state = state;
        this.terminal = terminal;
    }

    /**
     * @return the wire value of this state
     */
    @JsonValue
    public String asString() {
        return state;
    }

    /**
     * Determines whether this state is terminal. Once a task reaches a terminal state no further status
     * transition is expected, and cancellation is refused with {@link TaskNotCancelableError}.
     *
     * @return {@code true} for completed, canceled and failed
     */
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * @return the wire values of all states, in declaration order
     */
    public static List<String> names() {
        return Arrays.stream(values()).map(TaskState::asString).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Parses a wire value.
     *
     * @param state the wire value
     * @return the matching state
     * @throws A2AValidationException if the value is not one of {@link #names()}
     */
    @JsonCreator
    public static TaskState fromString(@Nullable String state) {
        for (TaskState taskState : values()) {
            if (taskState.state.equals(state)) {
                return taskState;
            }
        }
        throw new A2AValidationException("Invalid task state: " + state + ". Must be one of: "
                + String.join(", ", names()));
    }

    @Override
    public String toString() {
        return state;
    }
}
