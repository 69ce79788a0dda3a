package io.a2a.protocol.model;

import java.time.Clock;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * The status of a {@link Task} at a point in time.
 * <p>
 * When no timestamp is supplied one is taken from a clock: the system UTC clock by default, or the clock
 * passed to {@link #TaskStatus(TaskState, Message, Clock)}. Server components always pass their injected
 * clock so that status timestamps are reproducible under test.
 *
 * @param state the lifecycle state
 * @param message optional message explaining the status, for example the question asked in
 *                {@link TaskState#INPUT_REQUIRED}
 * @param timestamp ISO-8601 date-time, e.g. {@code 2025-01-15T10:30:00Z}
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskStatus(@JsonProperty("state") TaskState state,
                         @JsonProperty("message") @Nullable Message message,
                         @JsonProperty("timestamp") String timestamp) {

    @JsonCreator
    public TaskStatus(@JsonProperty("state") TaskState state,
                      @JsonProperty("message") @Nullable Message message,
                      @JsonProperty("timestamp") @Nullable String timestamp) {
        this.state = Assert.checkNotNullParam("state", state);
        this.message = message;
        this.timestamp = timestamp == null
                ? Utils.currentTimestamp(Clock.systemUTC())
                : Utils.checkTimestamp("timestamp", timestamp);
    }

    public TaskStatus(TaskState state) {
        this(state, null, (String) null);
    }

    public TaskStatus(TaskState state, @Nullable Message message, Clock clock) {
        this(state, message, Utils.currentTimestamp(Assert.checkNotNullParam("clock", clock)));
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static TaskStatus fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, TaskStatus.class);
    }
}
