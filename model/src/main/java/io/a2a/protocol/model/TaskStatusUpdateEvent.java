package io.a2a.protocol.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Reports a new status of a streamed task. The last event of a stream has {@code final} set.
 *
 * @param id the task id
 * @param status the new status
 * @param isFinal whether no further event follows, {@code final} on the wire
 * @param metadata optional metadata
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(using = JsonDeserializer.None.class)
public record TaskStatusUpdateEvent(@JsonProperty("id") String id,
                                    @JsonProperty("status") TaskStatus status,
                                    @JsonProperty("final") boolean isFinal,
                                    @JsonProperty("metadata") @Nullable Map<String, Object> metadata)
        implements StreamingEventKind {

    @JsonCreator
    public TaskStatusUpdateEvent {
        Assert.checkNotNullParam("id", id);
        Assert.checkNotNullParam("status", status);
        metadata = Utils.copyOfNullable(metadata);
    }

    public TaskStatusUpdateEvent(String id, TaskStatus status, boolean isFinal) {
        this(id, status, isFinal, null);
    }

    public static TaskStatusUpdateEvent fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, TaskStatusUpdateEvent.class);
    }
}
