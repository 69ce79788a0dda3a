package io.a2a.protocol.model;

import java.util.Map;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;

/**
 * An update emitted while a task is streamed to a client, as the result of {@code tasks/sendSubscribe}
 * and {@code tasks/resubscribe}.
 * <p>
 * The two kinds carry no discriminator on the wire: a status update has a {@code status}, an artifact update
 * has an {@code artifact}.
 */
@JsonDeserialize(using = StreamingEventKindDeserializer.class)
public sealed interface StreamingEventKind permits TaskStatusUpdateEvent, TaskArtifactUpdateEvent {

    /**
     * @return the id of the task this event belongs to
     */
    String id();

    default Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    /**
     * @param projection a status or artifact update projection
     * @return the event
     * @throws A2AValidationException if the projection has neither a {@code status} nor an {@code artifact}
     */
    static StreamingEventKind fromProjection(Map<String, ?> projection) {
        Assert.checkNotNullParam("projection", projection);
        return Utils.fromProjection(projection, eventClass(projection.containsKey("status"),
                projection.containsKey("artifact")));
    }

    static Class<? extends StreamingEventKind> eventClass(boolean hasStatus, boolean hasArtifact) {
        if (hasStatus) {
            return TaskStatusUpdateEvent.class;
        }
        if (hasArtifact) {
            return TaskArtifactUpdateEvent.class;
        }
        throw new A2AValidationException("Streaming event must carry either a status or an artifact");
    }
}
