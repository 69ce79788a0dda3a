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
 * Reports an artifact, or a chunk of one, produced by a streamed task.
 *
 * @param id the task id
 * @param artifact the artifact or chunk
 * @param metadata optional metadata
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(using = JsonDeserializer.None.class)
public record TaskArtifactUpdateEvent(@JsonProperty("id") String id,
                                      @JsonProperty("artifact") Artifact artifact,
                                      @JsonProperty("metadata") @Nullable Map<String, Object> metadata)
        implements StreamingEventKind {

    @JsonCreator
    public TaskArtifactUpdateEvent {
        Assert.checkNotNullParam("id", id);
        Assert.checkNotNullParam("artifact", artifact);
        metadata = Utils.copyOfNullable(metadata);
    }

    public TaskArtifactUpdateEvent(String id, Artifact artifact) {
        this(id, artifact, null);
    }

    public static TaskArtifactUpdateEvent fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, TaskArtifactUpdateEvent.class);
    }
}
