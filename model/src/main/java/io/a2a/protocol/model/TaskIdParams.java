package io.a2a.protocol.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Parameters of the operations that only need a task identifier: {@code tasks/get}, {@code tasks/cancel},
 * {@code tasks/resubscribe} and {@code tasks/pushNotification/get}.
 *
 * @param taskId the task identifier, accepted as {@code id} or {@code task_id} on input
 * @param metadata optional request metadata
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskIdParams(@JsonProperty("taskId") @JsonAlias({"id", "task_id"}) String taskId,
                           @JsonProperty("metadata") @Nullable Map<String, Object> metadata) {

    @JsonCreator
    public TaskIdParams {
        Assert.checkNotBlankParam("taskId", taskId);
        metadata = Utils.copyOfNullable(metadata);
    }

    public TaskIdParams(String taskId) {
        this(taskId, null);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static TaskIdParams fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, TaskIdParams.class);
    }
}
