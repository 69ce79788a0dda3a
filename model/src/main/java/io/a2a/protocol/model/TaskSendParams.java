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
 * Parameters of {@code tasks/send} and {@code tasks/sendSubscribe}.
 * <p>
 * Sending to a new task id creates the task; sending to a task waiting in {@link TaskState#INPUT_REQUIRED}
 * resumes it with the new message.
 *
 * @param taskId the task identifier, accepted as {@code id} or {@code task_id} on input
 * @param sessionId optional session, accepted as {@code session_id} on input
 * @param message the message for the agent
 * @param metadata optional request metadata
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskSendParams(@JsonProperty("taskId") @JsonAlias({"id", "task_id"}) String taskId,
                             @JsonProperty("sessionId") @JsonAlias("session_id") @Nullable String sessionId,
                             @JsonProperty("message") Message message,
                             @JsonProperty("metadata") @Nullable Map<String, Object> metadata) {

    @JsonCreator
    public TaskSendParams {
        Assert.checkNotBlankParam("taskId", taskId);
        Assert.checkNotNullParam("message", message);
        metadata = Utils.copyOfNullable(metadata);
    }

    public TaskSendParams(String taskId, Message message) {
        this(taskId, null, message, null);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static TaskSendParams fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, TaskSendParams.class);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private @Nullable String taskId;
        private @Nullable String sessionId;
        private @Nullable Message message;
        private @Nullable Map<String, Object> metadata;

        private Builder() {
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder sessionId(@Nullable String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        /**
         * @param message a {@link Message} or its projection
         * @return this builder
         */
        public Builder message(Object message) {
            this.message = Utils.normalize(message, Message.class);
            return this;
        }

        public Builder metadata(@Nullable Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public TaskSendParams build() {
            return new TaskSendParams(Assert.checkNotNullParam("taskId", taskId), sessionId,
                    Assert.checkNotNullParam("message", message), metadata);
        }
    }
}
