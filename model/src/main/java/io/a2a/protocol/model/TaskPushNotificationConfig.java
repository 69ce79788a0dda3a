package io.a2a.protocol.model;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;

/**
 * Associates a {@link PushNotificationConfig} with a task. Parameters of {@code tasks/pushNotification/set}
 * and result of both push notification methods.
 *
 * @param taskId the task identifier, accepted as {@code id} or {@code task_id} on input
 * @param pushNotificationConfig the configuration, accepted as {@code push_notification_config} on input
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskPushNotificationConfig(
        @JsonProperty("taskId") @JsonAlias({"id", "task_id"}) String taskId,
        @JsonProperty("pushNotificationConfig") @JsonAlias("push_notification_config")
        PushNotificationConfig pushNotificationConfig) {

    @JsonCreator
    public TaskPushNotificationConfig {
        Assert.checkNotBlankParam("taskId", taskId);
        Assert.checkNotNullParam("pushNotificationConfig", pushNotificationConfig);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static TaskPushNotificationConfig fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, TaskPushNotificationConfig.class);
    }
}
