package io.a2a.protocol.server.tasks;

import io.a2a.protocol.model.PushNotificationConfig;
import org.jspecify.annotations.Nullable;

/**
 * Keeps the push notification configuration registered for each task. Delivering the notifications is left to
 * the integrator.
 */
public interface PushNotificationConfigStore {

    /**
     * Registers the configuration of a task, replacing any previous one.
     */
    void setInfo(String taskId, PushNotificationConfig config);

    @Nullable PushNotificationConfig getInfo(String taskId);
}
