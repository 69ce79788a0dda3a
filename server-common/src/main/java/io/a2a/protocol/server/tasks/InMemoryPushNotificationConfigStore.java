package io.a2a.protocol.server.tasks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.a2a.protocol.model.PushNotificationConfig;
import io.a2a.protocol.util.Assert;
import org.jspecify.annotations.Nullable;

public class InMemoryPushNotificationConfigStore implements PushNotificationConfigStore {

    private final Map<String, PushNotificationConfig> configs = new ConcurrentHashMap<>();

    @Override
    public void setInfo(String taskId, PushNotificationConfig config) {
        Assert.checkNotNullParam("taskId", taskId);
        Assert.checkNotNullParam("config", config);
        configs.put(taskId, config);
    }

    @Override
    public @Nullable PushNotificationConfig getInfo(String taskId) {
        return configs.get(taskId);
    }
}
