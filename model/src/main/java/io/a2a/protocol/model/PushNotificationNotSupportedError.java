package io.a2a.protocol.model;

import static io.a2a.protocol.model.A2AErrorCodes.PUSH_NOTIFICATION_NOT_SUPPORTED_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * The agent does not advertise {@link AgentCapabilities#pushNotifications()}.
 */
public class PushNotificationNotSupportedError extends A2AError {

    public static final String DEFAULT_MESSAGE = "Push Notification is not supported";

    public PushNotificationNotSupportedError() {
        this(DEFAULT_MESSAGE);
    }

    public PushNotificationNotSupportedError(String message) {
        this(message, null);
    }

    public PushNotificationNotSupportedError(String message, @Nullable Object data) {
        super(PUSH_NOTIFICATION_NOT_SUPPORTED_ERROR_CODE, message, data);
    }
}
