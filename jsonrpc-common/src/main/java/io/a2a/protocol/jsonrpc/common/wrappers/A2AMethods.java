package io.a2a.protocol.jsonrpc.common.wrappers;

import java.util.Set;

/**
 * The JSON-RPC method names of the protocol.
 */
public final class A2AMethods {

    public static final String SEND_TASK_METHOD = "tasks/send";
    public static final String SEND_TASK_SUBSCRIBE_METHOD = "tasks/sendSubscribe";
    public static final String GET_TASK_METHOD = "tasks/get";
    public static final String CANCEL_TASK_METHOD = "tasks/cancel";
    public static final String RESUBSCRIBE_METHOD = "tasks/resubscribe";
    public static final String SET_TASK_PUSH_NOTIFICATION_CONFIG_METHOD = "tasks/pushNotification/set";
    public static final String GET_TASK_PUSH_NOTIFICATION_CONFIG_METHOD = "tasks/pushNotification/get";

    /**
     * Methods answered with a stream of responses rather than a single one.
     */
    public static final Set<String> STREAMING_METHODS = Set.of(SEND_TASK_SUBSCRIBE_METHOD, RESUBSCRIBE_METHOD);

    public static final Set<String> ALL_METHODS = Set.of(
            SEND_TASK_METHOD,
            SEND_TASK_SUBSCRIBE_METHOD,
            GET_TASK_METHOD,
            CANCEL_TASK_METHOD,
            RESUBSCRIBE_METHOD,
            SET_TASK_PUSH_NOTIFICATION_CONFIG_METHOD,
            GET_TASK_PUSH_NOTIFICATION_CONFIG_METHOD);

    private A2AMethods() {
    }

    public static boolean isStreaming(String method) {
        return STREAMING_METHODS.contains(method);
    }

    public static boolean isKnown(String method) {
        return ALL_METHODS.contains(method);
    }
}
