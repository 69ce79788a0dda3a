package io.a2a.protocol.server.requesthandlers;

import java.util.concurrent.Flow;

import io.a2a.protocol.model.A2AError;
import io.a2a.protocol.model.StreamingEventKind;
import io.a2a.protocol.model.Task;
import io.a2a.protocol.model.TaskIdParams;
import io.a2a.protocol.model.TaskPushNotificationConfig;
import io.a2a.protocol.model.TaskSendParams;

/**
 * The server side of the protocol, one method per JSON-RPC method. Transports decode the request, call the
 * matching method and encode its result; a thrown {@link A2AError} becomes the error of the response.
 */
public interface RequestHandler {

    /**
     * {@code tasks/send}: accepts a message and runs the agent on it.
     *
     * @return the task once the agent has returned
     */
    Task onSendTask(TaskSendParams params) throws A2AError;

    /**
     * {@code tasks/sendSubscribe}: accepts a message and streams the progress of the agent on it.
     */
    Flow.Publisher<StreamingEventKind> onSendTaskSubscribe(TaskSendParams params) throws A2AError;

    /**
     * {@code tasks/get}
     */
    Task onGetTask(TaskIdParams params) throws A2AError;

    /**
     * {@code tasks/cancel}
     */
    Task onCancelTask(TaskIdParams params) throws A2AError;

    /**
     * {@code tasks/pushNotification/set}
     */
    TaskPushNotificationConfig onSetTaskPushNotificationConfig(TaskPushNotificationConfig params) throws A2AError;

    /**
     * {@code tasks/pushNotification/get}
     */
    TaskPushNotificationConfig onGetTaskPushNotificationConfig(TaskIdParams params) throws A2AError;

    /**
     * {@code tasks/resubscribe}: streams the state of a task again, for a client whose stream was interrupted.
     */
    Flow.Publisher<StreamingEventKind> onResubscribe(TaskIdParams params) throws A2AError;
}
