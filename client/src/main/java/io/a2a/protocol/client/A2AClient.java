package io.a2a.protocol.client;

import java.util.function.Consumer;

import io.a2a.protocol.model.AgentCard;
import io.a2a.protocol.model.StreamingEventKind;
import io.a2a.protocol.model.Task;
import io.a2a.protocol.model.TaskIdParams;
import io.a2a.protocol.model.TaskPushNotificationConfig;
import io.a2a.protocol.model.TaskSendParams;

/**
 * The client side of the protocol, mirroring the methods an agent serves.
 */
public interface A2AClient {

    /**
     * @return the card published by the agent
     */
    AgentCard getAgentCard() throws A2AClientException;

    Task sendTask(TaskSendParams params) throws A2AClientException;

    /**
     * Sends a message and receives the progress of the task as it happens.
     *
     * @param params the send parameters
     * @param eventConsumer receives each status or artifact update
     * @param errorConsumer receives a failure reported after the stream started
     * @throws A2AClientException if the request cannot be sent
     */
    void sendTaskStreaming(TaskSendParams params, Consumer<StreamingEventKind> eventConsumer,
                           Consumer<Throwable> errorConsumer) throws A2AClientException;

    Task getTask(TaskIdParams params) throws A2AClientException;

    Task cancelTask(TaskIdParams params) throws A2AClientException;

    TaskPushNotificationConfig setTaskPushNotificationConfig(TaskPushNotificationConfig config)
            throws A2AClientException;

    TaskPushNotificationConfig getTaskPushNotificationConfig(TaskIdParams params) throws A2AClientException;

    void resubscribe(TaskIdParams params, Consumer<StreamingEventKind> eventConsumer,
                     Consumer<Throwable> errorConsumer) throws A2AClientException;
}
