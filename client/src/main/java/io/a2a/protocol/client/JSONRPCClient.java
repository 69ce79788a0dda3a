package io.a2a.protocol.client;

import static io.a2a.protocol.util.Assert.checkNotNullParam;

import java.io.IOException;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JsonNode;
import io.a2a.protocol.client.transport.spi.ClientTransport;
import io.a2a.protocol.jsonrpc.common.json.JsonProcessingException;
import io.a2a.protocol.jsonrpc.common.json.JsonUtil;
import io.a2a.protocol.jsonrpc.common.wrappers.A2AMethods;
import io.a2a.protocol.jsonrpc.common.wrappers.JSONRPCError;
import io.a2a.protocol.jsonrpc.common.wrappers.JSONRPCRequest;
import io.a2a.protocol.jsonrpc.common.wrappers.JSONRPCResponse;
import io.a2a.protocol.model.A2AError;
import io.a2a.protocol.model.A2AValidationException;
import io.a2a.protocol.model.AgentCard;
import io.a2a.protocol.model.StreamingEventKind;
import io.a2a.protocol.model.Task;
import io.a2a.protocol.model.TaskIdParams;
import io.a2a.protocol.model.TaskPushNotificationConfig;
import io.a2a.protocol.model.TaskSendParams;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link A2AClient} speaking JSON-RPC 2.0 over a {@link ClientTransport}.
 * <pre>{@code
 * A2AClient client = JSONRPCClient.builder()
 *     .transport(httpTransport)
 *     .build();
 * Task task = client.sendTask(new TaskSendParams("t-1", Message.text(Message.Role.USER, "hi")));
 * }</pre>
 * Each request gets a fresh id, random unless an id generator is configured. An error answered by the agent is
 * raised as an {@link A2AClientException} whose cause is the matching {@link A2AError}.
 */
public class JSONRPCClient implements A2AClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCClient.class);

    private final ClientTransport transport;
    private final Supplier<Object> idGenerator;
    private volatile @Nullable AgentCard agentCard;

    private JSONRPCClient(ClientTransport transport, Supplier<Object> idGenerator, @Nullable AgentCard agentCard) {
        this.transport = transport;
        this.idGenerator = idGenerator;
        this.agentCard = agentCard;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public AgentCard getAgentCard() throws A2AClientException {
        AgentCard card = agentCard;
        if (card == null) {
            try {
                card = JsonUtil.fromJson(transport.fetchAgentCard(), AgentCard.class);
            } catch (IOException e) {
                throw new A2AClientException("Failed to fetch agent card: " + e, e);
            } catch (JsonProcessingException | A2AValidationException e) {
                throw new A2AClientException("Failed to read agent card: " + e.getMessage(), e);
            }
            agentCard = card;
        }
        return card;
    }

    @Override
    public Task sendTask(TaskSendParams params) throws A2AClientException {
        checkNotNullParam("params", params);
        return call(A2AMethods.SEND_TASK_METHOD, params, Task.class);
    }

    @Override
    public void sendTaskStreaming(TaskSendParams params, Consumer<StreamingEventKind> eventConsumer,
                                  Consumer<Throwable> errorConsumer) throws A2AClientException {
        checkNotNullParam("params", params);
        stream(A2AMethods.SEND_TASK_SUBSCRIBE_METHOD, params, eventConsumer, errorConsumer);
    }

    @Override
    public Task getTask(TaskIdParams params) throws A2AClientException {
        checkNotNullParam("params", params);
        return call(A2AMethods.GET_TASK_METHOD, params, Task.class);
    }

    public Task getTask(String taskId) throws A2AClientException {
        return getTask(new TaskIdParams(taskId));
    }

    @Override
    public Task cancelTask(TaskIdParams params) throws A2AClientException {
        checkNotNullParam("params", params);
        return call(A2AMethods.CANCEL_TASK_METHOD, params, Task.class);
    }

    public Task cancelTask(String taskId) throws A2AClientException {
        return cancelTask(new TaskIdParams(taskId));
    }

    @Override
    public TaskPushNotificationConfig setTaskPushNotificationConfig(TaskPushNotificationConfig config)
            throws A2AClientException {
        checkNotNullParam("config", config);
        return call(A2AMethods.SET_TASK_PUSH_NOTIFICATION_CONFIG_METHOD, config, TaskPushNotificationConfig.class);
    }

    @Override
    public TaskPushNotificationConfig getTaskPushNotificationConfig(TaskIdParams params) throws A2AClientException {
        checkNotNullParam("params", params);
        return call(A2AMethods.GET_TASK_PUSH_NOTIFICATION_CONFIG_METHOD, params, TaskPushNotificationConfig.class);
    }

    @Override
    public void resubscribe(TaskIdParams params, Consumer<StreamingEventKind> eventConsumer,
                            Consumer<Throwable> errorConsumer) throws A2AClientException {
        checkNotNullParam("params", params);
        stream(A2AMethods.RESUBSCRIBE_METHOD, params, eventConsumer, errorConsumer);
    }

    private <T> T call(String method, Object params, Class<T> resultType) throws A2AClientException {
        JSONRPCRequest request = new JSONRPCRequest(method, params, idGenerator.get());
        String responseBody;
        try {
            responseBody = transport.send(toJson(request));
        } catch (IOException e) {
            throw new A2AClientException("Failed to send " + method + " request: " + e, e);
        }
        JSONRPCResponse response = unmarshalResponse(method, responseBody);
        if (!sameId(request.id(), response.id())) {
            throw new A2AClientException("Response id " + response.id() + " does not match request id "
                    + request.id());
        }
        T result = result(method, response, resultType);
        if (result == null) {
            throw new A2AClientException("Response to " + method + " carries no result");
        }
        return result;
    }

    private void stream(String method, Object params, Consumer<StreamingEventKind> eventConsumer,
                        Consumer<Throwable> errorConsumer) throws A2AClientException {
        checkNotNullParam("eventConsumer", eventConsumer);
        checkNotNullParam("errorConsumer", errorConsumer);
        JSONRPCRequest request = new JSONRPCRequest(method, params, idGenerator.get());
        try {
            transport.sendStreaming(toJson(request), message -> {
                try {
                    StreamingEventKind event = result(method, unmarshalResponse(method, message),
                            StreamingEventKind.class);
                    if (event != null) {
                        eventConsumer.accept(event);
                    }
                } catch (A2AClientException e) {
                    errorConsumer.accept(e);
                }
            }, errorConsumer);
        } catch (IOException e) {
            throw new A2AClientException("Failed to send " + method + " request: " + e, e);
        }
    }

    private String toJson(JSONRPCRequest request) throws A2AClientException {
        try {
            String body = JsonUtil.toJson(request);
            LOGGER.debug("Sending {} request {}", request.method(), request.id());
            return body;
        } catch (JsonProcessingException e) {
            throw new A2AClientException("Failed to prepare " + request.method() + " request: " + e.getMessage(), e);
        }
    }

    private static JSONRPCResponse unmarshalResponse(String method, String body) throws A2AClientException {
        JSONRPCResponse response;
        try {
            response = JsonUtil.parseResponse(body);
        } catch (A2AError | A2AValidationException e) {
            throw new A2AClientException("Failed to read " + method + " response: " + e.getMessage(), e);
        }
        JSONRPCError error = response.error();
        if (error != null) {
            throw new A2AClientException(error.message() + (error.data() != null ? ": " + error.data() : ""),
                    error.toException());
        }
        return response;
    }

    private static <T> @Nullable T result(String method, JSONRPCResponse response, Class<T> resultType)
            throws A2AClientException {
        try {
            return response.getResult(resultType);
        } catch (A2AValidationException e) {
            throw new A2AClientException("Failed to read " + method + " result: " + e.getMessage(), e);
        }
    }

    public static class Builder {

        private @Nullable ClientTransport transport;
        private Supplier<Object> idGenerator = () -> UUID.randomUUID().toString();
        private @Nullable AgentCard agentCard;

        private Builder() {
        }

        public Builder transport(ClientTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * @param idGenerator supplies the id of each request, a string or a number
         * @return this builder
         */
        public Builder idGenerator(Supplier<Object> idGenerator) {
            this.idGenerator = checkNotNullParam("idGenerator", idGenerator);
            return this;
        }

        /**
         * @param agentCard a card already known, so that {@link JSONRPCClient#getAgentCard()} does not fetch it
         * @return this builder
         */
        public Builder agentCard(@Nullable AgentCard agentCard) {
            this.agentCard = agentCard;
            return this;
        }

        public JSONRPCClient build() {
            return new JSONRPCClient(checkNotNullParam("transport", transport), idGenerator, agentCard);
        }
    }

    /**
     * Ids match when they are of the same JSON type and value: {@code 1} and {@code "1"} are different ids,
     * while numbers compare by value whatever their Java type.
     */
    static boolean sameId(@Nullable Object requestId, @Nullable Object responseId) {
        if (requestId == null || responseId == null) {
            return requestId == responseId;
        }
        JsonNode expected = Utils.OBJECT_MAPPER.valueToTree(requestId);
        JsonNode actual = Utils.OBJECT_MAPPER.valueToTree(responseId);
        if (expected.isNumber() && actual.isNumber()) {
            return expected.decimalValue().compareTo(actual.decimalValue()) == 0;
        }
        return expected.getNodeType() == actual.getNodeType() && expected.equals(actual);
    }
}
