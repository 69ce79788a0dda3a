package io.a2a.protocol.transport.jsonrpc.handler;

import static io.a2a.protocol.jsonrpc.common.wrappers.A2AMethods.CANCEL_TASK_METHOD;
import static io.a2a.protocol.jsonrpc.common.wrappers.A2AMethods.GET_TASK_METHOD;
import static io.a2a.protocol.jsonrpc.common.wrappers.A2AMethods.GET_TASK_PUSH_NOTIFICATION_CONFIG_METHOD;
import static io.a2a.protocol.jsonrpc.common.wrappers.A2AMethods.RESUBSCRIBE_METHOD;
import static io.a2a.protocol.jsonrpc.common.wrappers.A2AMethods.SEND_TASK_METHOD;
import static io.a2a.protocol.jsonrpc.common.wrappers.A2AMethods.SEND_TASK_SUBSCRIBE_METHOD;
import static io.a2a.protocol.jsonrpc.common.wrappers.A2AMethods.SET_TASK_PUSH_NOTIFICATION_CONFIG_METHOD;
import static io.a2a.protocol.server.util.async.AsyncUtils.createTubeConfig;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;

import com.fasterxml.jackson.databind.JsonNode;
import io.a2a.protocol.jsonrpc.common.json.JsonUtil;
import io.a2a.protocol.jsonrpc.common.wrappers.A2AMethods;
import io.a2a.protocol.jsonrpc.common.wrappers.JSONRPCRequest;
import io.a2a.protocol.jsonrpc.common.wrappers.JSONRPCResponse;
import io.a2a.protocol.model.A2AError;
import io.a2a.protocol.model.A2AValidationException;
import io.a2a.protocol.model.AgentCard;
import io.a2a.protocol.model.InvalidParamsError;
import io.a2a.protocol.model.InvalidRequestError;
import io.a2a.protocol.model.MethodNotFoundError;
import io.a2a.protocol.model.PushNotificationNotSupportedError;
import io.a2a.protocol.model.StreamingEventKind;
import io.a2a.protocol.model.TaskIdParams;
import io.a2a.protocol.model.TaskPushNotificationConfig;
import io.a2a.protocol.model.TaskSendParams;
import io.a2a.protocol.model.UnsupportedOperationError;
import io.a2a.protocol.server.requesthandlers.RequestHandler;
import io.a2a.protocol.util.Assert;
import mutiny.zero.ZeroPublisher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC 2.0 dispatcher of the protocol methods onto a {@link RequestHandler}.
 *
 * <p>Requests follow the JSON-RPC 2.0 specification:
 * <pre>{@code
 * {
 *   "jsonrpc": "2.0",
 *   "id": 1,
 *   "method": "tasks/send",
 *   "params": {
 *     "taskId": "t-1",
 *     "message": {"role": "user", "parts": [{"type": "text", "text": "hi"}]}
 *   }
 * }
 * }</pre>
 *
 * <h2>Error Handling</h2>
 * <p>Every failure is answered as an error response, never thrown:
 * <ul>
 *   <li>malformed JSON: {@code -32700}; a body that is not a JSON-RPC request: {@code -32600}</li>
 *   <li>unknown method: {@code -32601}; parameters that do not validate: {@code -32602}</li>
 *   <li>protocol errors raised by the request handler keep their own code</li>
 *   <li>anything else: {@code -32603} with only the exception message</li>
 * </ul>
 *
 * <h2>Streaming</h2>
 * <p>{@code tasks/sendSubscribe} and {@code tasks/resubscribe} are served by
 * {@link #handleStreaming(JSONRPCRequest)} as a {@link Flow.Publisher} of responses, one per streamed event,
 * delivered on the supplied {@link Executor}. They are refused with {@link UnsupportedOperationError} unless the
 * agent card advertises streaming. The push notification methods are likewise refused with
 * {@link PushNotificationNotSupportedError} unless it advertises push notifications.
 *
 * <p>Notifications (requests without an id) are executed; {@link #handle(JSONRPCRequest)} answers them with
 * {@code null}.
 *
 * @see RequestHandler
 * @see io.a2a.protocol.server.requesthandlers.DefaultRequestHandler
 */
public class JSONRPCHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCHandler.class);

    private final AgentCard agentCard;
    private final RequestHandler requestHandler;
    private final Executor executor;

    /**
     * @param agentCard the card of the served agent, whose capabilities gate the optional methods
     * @param requestHandler the handler serving the methods
     * @param executor the executor delivering streamed responses
     */
    public JSONRPCHandler(AgentCard agentCard, RequestHandler requestHandler, Executor executor) {
        this.agentCard = Assert.checkNotNullParam("agentCard", agentCard);
        this.requestHandler = Assert.checkNotNullParam("requestHandler", requestHandler);
        this.executor = Assert.checkNotNullParam("executor", executor);
    }

    /**
     * Parses and serves the body of a unary request.
     *
     * @param body the JSON request body
     * @return the response, or {@code null} for a notification
     */
    public @Nullable JSONRPCResponse handle(String body) {
        Object id = null;
        JSONRPCRequest request;
        try {
            JsonNode node = JsonUtil.readTree(body);
            id = JsonUtil.requestId(node);
            request = JsonUtil.parseRequest(node);
        } catch (A2AError e) {
            LOGGER.debug("Rejecting request body: {}", e.getMessage());
            return JSONRPCResponse.error(id, e);
        }
        return handle(request);
    }

    /**
     * Serves a unary request.
     *
     * @param request the request
     * @return the response, or {@code null} for a notification
     */
    public @Nullable JSONRPCResponse handle(JSONRPCRequest request) {
        JSONRPCResponse response = dispatch(request);
        if (request.isNotification()) {
            if (!response.isSuccess()) {
                LOGGER.debug("Notification {} failed: {}", request.method(), response.error());
            }
            return null;
        }
        return response;
    }

    /**
     * Serves a streaming request.
     *
     * @param request a {@code tasks/sendSubscribe} or {@code tasks/resubscribe} request
     * @return the responses, one per streamed event; a failure is delivered as a final error response
     */
    public Flow.Publisher<JSONRPCResponse> handleStreaming(JSONRPCRequest request) {
        Object id = request.id();
        if (!agentCard.capabilities().streaming()) {
            return ZeroPublisher.fromItems(
                    JSONRPCResponse.error(id, new UnsupportedOperationError("Streaming is not supported by the agent")));
        }
        try {
            Flow.Publisher<StreamingEventKind> publisher = switch (request.method()) {
                case SEND_TASK_SUBSCRIBE_METHOD ->
                        requestHandler.onSendTaskSubscribe(params(request, TaskSendParams.class));
                case RESUBSCRIBE_METHOD -> requestHandler.onResubscribe(params(request, TaskIdParams.class));
                default -> throw unsupportedMethod(request.method(), true);
            };
            return convertToStreamingResponse(id, publisher);
        } catch (A2AError e) {
            return ZeroPublisher.fromItems(JSONRPCResponse.error(id, e));
        } catch (Throwable t) {
            LOGGER.error("Failed to serve {}", request.method(), t);
            return ZeroPublisher.fromItems(JSONRPCResponse.error(id, t));
        }
    }

    /**
     * @param request the request
     * @return whether the request must be served by {@link #handleStreaming(JSONRPCRequest)}
     */
    public boolean isStreaming(JSONRPCRequest request) {
        return A2AMethods.isStreaming(request.method());
    }

    public AgentCard getAgentCard() {
        return agentCard;
    }

    private JSONRPCResponse dispatch(JSONRPCRequest request) {
        Object id = request.id();
        try {
            Object result = switch (request.method()) {
                case SEND_TASK_METHOD -> requestHandler.onSendTask(params(request, TaskSendParams.class));
                case GET_TASK_METHOD -> requestHandler.onGetTask(params(request, TaskIdParams.class));
                case CANCEL_TASK_METHOD -> requestHandler.onCancelTask(params(request, TaskIdParams.class));
                case SET_TASK_PUSH_NOTIFICATION_CONFIG_METHOD -> {
                    checkPushNotificationsSupported();
                    yield requestHandler.onSetTaskPushNotificationConfig(
                            params(request, TaskPushNotificationConfig.class));
                }
                case GET_TASK_PUSH_NOTIFICATION_CONFIG_METHOD -> {
                    checkPushNotificationsSupported();
                    yield requestHandler.onGetTaskPushNotificationConfig(params(request, TaskIdParams.class));
                }
                default -> throw unsupportedMethod(request.method(), false);
            };
            return JSONRPCResponse.success(id, result);
        } catch (A2AError e) {
            return JSONRPCResponse.error(id, e);
        } catch (Throwable t) {
            LOGGER.error("Failed to serve {}", request.method(), t);
            return JSONRPCResponse.error(id, t);
        }
    }

    private static <T> T params(JSONRPCRequest request, Class<T> type) {
        try {
            return request.getParams(type);
        } catch (A2AValidationException e) {
            throw new InvalidParamsError(e.getMessage());
        }
    }

    private static A2AError unsupportedMethod(String method, boolean streaming) {
        if (!A2AMethods.isKnown(method)) {
            return new MethodNotFoundError(MethodNotFoundError.DEFAULT_MESSAGE + ": " + method);
        }
        return new InvalidRequestError(streaming
                ? "Method " + method + " does not stream its result"
                : "Method " + method + " streams its result and must be served as a stream");
    }

    private void checkPushNotificationsSupported() {
        if (!agentCard.capabilities().pushNotifications()) {
            throw new PushNotificationNotSupportedError();
        }
    }

    private Flow.Publisher<JSONRPCResponse> convertToStreamingResponse(
            @Nullable Object requestId,
            Flow.Publisher<StreamingEventKind> publisher) {
        // Failures are delivered as an error response rather than through Subscriber.onError()
        return ZeroPublisher.create(createTubeConfig(), tube -> {
            CompletableFuture.runAsync(() -> {
                publisher.subscribe(new Flow.Subscriber<StreamingEventKind>() {
                    private Flow.@Nullable Subscription subscription;

                    @Override
                    public void onSubscribe(Flow.Subscription subscription) {
                        this.subscription = subscription;
                        subscription.request(1);
                    }

                    @Override
                    public void onNext(StreamingEventKind item) {
                        tube.send(JSONRPCResponse.success(requestId, item));
                        if (subscription != null) {
                            subscription.request(1);
                        }
                    }

                    @Override
                    public void onError(Throwable throwable) {
                        if (!(throwable instanceof A2AError)) {
                            LOGGER.error("Stream failed", throwable);
                        }
                        tube.send(JSONRPCResponse.error(requestId, throwable));
                        onComplete();
                    }

                    @Override
                    public void onComplete() {
                        tube.complete();
                    }
                });
            }, executor).whenComplete((unused, failure) -> {
                if (failure != null) {
                    Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                            ? failure.getCause()
                            : failure;
                    LOGGER.error("Failed to subscribe to the event stream", cause);
                    tube.send(JSONRPCResponse.error(requestId, cause));
                    tube.complete();
                }
            });
        });
    }
}
