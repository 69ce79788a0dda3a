package io.a2a.protocol.server.requesthandlers;

import static io.a2a.protocol.server.util.async.AsyncUtils.createTubeConfig;
import static io.a2a.protocol.util.Assert.checkNotNullParam;

import java.util.concurrent.Flow;

import io.a2a.protocol.model.A2AError;
import io.a2a.protocol.model.AgentCard;
import io.a2a.protocol.model.InvalidParamsError;
import io.a2a.protocol.model.Message;
import io.a2a.protocol.model.PushNotificationConfig;
import io.a2a.protocol.model.PushNotificationNotSupportedError;
import io.a2a.protocol.model.StreamingEventKind;
import io.a2a.protocol.model.Task;
import io.a2a.protocol.model.TaskIdParams;
import io.a2a.protocol.model.TaskPushNotificationConfig;
import io.a2a.protocol.model.TaskSendParams;
import io.a2a.protocol.model.TaskStatusUpdateEvent;
import io.a2a.protocol.server.agentexecution.AgentExecutor;
import io.a2a.protocol.server.agentexecution.RequestContext;
import io.a2a.protocol.server.tasks.PushNotificationConfigStore;
import io.a2a.protocol.server.tasks.TaskManager;
import io.a2a.protocol.server.tasks.TaskUpdater;
import mutiny.zero.ZeroPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RequestHandler} running an {@link AgentExecutor} over tasks kept by a {@link TaskManager}.
 * <p>
 * The executor runs on the calling thread: for {@code tasks/send} before the call returns, for
 * {@code tasks/sendSubscribe} when the returned publisher is subscribed to. The task is accepted (stored as
 * submitted, or resumed) before the executor runs, so that invalid sends are refused synchronously. When the
 * executor fails the task, unless already finished, is moved to failed. A protocol error is then rethrown to
 * the caller; any other failure is logged and the failed task is returned.
 * <p>
 * The push notification methods are refused with {@link PushNotificationNotSupportedError} unless the served
 * {@link AgentCard} advertises the capability.
 */
public class DefaultRequestHandler implements RequestHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRequestHandler.class);

    private final AgentCard agentCard;
    private final AgentExecutor agentExecutor;
    private final TaskManager taskManager;
    private final PushNotificationConfigStore pushConfigStore;

    public DefaultRequestHandler(AgentCard agentCard, AgentExecutor agentExecutor, TaskManager taskManager,
                                 PushNotificationConfigStore pushConfigStore) {
        this.agentCard = checkNotNullParam("agentCard", agentCard);
        this.agentExecutor = checkNotNullParam("agentExecutor", agentExecutor);
        this.taskManager = checkNotNullParam("taskManager", taskManager);
        this.pushConfigStore = checkNotNullParam("pushConfigStore", pushConfigStore);
    }

    @Override
    public Task onSendTask(TaskSendParams params) throws A2AError {
        Task accepted = taskManager.submit(params);
        TaskUpdater updater = new TaskUpdater(taskManager, accepted.id());
        runExecutor(RequestContext.forSend(params, accepted), updater);
        return taskManager.requireTask(accepted.id());
    }

    @Override
    public Flow.Publisher<StreamingEventKind> onSendTaskSubscribe(TaskSendParams params) throws A2AError {
        Task accepted = taskManager.submit(params);
        RequestContext context = RequestContext.forSend(params, accepted);
        return ZeroPublisher.create(createTubeConfig(), tube -> {
            tube.send(new TaskStatusUpdateEvent(accepted.id(), accepted.status(), false));
            TaskUpdater updater = new TaskUpdater(taskManager, accepted.id(), tube::send);
            try {
                runExecutor(context, updater);
                tube.complete();
            } catch (A2AError e) {
                tube.fail(e);
            }
        });
    }

    @Override
    public Task onGetTask(TaskIdParams params) throws A2AError {
        return taskManager.requireTask(params.taskId());
    }

    @Override
    public Task onCancelTask(TaskIdParams params) throws A2AError {
        Task canceled = taskManager.cancel(params.taskId());
        agentExecutor.cancel(RequestContext.forCancel(params, canceled));
        return taskManager.requireTask(params.taskId());
    }

    @Override
    public TaskPushNotificationConfig onSetTaskPushNotificationConfig(TaskPushNotificationConfig params)
            throws A2AError {
        checkPushNotificationsSupported();
        taskManager.requireTask(params.taskId());
        pushConfigStore.setInfo(params.taskId(), params.pushNotificationConfig());
        LOGGER.debug("Push notification config set for task {}", params.taskId());
        return params;
    }

    @Override
    public TaskPushNotificationConfig onGetTaskPushNotificationConfig(TaskIdParams params) throws A2AError {
        checkPushNotificationsSupported();
        taskManager.requireTask(params.taskId());
        PushNotificationConfig config = pushConfigStore.getInfo(params.taskId());
        if (config == null) {
            throw new InvalidParamsError("No push notification config set for task " + params.taskId());
        }
        return new TaskPushNotificationConfig(params.taskId(), config);
    }

    @Override
    public Flow.Publisher<StreamingEventKind> onResubscribe(TaskIdParams params) throws A2AError {
        Task task = taskManager.requireTask(params.taskId());
        return ZeroPublisher.fromItems(new TaskStatusUpdateEvent(task.id(), task.status(), true));
    }

    private void runExecutor(RequestContext context, TaskUpdater updater) {
        try {
            agentExecutor.execute(context, updater);
        } catch (A2AError e) {
            LOGGER.debug("Agent refused task {}: {}", context.taskId(), e.getMessage());
            failIfUnfinished(updater, e);
            throw e;
        } catch (RuntimeException e) {
            LOGGER.error("Agent execution failed for task {}", context.taskId(), e);
            failIfUnfinished(updater, e);
        }
    }

    private void failIfUnfinished(TaskUpdater updater, RuntimeException failure) {
        Task current = updater.getTask();
        if (current.state().isTerminal()) {
            return;
        }
        String reason = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
        updater.fail(Message.text(Message.Role.AGENT, reason));
    }

    private void checkPushNotificationsSupported() {
        if (!agentCard.capabilities().pushNotifications()) {
            throw new PushNotificationNotSupportedError();
        }
    }
}
