package io.a2a.protocol.server.agentexecution;

import java.util.Map;

import io.a2a.protocol.model.Message;
import io.a2a.protocol.model.Task;
import io.a2a.protocol.model.TaskIdParams;
import io.a2a.protocol.model.TaskSendParams;
import io.a2a.protocol.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * What an {@link AgentExecutor} is asked to act on.
 *
 * @param taskId the task id
 * @param sessionId the session of the task, if any
 * @param message the message received, {@code null} for a cancellation
 * @param task the snapshot of the task when the request was accepted
 * @param metadata the request metadata, if any
 */
public record RequestContext(String taskId,
                             @Nullable String sessionId,
                             @Nullable Message message,
                             Task task,
                             @Nullable Map<String, Object> metadata) {

    public RequestContext {
        Assert.checkNotNullParam("taskId", taskId);
        Assert.checkNotNullParam("task", task);
    }

    public static RequestContext forSend(TaskSendParams params, Task task) {
        return new RequestContext(params.taskId(), task.sessionId(), params.message(), task, params.metadata());
    }

    public static RequestContext forCancel(TaskIdParams params, Task task) {
        return new RequestContext(params.taskId(), task.sessionId(), null, task, params.metadata());
    }
}
