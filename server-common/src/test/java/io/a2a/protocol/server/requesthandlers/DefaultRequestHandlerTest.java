package io.a2a.protocol.server.requesthandlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import io.a2a.protocol.model.Artifact;
import io.a2a.protocol.model.InvalidParamsError;
import io.a2a.protocol.model.Message;
import io.a2a.protocol.model.PushNotificationConfig;
import io.a2a.protocol.model.PushNotificationNotSupportedError;
import io.a2a.protocol.model.StreamingEventKind;
import io.a2a.protocol.model.Task;
import io.a2a.protocol.model.TaskArtifactUpdateEvent;
import io.a2a.protocol.model.TaskIdParams;
import io.a2a.protocol.model.TaskNotCancelableError;
import io.a2a.protocol.model.TaskNotFoundError;
import io.a2a.protocol.model.TaskPushNotificationConfig;
import io.a2a.protocol.model.TaskSendParams;
import io.a2a.protocol.model.TaskState;
import io.a2a.protocol.model.TaskStatusUpdateEvent;
import io.a2a.protocol.model.TextPart;
import io.a2a.protocol.server.tasks.PushNotificationConfigStore;
import io.a2a.protocol.server.tasks.TaskManager;
import org.junit.jupiter.api.Test;

public class DefaultRequestHandlerTest extends AbstractA2ARequestHandlerTest {

    private static final String TASK_ID = "task-123";

    @Test
    void testSendTaskRunsTheAgent() {
        agentExecutorExecute = (context, updater) -> {
            assertEquals(TASK_ID, context.taskId());
            assertEquals("session-xyz", context.sessionId());
            assertEquals(TaskState.SUBMITTED, context.task().state());
            updater.startWork();
            updater.addArtifact(List.of(new TextPart("echo: " + ((TextPart) context.message().parts().get(0)).text())));
            updater.complete();
        };

        Task task = requestHandler.onSendTask(TaskSendParams.builder()
                .taskId(TASK_ID)
                .sessionId("session-xyz")
                .message(Message.text(Message.Role.USER, "hi"))
                .build());

        assertEquals(TaskState.COMPLETED, task.state());
        assertEquals(List.of(new TextPart("echo: hi")), task.artifacts().get(0).parts());
        assertEquals(task, taskStore.get(TASK_ID));
    }

    @Test
    void testAgentFailureFailsTheTask() {
        agentExecutorExecute = (context, updater) -> {
            updater.startWork();
            throw new IllegalStateException("model unavailable");
        };

        Task task = requestHandler.onSendTask(sendParams("hi"));

        assertEquals(TaskState.FAILED, task.state());
        assertEquals(new TextPart("model unavailable"), task.status().message().parts().get(0));
    }

    @Test
    void testProtocolErrorFromAgentPropagates() {
        agentExecutorExecute = (context, updater) -> {
            throw new InvalidParamsError("unsupported language");
        };

        InvalidParamsError e = assertThrows(InvalidParamsError.class, () -> requestHandler.onSendTask(sendParams("hi")));

        assertEquals("unsupported language", e.getMessage());
        Task stored = taskStore.get(TASK_ID);
        assertEquals(TaskState.FAILED, stored.state());
        assertEquals(new TextPart("unsupported language"), stored.status().message().parts().get(0));
    }

    @Test
    void testInputRequiredThenResume() {
        agentExecutorExecute = (context, updater) -> {
            updater.startWork();
            if (context.task().state() == TaskState.SUBMITTED) {
                updater.requireInput(updater.newAgentMessage("which city?"));
            } else {
                updater.complete();
            }
        };

        Task waiting = requestHandler.onSendTask(sendParams("weather"));
        assertEquals(TaskState.INPUT_REQUIRED, waiting.state());

        agentExecutorExecute = (context, updater) -> {
            assertEquals(TaskState.WORKING, context.task().state());
            updater.complete();
        };
        Task done = requestHandler.onSendTask(sendParams("Paris"));

        assertEquals(TaskState.COMPLETED, done.state());
    }

    @Test
    void testGetTask() {
        requestHandler.onSendTask(sendParams("hi"));

        assertEquals(TaskState.COMPLETED, requestHandler.onGetTask(new TaskIdParams(TASK_ID)).state());
        assertThrows(TaskNotFoundError.class, () -> requestHandler.onGetTask(new TaskIdParams("missing")));
    }

    @Test
    void testCancelTask() {
        agentExecutorExecute = (context, updater) -> updater.startWork();
        AtomicReference<String> canceled = new AtomicReference<>();
        agentExecutorCancel = (context, updater) -> canceled.set(context.taskId());
        requestHandler.onSendTask(sendParams("hi"));

        Task task = requestHandler.onCancelTask(new TaskIdParams(TASK_ID));

        assertEquals(TaskState.CANCELED, task.state());
        assertEquals(TASK_ID, canceled.get());
        assertThrows(TaskNotCancelableError.class, () -> requestHandler.onCancelTask(new TaskIdParams(TASK_ID)));
        assertThrows(TaskNotFoundError.class, () -> requestHandler.onCancelTask(new TaskIdParams("missing")));
    }

    @Test
    void testSendTaskSubscribeStreamsEvents() throws Exception {
        agentExecutorExecute = (context, updater) -> {
            updater.startWork();
            updater.addArtifact(Artifact.builder().parts(new TextPart("partial")).build());
            updater.complete();
        };
        AtomicReference<Throwable> failure = new AtomicReference<>();

        List<StreamingEventKind> events = collect(requestHandler.onSendTaskSubscribe(sendParams("hi")), failure);

        assertNull(failure.get());
        assertEquals(4, events.size());
        TaskStatusUpdateEvent submitted = assertInstanceOf(TaskStatusUpdateEvent.class, events.get(0));
        assertEquals(TaskState.SUBMITTED, submitted.status().state());
        assertFalse(submitted.isFinal());
        assertEquals(TaskState.WORKING, ((TaskStatusUpdateEvent) events.get(1)).status().state());
        assertInstanceOf(TaskArtifactUpdateEvent.class, events.get(2));
        TaskStatusUpdateEvent completed = assertInstanceOf(TaskStatusUpdateEvent.class, events.get(3));
        assertEquals(TaskState.COMPLETED, completed.status().state());
        assertTrue(completed.isFinal());
    }

    @Test
    void testStreamedProtocolErrorFailsThePublisher() throws Exception {
        agentExecutorExecute = (context, updater) -> {
            throw new InvalidParamsError("bad input");
        };
        AtomicReference<Throwable> failure = new AtomicReference<>();

        List<StreamingEventKind> events = collect(requestHandler.onSendTaskSubscribe(sendParams("hi")), failure);

        assertEquals(2, events.size());
        TaskStatusUpdateEvent failed = assertInstanceOf(TaskStatusUpdateEvent.class, events.get(1));
        assertEquals(TaskState.FAILED, failed.status().state());
        assertTrue(failed.isFinal());
        assertInstanceOf(InvalidParamsError.class, failure.get());
    }

    @Test
    void testSlowSubscriberReceivesEveryEvent() throws Exception {
        int chunks = 300;
        agentExecutorExecute = (context, updater) -> {
            updater.startWork();
            for (int i = 0; i < chunks; i++) {
                updater.addArtifact(List.of(new TextPart("chunk " + i)));
            }
            updater.complete();
        };
        List<StreamingEventKind> events = Collections.synchronizedList(new ArrayList<>());
        AtomicReference<Throwable> failure = new AtomicReference<>();
        AtomicReference<Flow.Subscription> subscription = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        requestHandler.onSendTaskSubscribe(sendParams("hi")).subscribe(new Flow.Subscriber<>() {
            @Override
            public void onSubscribe(Flow.Subscription s) {
                subscription.set(s);
                s.request(1);
            }

            @Override
            public void onNext(StreamingEventKind item) {
                events.add(item);
            }

            @Override
            public void onError(Throwable throwable) {
                failure.set(throwable);
                done.countDown();
            }

            @Override
            public void onComplete() {
                done.countDown();
            }
        });
        subscription.get().request(Long.MAX_VALUE);

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertNull(failure.get());
        assertEquals(chunks + 3, events.size());
        TaskStatusUpdateEvent last = assertInstanceOf(TaskStatusUpdateEvent.class, events.get(events.size() - 1));
        assertEquals(TaskState.COMPLETED, last.status().state());
    }

    @Test
    void testResubscribeEmitsCurrentStatus() throws Exception {
        agentExecutorExecute = (context, updater) -> updater.startWork();
        requestHandler.onSendTask(sendParams("hi"));
        AtomicReference<Throwable> failure = new AtomicReference<>();

        List<StreamingEventKind> events = collect(requestHandler.onResubscribe(new TaskIdParams(TASK_ID)), failure);

        assertEquals(1, events.size());
        TaskStatusUpdateEvent event = (TaskStatusUpdateEvent) events.get(0);
        assertEquals(TaskState.WORKING, event.status().state());
        assertTrue(event.isFinal());
        assertThrows(TaskNotFoundError.class, () -> requestHandler.onResubscribe(new TaskIdParams("missing")));
    }

    @Test
    void testPushNotificationConfig() {
        requestHandler.onSendTask(sendParams("hi"));
        TaskPushNotificationConfig config = new TaskPushNotificationConfig(TASK_ID,
                new PushNotificationConfig("https://hooks.example.com/a2a", "secret", null));

        assertEquals(config, requestHandler.onSetTaskPushNotificationConfig(config));
        assertEquals(config, requestHandler.onGetTaskPushNotificationConfig(new TaskIdParams(TASK_ID)));
    }

    @Test
    void testPushNotificationConfigNotSet() {
        requestHandler.onSendTask(sendParams("hi"));

        assertThrows(InvalidParamsError.class,
                () -> requestHandler.onGetTaskPushNotificationConfig(new TaskIdParams(TASK_ID)));
        assertThrows(TaskNotFoundError.class,
                () -> requestHandler.onGetTaskPushNotificationConfig(new TaskIdParams("missing")));
    }

    @Test
    void testPushNotificationsNotSupported() {
        PushNotificationConfigStore store = mock(PushNotificationConfigStore.class);
        RequestHandler handler = new DefaultRequestHandler(createAgentCard(true, false), executor,
                new TaskManager(taskStore, CLOCK), store);
        handler.onSendTask(sendParams("hi"));

        assertThrows(PushNotificationNotSupportedError.class, () -> handler.onSetTaskPushNotificationConfig(
                new TaskPushNotificationConfig(TASK_ID, new PushNotificationConfig("https://hooks.example.com"))));
        verify(store, never()).setInfo(eq(TASK_ID), any());
    }

    private static TaskSendParams sendParams(String text) {
        return new TaskSendParams(TASK_ID, Message.text(Message.Role.USER, text));
    }
}
