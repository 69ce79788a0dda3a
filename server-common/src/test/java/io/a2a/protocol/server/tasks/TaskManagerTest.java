package io.a2a.protocol.server.tasks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import io.a2a.protocol.model.Artifact;
import io.a2a.protocol.model.InvalidParamsError;
import io.a2a.protocol.model.Message;
import io.a2a.protocol.model.Task;
import io.a2a.protocol.model.TaskNotCancelableError;
import io.a2a.protocol.model.TaskNotFoundError;
import io.a2a.protocol.model.TaskSendParams;
import io.a2a.protocol.model.TaskState;
import io.a2a.protocol.model.TextPart;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TaskManagerTest {

    private static final String TASK_ID = "task-123";
    private static final String SESSION_ID = "session-xyz";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-15T10:30:00Z"), ZoneOffset.UTC);

    private InMemoryTaskStore taskStore;
    private TaskManager taskManager;

    @BeforeEach
    public void setUp() {
        taskStore = new InMemoryTaskStore();
        taskManager = new TaskManager(taskStore, CLOCK);
    }

    @Test
    public void testSubmitCreatesSubmittedTask() {
        Message message = Message.text(Message.Role.USER, "hi");

        Task task = taskManager.submit(TaskSendParams.builder()
                .taskId(TASK_ID)
                .sessionId(SESSION_ID)
                .message(message)
                .build());

        assertEquals(TASK_ID, task.id());
        assertEquals(SESSION_ID, task.sessionId());
        assertEquals(TaskState.SUBMITTED, task.state());
        assertEquals(message, task.status().message());
        assertEquals("2025-01-15T10:30:00Z", task.status().timestamp());
        assertEquals(task, taskStore.get(TASK_ID));
    }

    @Test
    public void testSubmitResumesTaskWaitingForInput() {
        submit();
        taskManager.transition(TASK_ID, TaskState.WORKING, null);
        taskManager.transition(TASK_ID, TaskState.INPUT_REQUIRED, Message.text(Message.Role.AGENT, "which city?"));

        Task resumed = taskManager.submit(new TaskSendParams(TASK_ID, Message.text(Message.Role.USER, "Paris")));

        assertEquals(TaskState.WORKING, resumed.state());
        assertEquals(Message.text(Message.Role.USER, "Paris"), resumed.status().message());
    }

    @Test
    public void testSubmitRefusesRunningAndFinishedTasks() {
        submit();
        assertThrows(InvalidParamsError.class, this::submit);

        taskManager.transition(TASK_ID, TaskState.WORKING, null);
        taskManager.transition(TASK_ID, TaskState.COMPLETED, null);
        assertThrows(InvalidParamsError.class, this::submit);
    }

    @Test
    public void testLegalTransitions() {
        assertTrue(TaskManager.isLegalTransition(TaskState.SUBMITTED, TaskState.WORKING));
        assertTrue(TaskManager.isLegalTransition(TaskState.WORKING, TaskState.INPUT_REQUIRED));
        assertTrue(TaskManager.isLegalTransition(TaskState.INPUT_REQUIRED, TaskState.WORKING));
        assertTrue(TaskManager.isLegalTransition(TaskState.WORKING, TaskState.COMPLETED));
        assertTrue(TaskManager.isLegalTransition(TaskState.SUBMITTED, TaskState.CANCELED));
        assertFalse(TaskManager.isLegalTransition(TaskState.SUBMITTED, TaskState.COMPLETED));
        assertFalse(TaskManager.isLegalTransition(TaskState.INPUT_REQUIRED, TaskState.COMPLETED));
        for (TaskState to : TaskState.values()) {
            assertFalse(TaskManager.isLegalTransition(TaskState.COMPLETED, to));
            assertFalse(TaskManager.isLegalTransition(TaskState.CANCELED, to));
            assertFalse(TaskManager.isLegalTransition(TaskState.FAILED, to));
        }
    }

    @Test
    public void testIllegalTransitionKeepsStoredTask() {
        Task submitted = submit();

        InvalidTaskTransitionException e = assertThrows(InvalidTaskTransitionException.class,
                () -> taskManager.transition(TASK_ID, TaskState.COMPLETED, null));

        assertEquals(TaskState.SUBMITTED, e.getFrom());
        assertEquals(TaskState.COMPLETED, e.getTo());
        assertEquals(submitted, taskStore.get(TASK_ID));
    }

    @Test
    public void testTransitionOfUnknownTask() {
        assertThrows(TaskNotFoundError.class, () -> taskManager.transition("missing", TaskState.WORKING, null));
    }

    @Test
    public void testAddArtifactAppendsByIndex() {
        submit();
        taskManager.addArtifact(TASK_ID, Artifact.builder().parts(new TextPart("Hello")).index(0).build());
        taskManager.addArtifact(TASK_ID, Artifact.builder().parts(new TextPart(" world"))
                .index(0).append(true).lastChunk(true).build());
        Task task = taskManager.addArtifact(TASK_ID, Artifact.builder().parts(new TextPart("other")).index(1).build());

        assertEquals(2, task.artifacts().size());
        Artifact first = task.artifacts().get(0);
        assertEquals(List.of(new TextPart("Hello"), new TextPart(" world")), first.parts());
        assertEquals(Boolean.TRUE, first.lastChunk());
        assertEquals(1, task.artifacts().get(1).index());
    }

    @Test
    public void testAddArtifactReplacesSameIndexWithoutAppend() {
        submit();
        taskManager.addArtifact(TASK_ID, Artifact.builder().parts(new TextPart("draft")).build());
        Task task = taskManager.addArtifact(TASK_ID, Artifact.builder().parts(new TextPart("final")).build());

        assertEquals(1, task.artifacts().size());
        assertEquals(List.of(new TextPart("final")), task.artifacts().get(0).parts());
    }

    @Test
    public void testFinishedTaskAcceptsNoArtifact() {
        submit();
        taskManager.cancel(TASK_ID);

        assertThrows(InvalidTaskTransitionException.class,
                () -> taskManager.addArtifact(TASK_ID, Artifact.builder().parts(new TextPart("late")).build()));
    }

    @Test
    public void testCancel() {
        submit();

        Task canceled = taskManager.cancel(TASK_ID);

        assertEquals(TaskState.CANCELED, canceled.state());
        assertNull(canceled.status().message());
        TaskNotCancelableError e = assertThrows(TaskNotCancelableError.class, () -> taskManager.cancel(TASK_ID));
        assertEquals("Task cannot be canceled", e.getMessage());
    }

    @Test
    public void testCancelUnknownTask() {
        TaskNotFoundError e = assertThrows(TaskNotFoundError.class, () -> taskManager.cancel("missing"));

        assertEquals("Task not found", e.getMessage());
        assertNull(taskManager.getTask("missing"));
        assertThrows(TaskNotFoundError.class, () -> taskManager.requireTask("missing"));
    }

    private Task submit() {
        return taskManager.submit(new TaskSendParams(TASK_ID, Message.text(Message.Role.USER, "hi")));
    }
}
