package io.a2a.protocol.server.tasks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import io.a2a.protocol.model.Message;
import io.a2a.protocol.model.StreamingEventKind;
import io.a2a.protocol.model.TaskArtifactUpdateEvent;
import io.a2a.protocol.model.TaskSendParams;
import io.a2a.protocol.model.TaskState;
import io.a2a.protocol.model.TaskStatusUpdateEvent;
import io.a2a.protocol.model.TextPart;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TaskUpdaterTest {

    private static final String TASK_ID = "task-123";

    private final List<StreamingEventKind> events = new ArrayList<>();
    private TaskManager taskManager;
    private TaskUpdater taskUpdater;

    @BeforeEach
    public void setUp() {
        taskManager = new TaskManager(new InMemoryTaskStore());
        taskManager.submit(new TaskSendParams(TASK_ID, Message.text(Message.Role.USER, "hi")));
        taskUpdater = new TaskUpdater(taskManager, TASK_ID, events::add);
    }

    @Test
    public void testStatusEvents() {
        taskUpdater.startWork();
        taskUpdater.complete(taskUpdater.newAgentMessage("done"));

        assertEquals(2, events.size());
        TaskStatusUpdateEvent working = assertInstanceOf(TaskStatusUpdateEvent.class, events.get(0));
        TaskStatusUpdateEvent completed = assertInstanceOf(TaskStatusUpdateEvent.class, events.get(1));
        assertEquals(TaskState.WORKING, working.status().state());
        assertFalse(working.isFinal());
        assertEquals(TaskState.COMPLETED, completed.status().state());
        assertTrue(completed.isFinal());
        assertEquals(TaskState.COMPLETED, taskUpdater.getTask().state());
    }

    @Test
    public void testInputRequiredEndsTheStream() {
        taskUpdater.startWork();
        taskUpdater.requireInput(Message.text(Message.Role.AGENT, "which city?"));

        TaskStatusUpdateEvent last = (TaskStatusUpdateEvent) events.get(events.size() - 1);
        assertEquals(TaskState.INPUT_REQUIRED, last.status().state());
        assertTrue(last.isFinal());
    }

    @Test
    public void testArtifactEvent() {
        taskUpdater.startWork();
        taskUpdater.addArtifact(List.of(new TextPart("result")));

        TaskArtifactUpdateEvent event = assertInstanceOf(TaskArtifactUpdateEvent.class, events.get(1));
        assertEquals(TASK_ID, event.id());
        assertEquals(List.of(new TextPart("result")), event.artifact().parts());
        assertEquals(1, taskUpdater.getTask().artifacts().size());
    }

    @Test
    public void testIllegalTransitionEmitsNothing() {
        assertThrows(InvalidTaskTransitionException.class, () -> taskUpdater.complete());

        assertTrue(events.isEmpty());
    }
}
