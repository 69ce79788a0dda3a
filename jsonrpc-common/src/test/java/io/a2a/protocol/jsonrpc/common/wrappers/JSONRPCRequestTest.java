package io.a2a.protocol.jsonrpc.common.wrappers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import io.a2a.protocol.model.A2AValidationException;
import io.a2a.protocol.model.TaskIdParams;
import org.junit.jupiter.api.Test;

class JSONRPCRequestTest {

    @Test
    void testRecordParamsAreProjected() {
        JSONRPCRequest request = new JSONRPCRequest(A2AMethods.GET_TASK_METHOD, new TaskIdParams("t-1"), 1);

        assertEquals("2.0", request.jsonrpc());
        assertEquals(Map.of("taskId", "t-1"), request.params());
        assertEquals(new TaskIdParams("t-1"), request.getParams(TaskIdParams.class));
    }

    @Test
    void testProjection() {
        JSONRPCRequest request = new JSONRPCRequest(A2AMethods.CANCEL_TASK_METHOD, Map.of("id", "t-1"), "req-1");

        assertEquals(Map.of(
                "jsonrpc", "2.0",
                "id", "req-1",
                "method", "tasks/cancel",
                "params", Map.of("id", "t-1")), request.toProjection());
        assertEquals(request, JSONRPCRequest.fromProjection(request.toProjection()));
    }

    @Test
    void testNotification() {
        JSONRPCRequest notification = new JSONRPCRequest(A2AMethods.GET_TASK_METHOD, null, null);

        assertTrue(notification.isNotification());
        assertFalse(notification.toProjection().containsKey("id"));
        assertFalse(notification.toProjection().containsKey("params"));
    }

    @Test
    void testArrayParamsAreKept() {
        JSONRPCRequest request = new JSONRPCRequest("custom/method", List.of(1, 2), 3);

        assertEquals(List.of(1, 2), request.params());
        assertThrows(A2AValidationException.class, () -> request.getParams(TaskIdParams.class));
    }

    @Test
    void testInvalidRequests() {
        assertThrows(A2AValidationException.class, () -> new JSONRPCRequest("1.0", "tasks/get", null, 1));
        assertThrows(A2AValidationException.class, () -> new JSONRPCRequest(" ", null, 1));
        assertThrows(A2AValidationException.class, () -> new JSONRPCRequest("tasks/get", "t-1", 1));
        assertThrows(A2AValidationException.class, () -> new JSONRPCRequest("tasks/get", null, List.of(1)));
    }

    @Test
    void testMissingParamsAreAnInvalidParamsCondition() {
        JSONRPCRequest request = new JSONRPCRequest(A2AMethods.GET_TASK_METHOD, null, 1);

        assertNull(request.params());
        A2AValidationException e = assertThrows(A2AValidationException.class,
                () -> request.getParams(TaskIdParams.class));
        assertEquals("Method tasks/get requires an object of parameters", e.getMessage());
    }

    @Test
    void testMethodNames() {
        assertTrue(A2AMethods.isStreaming("tasks/sendSubscribe"));
        assertTrue(A2AMethods.isStreaming("tasks/resubscribe"));
        assertFalse(A2AMethods.isStreaming("tasks/send"));
        assertTrue(A2AMethods.isKnown("tasks/pushNotification/get"));
        assertFalse(A2AMethods.isKnown("tasks/list"));
        assertEquals(7, A2AMethods.ALL_METHODS.size());
    }
}
