package io.a2a.protocol.jsonrpc.common.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import io.a2a.protocol.jsonrpc.common.wrappers.JSONRPCRequest;
import io.a2a.protocol.jsonrpc.common.wrappers.JSONRPCResponse;
import io.a2a.protocol.model.A2AValidationException;
import io.a2a.protocol.model.InvalidRequestError;
import io.a2a.protocol.model.JSONParseError;
import io.a2a.protocol.model.Message;
import io.a2a.protocol.model.Task;
import io.a2a.protocol.model.TaskNotFoundError;
import io.a2a.protocol.model.TaskSendParams;
import io.a2a.protocol.model.TaskState;
import io.a2a.protocol.model.TaskStatus;
import io.a2a.protocol.model.TextPart;
import io.a2a.protocol.util.Utils;
import org.junit.jupiter.api.Test;

public class JsonUtilTest {

    @Test
    void testParseCanonicalRequest() {
        String json = """
            {"jsonrpc":"2.0","id":1,"method":"tasks/send",
             "params":{"taskId":"t-1","sessionId":"s-1",
                       "message":{"role":"user","parts":[{"type":"text","text":"hi"}]}}}
            """;

        JSONRPCRequest request = JsonUtil.parseRequest(json);

        assertEquals("tasks/send", request.method());
        assertEquals(1, request.id());
        TaskSendParams params = request.getParams(TaskSendParams.class);
        assertEquals("t-1", params.taskId());
        assertEquals("s-1", params.sessionId());
        assertEquals(Message.Role.USER, params.message().role());
        assertEquals(List.of(new TextPart("hi")), params.message().parts());
    }

    @Test
    void testCanonicalSuccessResponse() throws Exception {
        Task task = Task.builder()
                .id("t-1")
                .status(new TaskStatus(TaskState.SUBMITTED, null, "2025-01-15T10:30:00Z"))
                .build();

        String json = JsonUtil.toJson(JSONRPCResponse.success(1, task));

        assertEquals(Utils.OBJECT_MAPPER.readTree("""
            {"jsonrpc":"2.0","id":1,"result":{"id":"t-1","status":{"state":"submitted","timestamp":"2025-01-15T10:30:00Z"}}}
            """), Utils.OBJECT_MAPPER.readTree(json));
    }

    @Test
    void testCanonicalErrorResponse() throws Exception {
        String json = JsonUtil.toJson(JSONRPCResponse.error(1, new TaskNotFoundError()));

        assertEquals(Utils.OBJECT_MAPPER.readTree("""
            {"jsonrpc":"2.0","id":1,"error":{"code":-32001,"message":"Task not found"}}
            """), Utils.OBJECT_MAPPER.readTree(json));
    }

    @Test
    void testMalformedJsonIsAParseError() {
        assertThrows(JSONParseError.class, () -> JsonUtil.parseRequest("{\"jsonrpc\": \"2.0\", "));
        assertThrows(JSONParseError.class, () -> JsonUtil.parseRequest(""));
    }

    @Test
    void testNonRequestsAreInvalidRequests() {
        assertThrows(InvalidRequestError.class, () -> JsonUtil.parseRequest("[1, 2]"));
        assertThrows(InvalidRequestError.class, () -> JsonUtil.parseRequest("""
            {"id": 1, "method": "tasks/get"}
            """));
        assertThrows(InvalidRequestError.class, () -> JsonUtil.parseRequest("""
            {"jsonrpc": "1.0", "id": 1, "method": "tasks/get"}
            """));
        assertThrows(InvalidRequestError.class, () -> JsonUtil.parseRequest("""
            {"jsonrpc": "2.0", "id": 1, "method": 42}
            """));
        assertThrows(InvalidRequestError.class, () -> JsonUtil.parseRequest("""
            {"jsonrpc": "2.0", "id": true, "method": "tasks/get"}
            """));
    }

    @Test
    void testRequestId() {
        assertEquals("abc", JsonUtil.requestId(JsonUtil.readTree("{\"id\": \"abc\"}")));
        assertEquals(7, JsonUtil.requestId(JsonUtil.readTree("{\"id\": 7}")));
        assertNull(JsonUtil.requestId(JsonUtil.readTree("{\"id\": {}}")));
        assertNull(JsonUtil.requestId(JsonUtil.readTree("{}")));
    }

    @Test
    void testParseResponse() {
        JSONRPCResponse response = JsonUtil.parseResponse("""
            {"jsonrpc":"2.0","id":"r-1","result":{"id":"t-1","status":{"state":"working"}}}
            """);

        assertTrue(response.isSuccess());
        assertEquals(TaskState.WORKING, response.getResult(Task.class).state());
    }

    @Test
    void testParseResponseRejectsErrorWithoutCode() {
        A2AValidationException e = assertThrows(A2AValidationException.class, () -> JsonUtil.parseResponse("""
            {"jsonrpc":"2.0","id":1,"error":{"message":"boom"}}
            """));

        assertEquals("Parameter 'code' may not be null", e.getMessage());
    }

    @Test
    void testFromJsonRethrowsValidationFailures() {
        A2AValidationException e = assertThrows(A2AValidationException.class, () -> JsonUtil.fromJson("""
            {"role": "system", "parts": [{"type": "text", "text": "x"}]}
            """, Message.class));

        assertTrue(e.getMessage().startsWith("Invalid role: system"));
        assertThrows(JsonProcessingException.class, () -> JsonUtil.fromJson("{\"role\":", Message.class));
    }
}
