package io.a2a.protocol.jsonrpc.common.json;

import java.util.Map;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import io.a2a.protocol.jsonrpc.common.wrappers.JSONRPCRequest;
import io.a2a.protocol.jsonrpc.common.wrappers.JSONRPCResponse;
import io.a2a.protocol.model.A2AValidationException;
import io.a2a.protocol.model.InvalidRequestError;
import io.a2a.protocol.model.JSONParseError;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Conversions between JSON text and the protocol types, all through {@link Utils#OBJECT_MAPPER}.
 */
public final class JsonUtil {

    private JsonUtil() {
    }

    public static String toJson(Object value) throws JsonProcessingException {
        try {
            return Utils.OBJECT_MAPPER.writeValueAsString(value);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new JsonProcessingException("Failed to write " + value.getClass().getSimpleName() + " as JSON: "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a value from JSON text.
     *
     * @param json the text
     * @param type the type to read
     * @param <T> the type to read
     * @return the value
     * @throws JsonProcessingException if the text is not JSON or does not bind to {@code type}
     * @throws A2AValidationException if the value violates an invariant of {@code type}
     */
    public static <T> T fromJson(String json, Class<T> type) throws JsonProcessingException {
        try {
            return Utils.OBJECT_MAPPER.readValue(json, type);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            A2AValidationException validationException = findValidationException(e);
            if (validationException != null) {
                throw validationException;
            }
            throw new JsonProcessingException("Failed to read " + type.getSimpleName() + " from JSON: "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * @param json the text
     * @return the parsed tree
     * @throws JSONParseError if the text is not well formed JSON
     */
    public static JsonNode readTree(String json) {
        try {
            JsonNode node = Utils.OBJECT_MAPPER.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new JSONParseError(JSONParseError.DEFAULT_MESSAGE + ": empty body");
            }
            return node;
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new JSONParseError(JSONParseError.DEFAULT_MESSAGE + ": " + e.getOriginalMessage());
        }
    }

    /**
     * Parses the body of a JSON-RPC request.
     *
     * @param body the request body
     * @return the request
     * @throws JSONParseError if the body is not well formed JSON
     * @throws InvalidRequestError if the body is not a valid JSON-RPC 2.0 request
     */
    public static JSONRPCRequest parseRequest(String body) {
        return parseRequest(readTree(body));
    }

    public static JSONRPCRequest parseRequest(JsonNode node) {
        if (!node.isObject()) {
            throw new InvalidRequestError(InvalidRequestError.DEFAULT_MESSAGE + ": request must be a JSON object");
        }
        JsonNode method = node.get("method");
        if (method != null && !method.isTextual()) {
            throw new InvalidRequestError(InvalidRequestError.DEFAULT_MESSAGE + ": 'method' must be a string");
        }
        JsonNode jsonrpc = node.get("jsonrpc");
        if (jsonrpc == null || !jsonrpc.isTextual()) {
            throw new InvalidRequestError(InvalidRequestError.DEFAULT_MESSAGE + ": 'jsonrpc' must be \""
                    + JSONRPCRequest.JSONRPC_VERSION + "\"");
        }
        try {
            return JSONRPCRequest.fromProjection(toMap(node));
        } catch (A2AValidationException e) {
            throw new InvalidRequestError(InvalidRequestError.DEFAULT_MESSAGE + ": " + e.getMessage());
        }
    }

    /**
     * Extracts the id of a request whose remaining content may be invalid, so that an error response can still
     * be correlated.
     *
     * @param node the request tree
     * @return the string or number id, or {@code null}
     */
    public static @Nullable Object requestId(JsonNode node) {
        JsonNode id = node.get("id");
        if (id == null) {
            return null;
        }
        if (id.isTextual()) {
            return id.asText();
        }
        if (id.isNumber()) {
            return id.numberValue();
        }
        return null;
    }

    /**
     * Parses the body of a JSON-RPC response.
     *
     * @param body the response body
     * @return the response
     * @throws JSONParseError if the body is not well formed JSON
     * @throws A2AValidationException if the body is not a valid JSON-RPC 2.0 response
     */
    public static JSONRPCResponse parseResponse(String body) {
        JsonNode node = readTree(body);
        if (!node.isObject()) {
            throw new A2AValidationException("JSON-RPC response must be a JSON object");
        }
        return JSONRPCResponse.fromProjection(toMap(node));
    }

    private static Map<String, Object> toMap(JsonNode node) {
        try {
            return Utils.OBJECT_MAPPER.convertValue(node, Utils.PROJECTION_TYPE);
        } catch (IllegalArgumentException e) {
            throw Utils.asValidationException(Map.class, e);
        }
    }

    private static @Nullable A2AValidationException findValidationException(JacksonException failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof A2AValidationException validationException) {
                return validationException;
            }
            current = current.getCause();
        }
        return null;
    }
}
