package io.a2a.protocol.jsonrpc.common.wrappers;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.a2a.protocol.model.A2AValidationException;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 response: a {@code result} on success, an {@code error} otherwise.
 * <p>
 * A response carrying both is rejected at construction. {@link #isSuccess()} is defined by the absence of
 * {@code error}, so a successful response may have no result at all.
 *
 * @param jsonrpc always {@value JSONRPCRequest#JSONRPC_VERSION}
 * @param id the id of the answered request
 * @param result the result on success; an entity or its projection
 * @param error the error on failure
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"jsonrpc", "id", "result", "error"})
public record JSONRPCResponse(@JsonProperty("jsonrpc") String jsonrpc,
                              @JsonProperty("id") @Nullable Object id,
                              @JsonProperty("result") @Nullable Object result,
                              @JsonProperty("error") @Nullable JSONRPCError error) {

    @JsonCreator
    public JSONRPCResponse {
        if (jsonrpc == null) {
            jsonrpc = JSONRPCRequest.JSONRPC_VERSION;
        } else if (!JSONRPCRequest.JSONRPC_VERSION.equals(jsonrpc)) {
            throw new A2AValidationException("Parameter 'jsonrpc' must be \"" + JSONRPCRequest.JSONRPC_VERSION
                    + "\" but was " + jsonrpc);
        }
        JSONRPCRequest.checkId(id);
        if (result != null && error != null) {
            throw new A2AValidationException("A response may carry a result or an error, not both");
        }
    }

    public static JSONRPCResponse success(@Nullable Object id, @Nullable Object result) {
        return new JSONRPCResponse(JSONRPCRequest.JSONRPC_VERSION, id, result, null);
    }

    public static JSONRPCResponse error(@Nullable Object id, JSONRPCError error) {
        return new JSONRPCResponse(JSONRPCRequest.JSONRPC_VERSION, id, null, error);
    }

    /**
     * @param id the request id
     * @param throwable the failure, translated by {@link JSONRPCError#fromException(Throwable)}
     * @return the error response
     */
    public static JSONRPCResponse error(@Nullable Object id, Throwable throwable) {
        return error(id, JSONRPCError.fromException(throwable));
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Binds the result to an entity type.
     *
     * @param type the expected type, for example {@link io.a2a.protocol.model.Task}
     * @param <T> the expected type
     * @return the result, or {@code null} if there is none
     * @throws A2AValidationException if the result does not bind to {@code type}
     */
    public <T> @Nullable T getResult(Class<T> type) {
        if (result == null) {
            return null;
        }
        if (type.isInstance(result)) {
            return type.cast(result);
        }
        try {
            return Utils.OBJECT_MAPPER.convertValue(result, type);
        } catch (IllegalArgumentException e) {
            throw Utils.asValidationException(type, e);
        }
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static JSONRPCResponse fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, JSONRPCResponse.class);
    }
}
