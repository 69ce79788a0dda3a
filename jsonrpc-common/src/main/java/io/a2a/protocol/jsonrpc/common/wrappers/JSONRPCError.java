package io.a2a.protocol.jsonrpc.common.wrappers;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.a2a.protocol.model.A2AError;
import io.a2a.protocol.model.A2AErrorCodes;
import io.a2a.protocol.model.InternalError;
import io.a2a.protocol.util.Assert;
import io.a2a.protocol.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * The error object of a JSON-RPC response.
 * <p>
 * {@link #fromException(Throwable)} is the single translation point between exceptions and wire errors:
 * a protocol error ({@link A2AError}) keeps its code, message and data; any other exception becomes an
 * internal error ({@value A2AErrorCodes#INTERNAL_ERROR_CODE}) carrying only its message, so that no other
 * detail of an unexpected failure reaches the wire.
 *
 * @param code the error code, required
 * @param message the error message
 * @param data optional additional information
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"code", "message", "data"})
public record JSONRPCError(@JsonProperty("code") Integer code,
                           @JsonProperty("message") String message,
                           @JsonProperty("data") @Nullable Object data) {

    @JsonCreator
    public JSONRPCError {
        Assert.checkNotNullParam("code", code);
        Assert.checkNotNullParam("message", message);
    }

    public JSONRPCError(int code, String message) {
        this(code, message, null);
    }

    /**
     * Translates an exception into a wire error.
     *
     * @param throwable the failure
     * @return the error object
     */
    public static JSONRPCError fromException(Throwable throwable) {
        Assert.checkNotNullParam("throwable", throwable);
        if (throwable instanceof A2AError a2aError) {
            return new JSONRPCError(a2aError.getCode(), messageOf(a2aError, a2aError.getClass().getSimpleName()),
                    a2aError.getData());
        }
        return new JSONRPCError(A2AErrorCodes.INTERNAL_ERROR_CODE, messageOf(throwable, InternalError.DEFAULT_MESSAGE));
    }

    /**
     * Rebuilds the typed protocol error carried by this wire error.
     *
     * @return the {@link A2AError} subclass matching {@link #code()}
     */
    public A2AError toException() {
        return A2AError.of(code, message, data);
    }

    public Map<String, Object> toProjection() {
        return Utils.toProjection(this);
    }

    public static JSONRPCError fromProjection(Map<String, ?> projection) {
        return Utils.fromProjection(projection, JSONRPCError.class);
    }

    private static String messageOf(Throwable throwable, String fallback) {
        String message = throwable.getMessage();
        return message == null ? fallback : message;
    }
}
