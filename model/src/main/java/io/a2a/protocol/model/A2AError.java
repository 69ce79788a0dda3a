package io.a2a.protocol.model;

import static io.a2a.protocol.model.A2AErrorCodes.INTERNAL_ERROR_CODE;
import static io.a2a.protocol.model.A2AErrorCodes.INVALID_PARAMS_ERROR_CODE;
import static io.a2a.protocol.model.A2AErrorCodes.INVALID_REQUEST_ERROR_CODE;
import static io.a2a.protocol.model.A2AErrorCodes.JSON_PARSE_ERROR_CODE;
import static io.a2a.protocol.model.A2AErrorCodes.METHOD_NOT_FOUND_ERROR_CODE;
import static io.a2a.protocol.model.A2AErrorCodes.PUSH_NOTIFICATION_NOT_SUPPORTED_ERROR_CODE;
import static io.a2a.protocol.model.A2AErrorCodes.TASK_NOT_CANCELABLE_ERROR_CODE;
import static io.a2a.protocol.model.A2AErrorCodes.TASK_NOT_FOUND_ERROR_CODE;
import static io.a2a.protocol.model.A2AErrorCodes.UNSUPPORTED_OPERATION_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * Base class of the protocol errors: exceptions carrying a stable numeric code, a human readable message and
 * optional structured data.
 * <p>
 * These are the only exceptions meant to cross the wire. The JSON-RPC layer copies their code, message and data
 * into the error object of a response; any other exception is reported as an {@link InternalError} carrying only
 * its message.
 * <p>
 * The standard JSON-RPC codes are {@link JSONParseError}, {@link InvalidRequestError},
 * {@link MethodNotFoundError}, {@link InvalidParamsError} and {@link InternalError}. The A2A specific codes are
 * {@link TaskNotFoundError}, {@link TaskNotCancelableError}, {@link PushNotificationNotSupportedError} and
 * {@link UnsupportedOperationError}.
 *
 * @see A2AErrorCodes
 */
public class A2AError extends RuntimeException {

    private final int code;
    private final @Nullable Object data;

    public A2AError(int code, String message, @Nullable Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    /**
     * @return the JSON-RPC error code
     */
    public int getCode() {
        return code;
    }

    /**
     * @return additional information about the error, or {@code null}
     */
    public @Nullable Object getData() {
        return data;
    }

    /**
     * Rebuilds the typed error for a code received over the wire. Unrecognized codes produce a plain
     * {@link A2AError} so that the code is never lost.
     *
     * @param code the error code
     * @param message the error message
     * @param data the error data
     * @return the matching error
     */
    public static A2AError of(int code, String message, @Nullable Object data) {
        return switch (code) {
            case JSON_PARSE_ERROR_CODE -> new JSONParseError(message, data);
            case INVALID_REQUEST_ERROR_CODE -> new InvalidRequestError(message, data);
            case METHOD_NOT_FOUND_ERROR_CODE -> new MethodNotFoundError(message, data);
            case INVALID_PARAMS_ERROR_CODE -> new InvalidParamsError(message, data);
            case INTERNAL_ERROR_CODE -> new InternalError(message, data);
            case TASK_NOT_FOUND_ERROR_CODE -> new TaskNotFoundError(message, data);
            case TASK_NOT_CANCELABLE_ERROR_CODE -> new TaskNotCancelableError(message, data);
            case PUSH_NOTIFICATION_NOT_SUPPORTED_ERROR_CODE -> new PushNotificationNotSupportedError(message, data);
            case UNSUPPORTED_OPERATION_ERROR_CODE -> new UnsupportedOperationError(message, data);
            default -> new A2AError(code, message, data);
        };
    }
}
