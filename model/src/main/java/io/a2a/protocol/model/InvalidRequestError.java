package io.a2a.protocol.model;

import static io.a2a.protocol.model.A2AErrorCodes.INVALID_REQUEST_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * The payload is JSON but not a structurally valid JSON-RPC request.
 */
public class InvalidRequestError extends A2AError {

    public static final String DEFAULT_MESSAGE = "Request payload validation error";

    public InvalidRequestError() {
        this(DEFAULT_MESSAGE);
    }

    public InvalidRequestError(String message) {
        this(message, null);
    }

    public InvalidRequestError(String message, @Nullable Object data) {
        super(INVALID_REQUEST_ERROR_CODE, message, data);
    }
}
