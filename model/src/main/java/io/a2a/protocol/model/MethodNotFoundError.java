package io.a2a.protocol.model;

import static io.a2a.protocol.model.A2AErrorCodes.METHOD_NOT_FOUND_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * The method name of the request is not recognized.
 */
public class MethodNotFoundError extends A2AError {

    public static final String DEFAULT_MESSAGE = "Method not found";

    public MethodNotFoundError() {
        this(DEFAULT_MESSAGE);
    }

    public MethodNotFoundError(String message) {
        this(message, null);
    }

    public MethodNotFoundError(String message, @Nullable Object data) {
        super(METHOD_NOT_FOUND_ERROR_CODE, message, data);
    }
}
