package io.a2a.protocol.model;

import static io.a2a.protocol.model.A2AErrorCodes.INVALID_PARAMS_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * The parameters of the request failed validation.
 */
public class InvalidParamsError extends A2AError {

    public static final String DEFAULT_MESSAGE = "Invalid parameters";

    public InvalidParamsError() {
        this(DEFAULT_MESSAGE);
    }

    public InvalidParamsError(String message) {
        this(message, null);
    }

    public InvalidParamsError(String message, @Nullable Object data) {
        super(INVALID_PARAMS_ERROR_CODE, message, data);
    }
}
