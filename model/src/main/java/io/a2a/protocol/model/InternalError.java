package io.a2a.protocol.model;

import static io.a2a.protocol.model.A2AErrorCodes.INTERNAL_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * An unclassified failure on the server side.
 */
public class InternalError extends A2AError {

    public static final String DEFAULT_MESSAGE = "Internal error";

    public InternalError() {
        this(DEFAULT_MESSAGE);
    }

    public InternalError(String message) {
        this(message, null);
    }

    public InternalError(String message, @Nullable Object data) {
        super(INTERNAL_ERROR_CODE, message, data);
    }
}
