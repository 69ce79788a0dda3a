package io.a2a.protocol.model;

import static io.a2a.protocol.model.A2AErrorCodes.UNSUPPORTED_OPERATION_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * The requested operation is not supported by this agent, for example streaming when
 * {@link AgentCapabilities#streaming()} is false.
 */
public class UnsupportedOperationError extends A2AError {

    public static final String DEFAULT_MESSAGE = "This operation is not supported";

    public UnsupportedOperationError() {
        this(DEFAULT_MESSAGE);
    }

    public UnsupportedOperationError(String message) {
        this(message, null);
    }

    public UnsupportedOperationError(String message, @Nullable Object data) {
        super(UNSUPPORTED_OPERATION_ERROR_CODE, message, data);
    }
}
