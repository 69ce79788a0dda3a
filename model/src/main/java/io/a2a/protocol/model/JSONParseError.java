package io.a2a.protocol.model;

import static io.a2a.protocol.model.A2AErrorCodes.JSON_PARSE_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * The payload received is not valid JSON.
 */
public class JSONParseError extends A2AError {

    public static final String DEFAULT_MESSAGE = "Invalid JSON payload";

    public JSONParseError() {
        this(DEFAULT_MESSAGE);
    }

    public JSONParseError(String message) {
        this(message, null);
    }

    public JSONParseError(String message, @Nullable Object data) {
        super(JSON_PARSE_ERROR_CODE, message, data);
    }
}
