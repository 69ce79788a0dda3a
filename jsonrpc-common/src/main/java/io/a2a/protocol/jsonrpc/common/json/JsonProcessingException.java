package io.a2a.protocol.jsonrpc.common.json;

/**
 * Raised when a value cannot be written to, or read from, its JSON text.
 */
public class JsonProcessingException extends Exception {

    public JsonProcessingException(String message) {
        super(message);
    }

    public JsonProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
