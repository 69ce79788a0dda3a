package io.a2a.protocol.model;

/**
 * Raised when an entity is constructed, or parsed from its projection, in violation of one of its invariants:
 * an unknown role or task state, a file content carrying both or neither of bytes and uri, a missing required
 * field, and so on.
 * <p>
 * Validation failures are local to the caller. They are never retried and only reach the wire through
 * {@code JSONRPCError.fromException}.
 */
public class A2AValidationException extends IllegalArgumentException {

    public A2AValidationException(String message) {
        super(message);
    }

    public A2AValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
