package io.a2a.protocol.client;

/**
 * Raised by a client when a call cannot complete: the transport failed, the response could not be read, or the
 * agent answered with an error. In the last case the cause is the {@link io.a2a.protocol.model.A2AError}
 * matching the error code, for example {@link io.a2a.protocol.model.TaskNotFoundError}.
 */
public class A2AClientException extends Exception {

    public A2AClientException(String message) {
        super(message);
    }

    public A2AClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
