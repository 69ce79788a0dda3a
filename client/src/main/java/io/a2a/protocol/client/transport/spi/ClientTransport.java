package io.a2a.protocol.client.transport.spi;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Moves JSON-RPC bodies between a client and an agent.
 * <p>
 * The client builds and parses the bodies; an implementation only carries them, typically over HTTP with the
 * streamed responses read from server-sent events. Implementations decide about connections, timeouts and
 * retries.
 */
public interface ClientTransport {

    /**
     * Sends a request and waits for its response.
     *
     * @param requestBody the JSON-RPC request
     * @return the JSON-RPC response body
     * @throws IOException if the exchange fails
     */
    String send(String requestBody) throws IOException;

    /**
     * Sends a request whose responses are streamed.
     *
     * @param requestBody the JSON-RPC request
     * @param messageConsumer receives each JSON-RPC response body, in order
     * @param errorConsumer receives a failure of the stream after it started
     * @throws IOException if the request cannot be sent
     */
    void sendStreaming(String requestBody, Consumer<String> messageConsumer, Consumer<Throwable> errorConsumer)
            throws IOException;

    /**
     * @return the JSON agent card published by the agent
     * @throws IOException if the card cannot be fetched
     */
    String fetchAgentCard() throws IOException;
}
