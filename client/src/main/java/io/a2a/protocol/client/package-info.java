/**
 * Client side of the protocol.
 *
 * <p>{@link io.a2a.protocol.client.JSONRPCClient} turns each call into a JSON-RPC request, hands it to a
 * {@link io.a2a.protocol.client.transport.spi.ClientTransport} and reads back the typed result. Errors answered by
 * the agent surface as {@link io.a2a.protocol.client.A2AClientException} carrying the matching
 * {@link io.a2a.protocol.model.A2AError}.
 *
 * @see io.a2a.protocol.client.A2AClient
 */
@NullMarked
package io.a2a.protocol.client;

import org.jspecify.annotations.NullMarked;
