/**
 * Transport-free JSON-RPC 2.0 dispatch of the protocol methods.
 *
 * <p>A transport (HTTP, SSE, in-process) hands the request body to
 * {@link io.a2a.protocol.transport.jsonrpc.handler.JSONRPCHandler} and writes back what it returns: a single
 * response for the unary methods, a publisher of responses for {@code tasks/sendSubscribe} and
 * {@code tasks/resubscribe}.
 *
 * @see io.a2a.protocol.transport.jsonrpc.handler.JSONRPCHandler
 */
@NullMarked
package io.a2a.protocol.transport.jsonrpc.handler;

import org.jspecify.annotations.NullMarked;
