package org.abstractica.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.gateway.handlers.CloseHandler;
import org.abstractica.gateway.handlers.ErrorHandler;
import org.abstractica.gateway.handlers.EventHandler;
import org.abstractica.gateway.handlers.HelloHandler;

import java.util.concurrent.CompletableFuture;

/**
 * A client session with a gateway.
 *
 * <p>The client keeps one socket to the gateway, authenticates it with a
 * {@code connect} handshake, and then carries named requests and pushed
 * events over it. Applications register callbacks and issue requests;
 * reconnecting after a close is left to the application.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * GatewayClient client = clientFactory.builder()
 *     .url("ws://localhost:18789")
 *     .token(token)
 *     .build();
 *
 * client.onHello(hello -> {
 *     client.send("chat.send", params)
 *         .thenAccept(reply -> ...);
 * });
 *
 * client.onEvent((event, payload) -> {
 *     // Handle pushed event
 * });
 *
 * client.connect();
 * }</pre>
 *
 * <p>No method blocks. Results and callbacks are delivered on the client's
 * event loop thread, so a callback must never wait on a request future.</p>
 */
public interface GatewayClient extends AutoCloseable
{
    /**
     * Opens the connection.
     *
     * <p>Does nothing if the client is disabled, has no URL, or already has
     * a transport connecting or open. The outcome is delivered via
     * {@link #onHello} or {@link #onClose}.</p>
     *
     * @throws IllegalStateException if the client has been closed
     */
    void connect();

    /**
     * Closes the connection.
     *
     * <p>Pending requests fail with {@link ConnectionClosedException}.
     * Does nothing if no transport is present.</p>
     */
    void disconnect();

    /**
     * Enables or disables the client.
     *
     * <p>Enabling connects; disabling disconnects and makes later
     * {@link #connect()} calls no-ops until enabled again.</p>
     *
     * @param enabled the new setting
     */
    void setEnabled(boolean enabled);

    /**
     * Disconnects and releases the client's thread.
     */
    @Override
    void close();

    /**
     * Sends a request and returns its eventual response payload.
     *
     * <p>The future fails with {@link NotConnectedException} if no transport
     * is open, {@link RequestRejectedException} if the gateway answers with
     * an error, or {@link ConnectionClosedException} if the transport closes
     * first. There is no timeout: a request stays pending until one of these
     * happens.</p>
     *
     * @param method the method name
     * @param params the parameters, or {@code null} for none
     * @return the response payload ({@code null} if the response carried none)
     */
    CompletableFuture<JsonNode> send(String method, Object params);

    /**
     * Same as {@link #send(String, Object)}.
     *
     * @param method the method name
     * @param params the parameters, or {@code null} for none
     * @return the response payload
     */
    CompletableFuture<JsonNode> request(String method, Object params);

    /**
     * Replaces all callbacks at once.
     *
     * @param callbacks the new callbacks
     */
    void setCallbacks(GatewayCallbacks callbacks);

    /**
     * Sets the handler for pushed events, replacing any previous one.
     *
     * @param handler the handler
     */
    void onEvent(EventHandler handler);

    /**
     * Sets the handler for a successful handshake, replacing any previous one.
     *
     * @param handler the handler
     */
    void onHello(HelloHandler handler);

    /**
     * Sets the handler for session close, replacing any previous one.
     *
     * @param handler the handler
     */
    void onClose(CloseHandler handler);

    /**
     * Sets the handler for transport errors, replacing any previous one.
     *
     * @param handler the handler
     */
    void onError(ErrorHandler handler);

    /**
     * Returns the current state.
     *
     * @return the state
     */
    ConnectionState getState();

    /**
     * Returns true once the handshake has been accepted and until the
     * connection closes.
     *
     * @return true if connected
     */
    boolean isConnected();
}
