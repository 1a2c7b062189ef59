package org.abstractica.gateway;

/**
 * Lifecycle state of a gateway session.
 *
 * <p>For one transport instance the state only moves forward:
 * {@code CONNECTING -> HANDSHAKING -> CONNECTED -> CLOSED}. Calling
 * {@link GatewayClient#connect()} after {@code CLOSED} starts over with
 * a fresh transport.</p>
 */
public enum ConnectionState
{
    /**
     * No connection has been attempted yet.
     */
    IDLE,

    /**
     * The transport is being opened.
     */
    CONNECTING,

    /**
     * The transport is open; the {@code connect} handshake is pending or in flight.
     */
    HANDSHAKING,

    /**
     * The gateway accepted the handshake. Requests and events flow.
     */
    CONNECTED,

    /**
     * The transport closed, the handshake failed, or the client disconnected.
     */
    CLOSED
}
