package org.abstractica.gateway;

/**
 * Base exception for gateway session failures.
 *
 * <p>Subclasses name the failure:</p>
 * <ul>
 *   <li>{@link NotConnectedException} - no open transport to send on</li>
 *   <li>{@link HandshakeRejectedException} - the gateway refused the handshake</li>
 *   <li>{@link ConnectionClosedException} - the transport closed with the request pending</li>
 *   <li>{@link RequestRejectedException} - the gateway answered a request with an error</li>
 *   <li>{@link MalformedFrameException} - inbound data could not be decoded</li>
 *   <li>{@link TransportException} - socket-level failure</li>
 * </ul>
 */
public class GatewayException extends RuntimeException
{
    public GatewayException(String message)
    {
        super(message);
    }

    public GatewayException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
