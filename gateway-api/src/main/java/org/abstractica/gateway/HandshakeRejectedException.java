package org.abstractica.gateway;

/**
 * The gateway answered the {@code connect} handshake with {@code ok:false}.
 *
 * <p>Fatal to the connection attempt: the transport is closed and the
 * caller decides whether to connect again.</p>
 */
public class HandshakeRejectedException extends GatewayException
{
    public HandshakeRejectedException(String message)
    {
        super(message);
    }

    public HandshakeRejectedException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
