package org.abstractica.gateway;

/**
 * A request was issued while no transport was open.
 *
 * <p>Delivered as an already-failed future. The request never reached the wire.</p>
 */
public class NotConnectedException extends GatewayException
{
    public NotConnectedException()
    {
        super("gateway not connected");
    }

    public NotConnectedException(String message)
    {
        super(message);
    }
}
