package org.abstractica.gateway;

/**
 * Low-level socket failure.
 */
public class TransportException extends GatewayException
{
    public TransportException(String message)
    {
        super(message);
    }

    public TransportException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
