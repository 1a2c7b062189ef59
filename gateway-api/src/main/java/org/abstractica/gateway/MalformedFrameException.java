package org.abstractica.gateway;

/**
 * Inbound data is not JSON or has no recognizable frame type.
 *
 * <p>Never delivered to callers. The session drops the frame and carries on.</p>
 */
public class MalformedFrameException extends GatewayException
{
    public MalformedFrameException(String message)
    {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
