package org.abstractica.gateway.impl.protocol;

/**
 * One JSON message on the gateway socket.
 */
public sealed interface Frame permits EventFrame, RequestFrame, ResponseFrame
{
    /**
     * Returns the discriminant of this frame.
     *
     * @return the frame type
     */
    FrameType type();
}
