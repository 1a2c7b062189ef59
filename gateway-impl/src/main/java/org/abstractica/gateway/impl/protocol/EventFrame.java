package org.abstractica.gateway.impl.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Server-pushed event.
 *
 * <p>Wire format:</p>
 * <pre>
 * {"type":"event","event":&lt;string&gt;,"payload"?:&lt;any&gt;,"seq"?:&lt;integer&gt;}
 * </pre>
 *
 * @param event   the event name
 * @param payload the payload, or null if absent
 * @param seq     the sequence number, if present
 */
public record EventFrame(String event, JsonNode payload, OptionalLong seq) implements Frame
{
    /**
     * Event name with which the gateway asks for the handshake.
     */
    public static final String CONNECT_CHALLENGE = "connect.challenge";

    public EventFrame
    {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(seq, "seq");
    }

    /**
     * Returns true if this event asks the client to send its handshake.
     *
     * @return true for {@code connect.challenge}
     */
    public boolean isChallenge()
    {
        return CONNECT_CHALLENGE.equals(event);
    }

    @Override
    public FrameType type()
    {
        return FrameType.EVENT;
    }
}
