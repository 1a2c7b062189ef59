package org.abstractica.gateway.impl.protocol;

import java.util.Optional;

/**
 * Frame type discriminants as they appear in the {@code type} field.
 */
public enum FrameType
{
    EVENT("event"),
    REQUEST("req"),
    RESPONSE("res");

    private final String wireName;

    FrameType(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * Returns the value used in the {@code type} field.
     *
     * @return the wire name
     */
    public String getWireName()
    {
        return wireName;
    }

    /**
     * Looks up a frame type by its wire name.
     *
     * @param wireName the {@code type} field value
     * @return the frame type, or empty if unknown
     */
    public static Optional<FrameType> fromWireName(String wireName)
    {
        for (FrameType type : values())
        {
            if (type.wireName.equals(wireName))
            {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
