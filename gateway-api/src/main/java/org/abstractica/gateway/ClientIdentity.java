package org.abstractica.gateway;

import java.util.Objects;

/**
 * How the client introduces itself in the {@code connect} handshake.
 *
 * @param id          stable client identifier
 * @param displayName human-readable client name
 * @param version     client version
 * @param platform    host platform
 * @param mode        declared client mode
 */
public record ClientIdentity(
        String id,
        String displayName,
        String version,
        String platform,
        String mode
)
{
    public ClientIdentity
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(mode, "mode");
    }

    /**
     * Returns the identity of the web chat client, with the platform taken
     * from the running JVM.
     *
     * @return the default identity
     */
    public static ClientIdentity webchat()
    {
        return new ClientIdentity(
                "webchat-ui",
                "Travel Agent",
                "0.1.0",
                System.getProperty("os.name", "java"),
                "webchat");
    }
}
