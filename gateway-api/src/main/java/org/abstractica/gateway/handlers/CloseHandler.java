package org.abstractica.gateway.handlers;

/**
 * Notified when the session stops being usable.
 */
@FunctionalInterface
public interface CloseHandler
{
    /**
     * Handles a session close.
     *
     * @param reason human-readable reason
     */
    void handle(String reason);
}
