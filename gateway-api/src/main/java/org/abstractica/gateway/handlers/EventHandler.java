package org.abstractica.gateway.handlers;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Handles events pushed by the gateway.
 *
 * <p>Handlers are called from the client's event loop thread. A handler
 * must not block on a request future; chain on it instead.</p>
 */
@FunctionalInterface
public interface EventHandler
{
    /**
     * Handles a pushed event.
     *
     * @param event   the event name, e.g. {@code "chat"}
     * @param payload the event payload, or {@code null} if the frame carried none
     */
    void handle(String event, JsonNode payload);
}
