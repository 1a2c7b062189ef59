package org.abstractica.gateway.handlers;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives the gateway's hello payload once the handshake is accepted.
 */
@FunctionalInterface
public interface HelloHandler
{
    /**
     * Called once per connection attempt when the session becomes usable.
     *
     * @param hello the payload of the successful {@code connect} response
     */
    void handle(JsonNode hello);
}
