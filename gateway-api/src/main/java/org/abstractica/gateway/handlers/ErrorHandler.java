package org.abstractica.gateway.handlers;

/**
 * Handles transport-level errors.
 *
 * <p>An error does not end the session by itself. If the socket is lost,
 * the close handler follows.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles a transport error.
     *
     * @param error the error reported by the transport
     */
    void handle(Throwable error);
}
