package org.abstractica.gateway.impl.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.gateway.GatewayCallbacks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Delivers session notifications to the caller's callbacks.
 *
 * <p>Holds one subscriber per slot. The callback set is read at each
 * delivery, so a replacement made while a connection is in flight takes
 * effect for the next notification. A callback that throws is logged;
 * the session carries on.</p>
 */
final class EventDispatcher
{
    private static final Logger LOG = LoggerFactory.getLogger(EventDispatcher.class);

    private final AtomicReference<GatewayCallbacks> callbacks =
            new AtomicReference<>(GatewayCallbacks.none());

    void setCallbacks(GatewayCallbacks replacement)
    {
        callbacks.set(Objects.requireNonNull(replacement, "callbacks"));
    }

    void update(UnaryOperator<GatewayCallbacks> change)
    {
        callbacks.updateAndGet(change);
    }

    GatewayCallbacks callbacks()
    {
        return callbacks.get();
    }

    void fireEvent(String event, JsonNode payload)
    {
        callbacks.get().eventHandler().ifPresentOrElse(
                handler -> safeCallback("Event", () -> handler.handle(event, payload)),
                () -> LOG.debug("No handler for event {}", event));
    }

    void fireHello(JsonNode hello)
    {
        callbacks.get().helloHandler()
                .ifPresent(handler -> safeCallback("Hello", () -> handler.handle(hello)));
    }

    void fireClose(String reason)
    {
        callbacks.get().closeHandler()
                .ifPresent(handler -> safeCallback("Close", () -> handler.handle(reason)));
    }

    void fireError(Throwable error)
    {
        callbacks.get().errorHandler()
                .ifPresent(handler -> safeCallback("Error", () -> handler.handle(error)));
    }

    private static void safeCallback(String slot, Runnable callback)
    {
        try
        {
            callback.run();
        }
        catch (RuntimeException e)
        {
            LOG.error("{} callback error", slot, e);
        }
    }
}
