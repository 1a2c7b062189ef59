package org.abstractica.gateway;

import org.abstractica.gateway.handlers.CloseHandler;
import org.abstractica.gateway.handlers.ErrorHandler;
import org.abstractica.gateway.handlers.EventHandler;
import org.abstractica.gateway.handlers.HelloHandler;

import java.util.Optional;

/**
 * The set of callbacks a client invokes.
 *
 * <p>Immutable. Each {@code with*} method returns a copy with one slot
 * replaced, so a client can swap callbacks while a connection is in flight
 * and always invoke the latest ones.</p>
 *
 * <pre>{@code
 * client.setCallbacks(GatewayCallbacks.none()
 *     .withEvent((event, payload) -> ...)
 *     .withClose(reason -> ...));
 * }</pre>
 */
public final class GatewayCallbacks
{
    private static final GatewayCallbacks NONE = new GatewayCallbacks(null, null, null, null);

    private final EventHandler eventHandler;
    private final HelloHandler helloHandler;
    private final CloseHandler closeHandler;
    private final ErrorHandler errorHandler;

    private GatewayCallbacks(
            EventHandler eventHandler,
            HelloHandler helloHandler,
            CloseHandler closeHandler,
            ErrorHandler errorHandler
    )
    {
        this.eventHandler = eventHandler;
        this.helloHandler = helloHandler;
        this.closeHandler = closeHandler;
        this.errorHandler = errorHandler;
    }

    /**
     * Returns a callback set with every slot empty.
     *
     * @return the empty set
     */
    public static GatewayCallbacks none()
    {
        return NONE;
    }

    public GatewayCallbacks withEvent(EventHandler handler)
    {
        return new GatewayCallbacks(handler, helloHandler, closeHandler, errorHandler);
    }

    public GatewayCallbacks withHello(HelloHandler handler)
    {
        return new GatewayCallbacks(eventHandler, handler, closeHandler, errorHandler);
    }

    public GatewayCallbacks withClose(CloseHandler handler)
    {
        return new GatewayCallbacks(eventHandler, helloHandler, handler, errorHandler);
    }

    public GatewayCallbacks withError(ErrorHandler handler)
    {
        return new GatewayCallbacks(eventHandler, helloHandler, closeHandler, handler);
    }

    public Optional<EventHandler> eventHandler()
    {
        return Optional.ofNullable(eventHandler);
    }

    public Optional<HelloHandler> helloHandler()
    {
        return Optional.ofNullable(helloHandler);
    }

    public Optional<CloseHandler> closeHandler()
    {
        return Optional.ofNullable(closeHandler);
    }

    public Optional<ErrorHandler> errorHandler()
    {
        return Optional.ofNullable(errorHandler);
    }
}
