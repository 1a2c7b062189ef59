package org.abstractica.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.gateway.handlers.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Forwards each gateway event to every registered listener.
 *
 * <p>A client holds a single event handler. Register an {@code EventFanOut}
 * as that handler when several parts of an application need the same event
 * stream and come and go independently:</p>
 *
 * <pre>{@code
 * EventFanOut fanOut = new EventFanOut();
 * client.onEvent(fanOut);
 *
 * fanOut.add(chatView::onGatewayEvent);
 * ...
 * fanOut.remove(chatView::onGatewayEvent); // must be the same instance
 * }</pre>
 *
 * <p>A listener that throws is logged and skipped; the remaining listeners
 * still receive the event.</p>
 */
public class EventFanOut implements EventHandler
{
    private static final Logger LOG = LoggerFactory.getLogger(EventFanOut.class);

    private final Set<EventHandler> listeners = new CopyOnWriteArraySet<>();

    /**
     * Registers a listener. Adding the same instance twice has no effect.
     *
     * @param listener the listener
     */
    public void add(EventHandler listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Unregisters a listener.
     *
     * @param listener the listener
     * @return true if it was registered
     */
    public boolean remove(EventHandler listener)
    {
        return listeners.remove(listener);
    }

    /**
     * Returns the number of registered listeners.
     *
     * @return listener count
     */
    public int size()
    {
        return listeners.size();
    }

    @Override
    public void handle(String event, JsonNode payload)
    {
        for (EventHandler listener : listeners)
        {
            try
            {
                listener.handle(event, payload);
            }
            catch (RuntimeException e)
            {
                LOG.error("Event listener failed for event {}", event, e);
            }
        }
    }
}
