package org.abstractica.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.abstractica.gateway.handlers.EventHandler;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link EventFanOut}.
 */
class EventFanOutTest
{
    @Test
    void handle_forwardsToEveryListener()
    {
        EventFanOut fanOut = new EventFanOut();
        List<String> received = new ArrayList<>();
        fanOut.add((event, payload) -> received.add("a:" + event));
        fanOut.add((event, payload) -> received.add("b:" + event));

        fanOut.handle("trip.updated", JsonNodeFactory.instance.objectNode());

        assertEquals(2, received.size());
        assertTrue(received.contains("a:trip.updated"));
        assertTrue(received.contains("b:trip.updated"));
    }

    @Test
    void add_sameInstanceOnce()
    {
        EventFanOut fanOut = new EventFanOut();
        List<String> received = new ArrayList<>();
        EventHandler listener = (event, payload) -> received.add(event);

        fanOut.add(listener);
        fanOut.add(listener);
        fanOut.handle("tick", null);

        assertEquals(1, fanOut.size());
        assertEquals(List.of("tick"), received);
    }

    @Test
    void remove_stopsDelivery()
    {
        EventFanOut fanOut = new EventFanOut();
        List<String> received = new ArrayList<>();
        EventHandler listener = (event, payload) -> received.add(event);
        fanOut.add(listener);

        assertTrue(fanOut.remove(listener));
        assertFalse(fanOut.remove(listener));
        fanOut.handle("tick", null);

        assertTrue(received.isEmpty());
        assertEquals(0, fanOut.size());
    }

    @Test
    void handle_throwingListenerDoesNotStopOthers()
    {
        EventFanOut fanOut = new EventFanOut();
        List<JsonNode> received = new ArrayList<>();
        fanOut.add((event, payload) ->
        {
            throw new IllegalStateException("listener bug");
        });
        fanOut.add((event, payload) -> received.add(payload));

        JsonNode payload = JsonNodeFactory.instance.textNode("x");
        assertDoesNotThrow(() -> fanOut.handle("tick", payload));

        assertEquals(List.of(payload), received);
    }

    @Test
    void listenerMayUnregisterWhileHandling()
    {
        EventFanOut fanOut = new EventFanOut();
        List<String> received = new ArrayList<>();
        EventHandler[] self = new EventHandler[1];
        self[0] = (event, payload) ->
        {
            received.add(event);
            fanOut.remove(self[0]);
        };
        fanOut.add(self[0]);

        fanOut.handle("first", null);
        fanOut.handle("second", null);

        assertEquals(List.of("first"), received);
    }

    @Test
    void add_rejectsNull()
    {
        assertThrows(NullPointerException.class, () -> new EventFanOut().add(null));
    }
}
