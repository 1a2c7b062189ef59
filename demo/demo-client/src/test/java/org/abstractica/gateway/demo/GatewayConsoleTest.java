package org.abstractica.gateway.demo;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GatewayConsole} output formatting.
 */
class GatewayConsoleTest
{
    @Test
    void chatLine_printsText()
    {
        assertEquals(Optional.of("[chat] hi there"),
                GatewayConsole.chatLine("chat.message", JsonNodeFactory.instance.objectNode().put("text", "hi there")));
    }

    @Test
    void chatLine_chatEventWithoutPayloadIsSkipped()
    {
        assertEquals(Optional.empty(), assertDoesNotThrow(() -> GatewayConsole.chatLine("chat.typing", null)));
    }

    @Test
    void chatLine_missingTextIsBlank()
    {
        assertEquals(Optional.of("[chat] "),
                GatewayConsole.chatLine("chat.message", JsonNodeFactory.instance.objectNode()));
    }

    @Test
    void chatLine_otherEventsIgnored()
    {
        assertEquals(Optional.empty(),
                GatewayConsole.chatLine("trip.updated", JsonNodeFactory.instance.objectNode().put("text", "x")));
    }
}
