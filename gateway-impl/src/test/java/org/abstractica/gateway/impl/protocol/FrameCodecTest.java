package org.abstractica.gateway.impl.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.gateway.ClientIdentity;
import org.abstractica.gateway.MalformedFrameException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FrameCodec}.
 */
class FrameCodecTest
{
    // ========== Decoding ==========

    @Test
    void decode_event()
    {
        Frame frame = FrameCodec.decode(
                "{\"type\":\"event\",\"event\":\"trip.updated\",\"payload\":{\"n\":1},\"seq\":7}");

        EventFrame event = assertInstanceOf(EventFrame.class, frame);
        assertEquals("trip.updated", event.event());
        assertEquals(1, event.payload().get("n").intValue());
        assertEquals(OptionalLong.of(7), event.seq());
        assertFalse(event.isChallenge());
    }

    @Test
    void decode_challengeWithoutPayload()
    {
        EventFrame event = (EventFrame) FrameCodec.decode("{\"type\":\"event\",\"event\":\"connect.challenge\"}");

        assertTrue(event.isChallenge());
        assertNull(event.payload());
        assertTrue(event.seq().isEmpty());
    }

    @Test
    void decode_nullPayloadIsAbsent()
    {
        EventFrame event = (EventFrame) FrameCodec.decode(
                "{\"type\":\"event\",\"event\":\"tick\",\"payload\":null}");

        assertNull(event.payload());
    }

    @Test
    void decode_nonIntegralSeqIgnored()
    {
        EventFrame event = (EventFrame) FrameCodec.decode(
                "{\"type\":\"event\",\"event\":\"tick\",\"seq\":\"7\"}");

        assertTrue(event.seq().isEmpty());
    }

    @Test
    void decode_request()
    {
        RequestFrame request = (RequestFrame) FrameCodec.decode(
                "{\"type\":\"req\",\"id\":\"r1\",\"method\":\"ping\",\"params\":[1,2]}");

        assertEquals("r1", request.id());
        assertEquals("ping", request.method());
        assertEquals(2, request.params().size());
    }

    @Test
    void decode_successResponse()
    {
        ResponseFrame response = (ResponseFrame) FrameCodec.decode(
                "{\"type\":\"res\",\"id\":\"a\",\"ok\":true,\"payload\":{\"session\":\"abc\"}}");

        assertTrue(response.ok());
        assertEquals("abc", response.payload().get("session").textValue());
        assertNull(response.errorMessage());
    }

    @Test
    void decode_failedResponseWithMessage()
    {
        ResponseFrame response = (ResponseFrame) FrameCodec.decode(
                "{\"type\":\"res\",\"id\":\"a\",\"ok\":false,\"error\":{\"message\":\"bad token\"}}");

        assertFalse(response.ok());
        assertEquals("bad token", response.errorMessage());
    }

    @Test
    void decode_failedResponseWithoutMessage()
    {
        ResponseFrame response = (ResponseFrame) FrameCodec.decode("{\"type\":\"res\",\"id\":\"a\",\"ok\":false}");

        assertFalse(response.ok());
        assertEquals("request failed", response.errorMessage());
    }

    @Test
    void decode_missingOkIsFailure()
    {
        ResponseFrame response = (ResponseFrame) FrameCodec.decode("{\"type\":\"res\",\"id\":\"a\"}");

        assertFalse(response.ok());
        assertEquals(ResponseFrame.DEFAULT_ERROR_MESSAGE, response.errorMessage());
    }

    @Test
    void decode_nonBooleanOkIsFailure()
    {
        ResponseFrame text = (ResponseFrame) FrameCodec.decode("{\"type\":\"res\",\"id\":\"x\",\"ok\":\"true\"}");
        ResponseFrame number = (ResponseFrame) FrameCodec.decode("{\"type\":\"res\",\"id\":\"y\",\"ok\":1}");

        assertFalse(text.ok());
        assertEquals("request failed", text.errorMessage());
        assertFalse(number.ok());
    }

    @Test
    void decode_rejectsMalformedText()
    {
        assertThrows(MalformedFrameException.class, () -> FrameCodec.decode(null));
        assertThrows(MalformedFrameException.class, () -> FrameCodec.decode("not json"));
        assertThrows(MalformedFrameException.class, () -> FrameCodec.decode("[1,2,3]"));
        assertThrows(MalformedFrameException.class, () -> FrameCodec.decode("\"event\""));
        assertThrows(MalformedFrameException.class, () -> FrameCodec.decode("{}"));
        assertThrows(MalformedFrameException.class, () -> FrameCodec.decode("{\"type\":42}"));
        assertThrows(MalformedFrameException.class, () -> FrameCodec.decode("{\"type\":\"push\"}"));
    }

    @Test
    void decode_rejectsMissingIdentifyingFields()
    {
        assertThrows(MalformedFrameException.class, () -> FrameCodec.decode("{\"type\":\"event\"}"));
        assertThrows(MalformedFrameException.class, () -> FrameCodec.decode("{\"type\":\"res\",\"ok\":true}"));
        assertThrows(MalformedFrameException.class, () -> FrameCodec.decode("{\"type\":\"res\",\"id\":5,\"ok\":true}"));
        assertThrows(MalformedFrameException.class, () -> FrameCodec.decode("{\"type\":\"req\",\"id\":\"x\"}"));
    }

    // ========== Encoding ==========

    @Test
    void encode_requestWireFormat() throws Exception
    {
        JsonNode params = FrameCodec.toTree(Map.of("q", "paris"));
        String text = FrameCodec.encode(new RequestFrame("id-1", "search", params));

        JsonNode node = FrameCodec.mapper().readTree(text);
        assertEquals("req", node.get("type").textValue());
        assertEquals("id-1", node.get("id").textValue());
        assertEquals("search", node.get("method").textValue());
        assertEquals("paris", node.get("params").get("q").textValue());
    }

    @Test
    void encode_requestWithoutParamsOmitsField() throws Exception
    {
        String text = FrameCodec.encode(new RequestFrame("id-1", "status", null));

        assertFalse(FrameCodec.mapper().readTree(text).has("params"));
    }

    @Test
    void encode_failedResponseCarriesErrorObject() throws Exception
    {
        String text = FrameCodec.encode(ResponseFrame.failure("x", "nope"));

        JsonNode node = FrameCodec.mapper().readTree(text);
        assertEquals("res", node.get("type").textValue());
        assertFalse(node.get("ok").booleanValue());
        assertEquals("nope", node.get("error").get("message").textValue());
    }

    @Test
    void encode_eventThenDecodeKeepsSeq()
    {
        String text = FrameCodec.encode(new EventFrame("tick", null, OptionalLong.of(3)));

        EventFrame decoded = (EventFrame) FrameCodec.decode(text);
        assertEquals("tick", decoded.event());
        assertEquals(OptionalLong.of(3), decoded.seq());
    }

    // ========== Connect Params ==========

    @Test
    void encodeConnectParams_fullPayload()
    {
        ConnectParams params = new ConnectParams(
                3, 3,
                new ClientIdentity("webchat-ui", "Travel Agent", "0.1.0", "Linux", "webchat"),
                "operator",
                List.of("operator.read", "operator.write"),
                List.of(),
                ConnectParams.Auth.of("  tok  ", "   "),
                "en-US",
                "agent/1");

        JsonNode node = FrameCodec.encode(params);

        assertEquals(3, node.get("minProtocol").intValue());
        assertEquals(3, node.get("maxProtocol").intValue());
        assertEquals("webchat-ui", node.get("client").get("id").textValue());
        assertEquals("Travel Agent", node.get("client").get("displayName").textValue());
        assertEquals("webchat", node.get("client").get("mode").textValue());
        assertEquals("operator", node.get("role").textValue());
        assertEquals(2, node.get("scopes").size());
        assertEquals("operator.write", node.get("scopes").get(1).textValue());
        assertTrue(node.get("caps").isArray());
        assertEquals(0, node.get("caps").size());
        assertEquals("tok", node.get("auth").get("token").textValue());
        assertFalse(node.get("auth").has("password"));
        assertEquals("en-US", node.get("locale").textValue());
        assertEquals("agent/1", node.get("userAgent").textValue());
    }

    @Test
    void encodeConnectParams_noCredentialsOmitsAuth()
    {
        ConnectParams params = new ConnectParams(
                3, 3, ClientIdentity.webchat(), "operator", List.of(), List.of(),
                ConnectParams.Auth.of(" ", null), "en", "ua");

        assertFalse(FrameCodec.encode(params).has("auth"));
    }

    @Test
    void auth_ofTrimsAndDropsBlanks()
    {
        assertEquals(Optional.empty(), ConnectParams.Auth.of(null, ""));

        ConnectParams.Auth auth = ConnectParams.Auth.of(null, " secret ").orElseThrow();
        assertTrue(auth.token().isEmpty());
        assertEquals(Optional.of("secret"), auth.password());
    }

    @Test
    void toTree_passesThroughJsonAndNull()
    {
        JsonNode node = FrameCodec.mapper().createObjectNode().put("a", 1);

        assertSame(node, FrameCodec.toTree(node));
        assertNull(FrameCodec.toTree(null));
        assertTrue(FrameCodec.toTree(Map.of()).isObject());
    }
}
