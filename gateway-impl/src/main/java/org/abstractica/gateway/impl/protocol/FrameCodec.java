package org.abstractica.gateway.impl.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.abstractica.gateway.MalformedFrameException;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Encodes and decodes gateway frames to/from JSON text.
 *
 * <p>Decoding checks structure only: the text must be a JSON object with a
 * known {@code type} and the identifying fields of that type. Unknown
 * event names or methods are not errors.</p>
 */
public final class FrameCodec
{
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FrameCodec() {}

    /**
     * Returns the mapper used for frames and payloads.
     *
     * @return the shared mapper
     */
    public static ObjectMapper mapper()
    {
        return MAPPER;
    }

    // ========== Encoding ==========

    /**
     * Encodes a frame.
     *
     * @param frame the frame to encode
     * @return JSON text
     */
    public static String encode(Frame frame)
    {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", frame.type().getWireName());

        switch (frame.type())
        {
            case EVENT ->
            {
                EventFrame event = (EventFrame) frame;
                node.put("event", event.event());
                putIfPresent(node, "payload", event.payload());
                event.seq().ifPresent(seq -> node.put("seq", seq));
            }
            case REQUEST ->
            {
                RequestFrame request = (RequestFrame) frame;
                node.put("id", request.id());
                node.put("method", request.method());
                putIfPresent(node, "params", request.params());
            }
            case RESPONSE ->
            {
                ResponseFrame response = (ResponseFrame) frame;
                node.put("id", response.id());
                node.put("ok", response.ok());
                putIfPresent(node, "payload", response.payload());
                if (response.errorMessage() != null)
                {
                    node.putObject("error").put("message", response.errorMessage());
                }
            }
        }

        return writeString(node);
    }

    /**
     * Encodes handshake parameters as the {@code params} of a connect request.
     *
     * @param params the handshake parameters
     * @return JSON object
     */
    public static ObjectNode encode(ConnectParams params)
    {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("minProtocol", params.minProtocol());
        node.put("maxProtocol", params.maxProtocol());

        ObjectNode client = node.putObject("client");
        client.put("id", params.client().id());
        client.put("displayName", params.client().displayName());
        client.put("version", params.client().version());
        client.put("platform", params.client().platform());
        client.put("mode", params.client().mode());

        node.put("role", params.role());
        putStrings(node.putArray("scopes"), params.scopes());
        putStrings(node.putArray("caps"), params.caps());

        params.auth().ifPresent(auth ->
        {
            ObjectNode authNode = node.putObject("auth");
            auth.token().ifPresent(token -> authNode.put("token", token));
            auth.password().ifPresent(password -> authNode.put("password", password));
        });

        node.put("locale", params.locale());
        node.put("userAgent", params.userAgent());
        return node;
    }

    /**
     * Converts caller-supplied request parameters to a JSON tree.
     *
     * @param params a JsonNode, a map, a bean, or null
     * @return the tree, or null for null input
     * @throws IllegalArgumentException if the value cannot be converted
     */
    public static JsonNode toTree(Object params)
    {
        if (params == null)
        {
            return null;
        }
        if (params instanceof JsonNode node)
        {
            return node;
        }
        return MAPPER.valueToTree(params);
    }

    // ========== Decoding ==========

    /**
     * Decodes a frame.
     *
     * @param text JSON text received from the gateway
     * @return the decoded frame
     * @throws MalformedFrameException if the text is not a recognizable frame
     */
    public static Frame decode(String text)
    {
        if (text == null)
        {
            throw new MalformedFrameException("Frame text is null");
        }

        JsonNode node;
        try
        {
            node = MAPPER.readTree(text);
        }
        catch (JsonProcessingException e)
        {
            throw new MalformedFrameException("Frame is not valid JSON", e);
        }

        if (node == null || !node.isObject())
        {
            throw new MalformedFrameException("Frame is not a JSON object");
        }

        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual())
        {
            throw new MalformedFrameException("Frame has no type");
        }

        Optional<FrameType> type = FrameType.fromWireName(typeNode.textValue());
        if (type.isEmpty())
        {
            throw new MalformedFrameException("Unknown frame type: " + typeNode.textValue());
        }

        return switch (type.get())
        {
            case EVENT -> decodeEvent(node);
            case REQUEST -> decodeRequest(node);
            case RESPONSE -> decodeResponse(node);
        };
    }

    private static EventFrame decodeEvent(JsonNode node)
    {
        String event = requireText(node, "event");
        JsonNode seqNode = node.get("seq");
        OptionalLong seq = (seqNode != null && seqNode.canConvertToLong() && seqNode.isIntegralNumber())
                ? OptionalLong.of(seqNode.longValue())
                : OptionalLong.empty();
        return new EventFrame(event, optionalNode(node, "payload"), seq);
    }

    private static RequestFrame decodeRequest(JsonNode node)
    {
        String id = requireText(node, "id");
        String method = requireText(node, "method");
        return new RequestFrame(id, method, optionalNode(node, "params"));
    }

    private static ResponseFrame decodeResponse(JsonNode node)
    {
        String id = requireText(node, "id");
        boolean ok = node.path("ok").isBoolean() && node.get("ok").booleanValue();
        if (ok)
        {
            return ResponseFrame.success(id, optionalNode(node, "payload"));
        }

        JsonNode message = node.path("error").path("message");
        String errorMessage = message.isTextual() ? message.textValue() : ResponseFrame.DEFAULT_ERROR_MESSAGE;
        return new ResponseFrame(id, false, optionalNode(node, "payload"), errorMessage);
    }

    // ========== Helpers ==========

    private static String requireText(JsonNode node, String field)
    {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual())
        {
            throw new MalformedFrameException("Frame field '" + field + "' missing or not a string");
        }
        return value.textValue();
    }

    private static JsonNode optionalNode(JsonNode node, String field)
    {
        JsonNode value = node.get(field);
        return (value == null || value.isNull()) ? null : value;
    }

    private static void putIfPresent(ObjectNode node, String field, JsonNode value)
    {
        if (value != null)
        {
            node.set(field, value);
        }
    }

    private static void putStrings(ArrayNode array, List<String> values)
    {
        for (String value : values)
        {
            array.add(value);
        }
    }

    private static String writeString(JsonNode node)
    {
        try
        {
            return MAPPER.writeValueAsString(node);
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalStateException("Failed to serialize frame", e);
        }
    }
}
