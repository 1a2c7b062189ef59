package org.abstractica.gateway.impl.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Response to a request.
 *
 * <p>Wire format:</p>
 * <pre>
 * {"type":"res","id":&lt;string&gt;,"ok":&lt;bool&gt;,"payload"?:&lt;any&gt;,"error"?:{"message"?:&lt;string&gt;}}
 * </pre>
 *
 * @param id           the identifier of the request being answered
 * @param ok           true on success
 * @param payload      the result on success, or null
 * @param errorMessage the failure description, or null on success
 */
public record ResponseFrame(String id, boolean ok, JsonNode payload, String errorMessage) implements Frame
{
    /**
     * Failure description used when the gateway gives none.
     */
    public static final String DEFAULT_ERROR_MESSAGE = "request failed";

    public ResponseFrame
    {
        Objects.requireNonNull(id, "id");
    }

    /**
     * Creates a successful response.
     *
     * @param id      the request identifier
     * @param payload the result, may be null
     * @return the response
     */
    public static ResponseFrame success(String id, JsonNode payload)
    {
        return new ResponseFrame(id, true, payload, null);
    }

    /**
     * Creates a failed response.
     *
     * @param id           the request identifier
     * @param errorMessage the failure description
     * @return the response
     */
    public static ResponseFrame failure(String id, String errorMessage)
    {
        return new ResponseFrame(id, false, null, errorMessage);
    }

    @Override
    public FrameType type()
    {
        return FrameType.RESPONSE;
    }
}
