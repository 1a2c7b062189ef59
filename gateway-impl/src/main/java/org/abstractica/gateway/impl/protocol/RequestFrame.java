package org.abstractica.gateway.impl.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Request carrying a method call.
 *
 * <p>Wire format:</p>
 * <pre>
 * {"type":"req","id":&lt;string&gt;,"method":&lt;string&gt;,"params"?:&lt;any&gt;}
 * </pre>
 *
 * @param id     the request identifier, echoed by the response
 * @param method the method name
 * @param params the parameters, or null if absent
 */
public record RequestFrame(String id, String method, JsonNode params) implements Frame
{
    public RequestFrame
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(method, "method");
    }

    @Override
    public FrameType type()
    {
        return FrameType.REQUEST;
    }
}
