package org.abstractica.gateway;

/**
 * The gateway answered a request with {@code ok:false}.
 */
public class RequestRejectedException extends GatewayException
{
    private final String method;

    public RequestRejectedException(String method, String message)
    {
        super(message);
        this.method = method;
    }

    /**
     * Returns the method of the rejected request.
     *
     * @return the method name
     */
    public String getMethod()
    {
        return method;
    }
}
