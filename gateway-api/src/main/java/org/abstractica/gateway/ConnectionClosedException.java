package org.abstractica.gateway;

/**
 * The transport closed while a request was still waiting for its response.
 */
public class ConnectionClosedException extends GatewayException
{
    private final int code;
    private final String reason;

    /**
     * Creates the exception for a close event.
     *
     * @param code   the close code reported by the transport
     * @param reason the close reason, possibly empty
     */
    public ConnectionClosedException(int code, String reason)
    {
        super(formatMessage(code, reason));
        this.code = code;
        this.reason = reason == null ? "" : reason;
    }

    /**
     * Returns the close code.
     *
     * @return the code, e.g. 1000 for a normal close or 1006 for an abnormal one
     */
    public int getCode()
    {
        return code;
    }

    /**
     * Returns the close reason.
     *
     * @return the reason, empty if the peer gave none
     */
    public String getReason()
    {
        return reason;
    }

    private static String formatMessage(int code, String reason)
    {
        String text = (reason == null || reason.isEmpty()) ? "no reason" : reason;
        return "gateway closed (" + code + "): " + text;
    }
}
