package org.abstractica.gateway;

/**
 * Receives events from a {@link TransportChannel}.
 *
 * <p>Methods may be called from any transport thread. Implementations
 * must not block.</p>
 */
public interface TransportListener
{
    /**
     * The channel is open and ready to send.
     */
    void onOpen();

    /**
     * A complete text message arrived.
     *
     * @param text the message
     */
    void onMessage(String text);

    /**
     * The channel reported an error. A close event may follow.
     *
     * @param error the error
     */
    void onError(Throwable error);

    /**
     * The channel closed. No further events follow.
     *
     * @param code   the close code
     * @param reason the close reason, possibly empty
     */
    void onClose(int code, String reason);
}
