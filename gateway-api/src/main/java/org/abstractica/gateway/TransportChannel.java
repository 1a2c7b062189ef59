package org.abstractica.gateway;

/**
 * One open (or opening) text connection to the gateway.
 */
public interface TransportChannel
{
    /**
     * Sends one text message.
     *
     * @param text the message
     * @throws TransportException if the channel is not open or the send fails
     */
    void send(String text);

    /**
     * Starts closing the channel.
     *
     * <p>The listener's {@link TransportListener#onClose(int, String)} follows
     * once the close completes. Closing an already closed channel does nothing.</p>
     *
     * @param code   the close code
     * @param reason the close reason
     */
    void close(int code, String reason);

    /**
     * Returns true while the channel is being opened.
     *
     * @return true if connecting
     */
    boolean isConnecting();

    /**
     * Returns true if the channel is open and ready to send.
     *
     * @return true if open
     */
    boolean isOpen();
}
