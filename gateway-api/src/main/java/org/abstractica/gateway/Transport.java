package org.abstractica.gateway;

import java.net.URI;

/**
 * A socket backend that can open text channels to a gateway.
 *
 * <p>Implementations provide different backends for production
 * and testing scenarios. The client opens one channel per connection
 * attempt and never reuses a closed one.</p>
 */
public interface Transport
{
    /**
     * Starts opening a channel.
     *
     * <p>Returns immediately with a channel in the connecting state.
     * The outcome is reported to the listener: {@link TransportListener#onOpen()}
     * on success, or {@link TransportListener#onError(Throwable)} followed by
     * {@link TransportListener#onClose(int, String)} on failure.</p>
     *
     * @param uri      the gateway address
     * @param listener receives channel events
     * @return the new channel
     */
    TransportChannel open(URI uri, TransportListener listener);
}
