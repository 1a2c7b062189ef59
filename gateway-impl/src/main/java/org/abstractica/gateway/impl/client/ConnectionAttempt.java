package org.abstractica.gateway.impl.client;

import org.abstractica.gateway.TransportChannel;
import org.abstractica.gateway.impl.session.HandshakeNegotiator;
import org.abstractica.gateway.impl.session.RequestCorrelator;

import java.util.concurrent.ScheduledFuture;

/**
 * One transport instance with everything scoped to it.
 *
 * <p>Confined to the client's event loop thread. Nothing carries over
 * from one attempt to the next.</p>
 */
final class ConnectionAttempt
{
    private final long number;
    private TransportChannel channel;
    private RequestCorrelator correlator;
    private HandshakeNegotiator handshake;
    private ScheduledFuture<?> settleTimer;
    private boolean closed;
    private boolean closeReported;

    ConnectionAttempt(long number)
    {
        this.number = number;
    }

    void bind(TransportChannel channel, RequestCorrelator correlator, HandshakeNegotiator handshake)
    {
        this.channel = channel;
        this.correlator = correlator;
        this.handshake = handshake;
    }

    long number()
    {
        return number;
    }

    TransportChannel channel()
    {
        return channel;
    }

    RequestCorrelator correlator()
    {
        return correlator;
    }

    HandshakeNegotiator handshake()
    {
        return handshake;
    }

    boolean isBound()
    {
        return channel != null;
    }

    boolean isLive()
    {
        return channel != null && (channel.isConnecting() || channel.isOpen());
    }

    void setSettleTimer(ScheduledFuture<?> settleTimer)
    {
        this.settleTimer = settleTimer;
    }

    void cancelSettleTimer()
    {
        if (settleTimer != null)
        {
            settleTimer.cancel(false);
            settleTimer = null;
        }
    }

    void markClosed()
    {
        closed = true;
    }

    boolean isClosed()
    {
        return closed;
    }

    /**
     * Records that the caller has been told this attempt is over.
     *
     * @return true on the first call only
     */
    boolean markCloseReported()
    {
        if (closeReported)
        {
            return false;
        }
        closeReported = true;
        return true;
    }

    @Override
    public String toString()
    {
        return "attempt#" + number;
    }
}
