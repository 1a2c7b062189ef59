package org.abstractica.gateway.impl.transport;

import org.abstractica.gateway.TransportChannel;
import org.abstractica.gateway.TransportException;
import org.abstractica.gateway.TransportListener;
import org.abstractica.gateway.impl.protocol.Frame;
import org.abstractica.gateway.impl.protocol.FrameCodec;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One channel of a {@link SimulatedTransport}.
 *
 * <p>The client side uses it through {@link TransportChannel}. The test
 * plays the gateway through the remaining public methods. A client-side
 * {@link #close(int, String)} is acknowledged at once, as a well-behaved
 * peer would.</p>
 */
public class SimulatedChannel implements TransportChannel
{
    /**
     * Channel lifecycle.
     */
    public enum State
    {
        CONNECTING,
        OPEN,
        CLOSED
    }

    private final URI uri;
    private final TransportListener listener;
    private final AtomicReference<State> state;
    private final BlockingQueue<String> outbound;
    private final List<String> sent;
    private final AtomicBoolean failNextSend;

    private volatile int closeCode = -1;
    private volatile String closeReason;

    SimulatedChannel(URI uri, TransportListener listener)
    {
        this.uri = uri;
        this.listener = listener;
        this.state = new AtomicReference<>(State.CONNECTING);
        this.outbound = new LinkedBlockingQueue<>();
        this.sent = new CopyOnWriteArrayList<>();
        this.failNextSend = new AtomicBoolean(false);
    }

    // ========== Client Side ==========

    @Override
    public void send(String text)
    {
        if (state.get() != State.OPEN)
        {
            throw new TransportException("Channel is not open");
        }
        if (failNextSend.getAndSet(false))
        {
            throw new TransportException("Simulated send failure");
        }
        sent.add(text);
        outbound.add(text);
    }

    @Override
    public void close(int code, String reason)
    {
        State previous = state.getAndSet(State.CLOSED);
        if (previous == State.CLOSED)
        {
            return;
        }
        closeCode = code;
        closeReason = reason;
        listener.onClose(code, reason);
    }

    @Override
    public boolean isConnecting()
    {
        return state.get() == State.CONNECTING;
    }

    @Override
    public boolean isOpen()
    {
        return state.get() == State.OPEN;
    }

    // ========== Gateway Side ==========

    /**
     * Completes the opening handshake.
     *
     * @return true if the channel was connecting and is now open
     */
    public boolean accept()
    {
        if (!state.compareAndSet(State.CONNECTING, State.OPEN))
        {
            return false;
        }
        listener.onOpen();
        return true;
    }

    /**
     * Delivers a text message to the client.
     *
     * @param text the message
     * @throws IllegalStateException if the channel is not open
     */
    public void deliver(String text)
    {
        if (state.get() != State.OPEN)
        {
            throw new IllegalStateException("Cannot deliver on a channel that is " + state.get());
        }
        listener.onMessage(text);
    }

    /**
     * Encodes and delivers a frame to the client.
     *
     * @param frame the frame
     */
    public void deliver(Frame frame)
    {
        deliver(FrameCodec.encode(frame));
    }

    /**
     * Reports a transport error to the client without closing the channel.
     *
     * @param error the error
     */
    public void fail(Throwable error)
    {
        listener.onError(error);
    }

    /**
     * Closes the channel from the gateway's side.
     *
     * @param code   the close code, e.g. 1006 for a lost connection
     * @param reason the close reason
     */
    public void drop(int code, String reason)
    {
        State previous = state.getAndSet(State.CLOSED);
        if (previous == State.CLOSED)
        {
            return;
        }
        closeCode = code;
        closeReason = reason;
        listener.onClose(code, reason);
    }

    /**
     * Makes the next client send fail with a {@link TransportException}.
     */
    public void failNextSend()
    {
        failNextSend.set(true);
    }

    /**
     * Waits for the next message the client sends.
     *
     * @param timeout how long to wait
     * @return the message, or null if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public String awaitSent(Duration timeout) throws InterruptedException
    {
        return outbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Waits for the next frame the client sends.
     *
     * @param timeout how long to wait
     * @return the decoded frame
     * @throws InterruptedException  if interrupted while waiting
     * @throws IllegalStateException if nothing was sent in time
     */
    public Frame awaitSentFrame(Duration timeout) throws InterruptedException
    {
        String text = awaitSent(timeout);
        if (text == null)
        {
            throw new IllegalStateException("Nothing sent within " + timeout);
        }
        return FrameCodec.decode(text);
    }

    /**
     * Returns every message the client has sent, oldest first.
     *
     * @return the messages
     */
    public List<String> getSent()
    {
        return List.copyOf(sent);
    }

    public URI getUri()
    {
        return uri;
    }

    public State getState()
    {
        return state.get();
    }

    /**
     * Returns the code the channel closed with.
     *
     * @return the close code, or -1 while not closed
     */
    public int getCloseCode()
    {
        return closeCode;
    }

    public String getCloseReason()
    {
        return closeReason;
    }
}
