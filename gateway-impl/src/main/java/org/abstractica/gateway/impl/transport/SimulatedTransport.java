package org.abstractica.gateway.impl.transport;

import org.abstractica.gateway.Transport;
import org.abstractica.gateway.TransportChannel;
import org.abstractica.gateway.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory transport for tests and local development.
 *
 * <p>Each {@link #open} creates a {@link SimulatedChannel} that the test
 * drives from the gateway's side: accept the connection, deliver frames,
 * report errors, drop the link.</p>
 *
 * <pre>{@code
 * SimulatedTransport transport = new SimulatedTransport();
 * client.connect();
 *
 * SimulatedChannel channel = transport.awaitChannel(Duration.ofSeconds(5));
 * channel.accept();
 * channel.deliver("{\"type\":\"event\",\"event\":\"connect.challenge\"}");
 * String handshake = channel.awaitSent(Duration.ofSeconds(5));
 * }</pre>
 */
public class SimulatedTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedTransport.class);

    private final boolean autoAccept;
    private final List<SimulatedChannel> channels;
    private final BlockingQueue<SimulatedChannel> unclaimed;

    /**
     * Creates a transport whose channels wait for {@link SimulatedChannel#accept()}.
     */
    public SimulatedTransport()
    {
        this(false);
    }

    /**
     * Creates a transport.
     *
     * @param autoAccept if true, channels open immediately
     */
    public SimulatedTransport(boolean autoAccept)
    {
        this.autoAccept = autoAccept;
        this.channels = new CopyOnWriteArrayList<>();
        this.unclaimed = new LinkedBlockingQueue<>();
    }

    @Override
    public TransportChannel open(URI uri, TransportListener listener)
    {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(listener, "listener");

        SimulatedChannel channel = new SimulatedChannel(uri, listener);
        channels.add(channel);
        unclaimed.add(channel);
        LOG.debug("Simulated channel #{} opening to {}", channels.size(), uri);

        if (autoAccept)
        {
            channel.accept();
        }
        return channel;
    }

    /**
     * Waits for the next channel the client opens.
     *
     * @param timeout how long to wait
     * @return the channel
     * @throws InterruptedException  if interrupted while waiting
     * @throws IllegalStateException if no channel was opened in time
     */
    public SimulatedChannel awaitChannel(Duration timeout) throws InterruptedException
    {
        SimulatedChannel channel = unclaimed.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (channel == null)
        {
            throw new IllegalStateException("No channel opened within " + timeout);
        }
        return channel;
    }

    /**
     * Returns every channel opened so far, oldest first.
     *
     * @return the channels
     */
    public List<SimulatedChannel> getChannels()
    {
        return List.copyOf(channels);
    }

    /**
     * Returns how many channels have been opened.
     *
     * @return open count
     */
    public int getOpenCount()
    {
        return channels.size();
    }
}
