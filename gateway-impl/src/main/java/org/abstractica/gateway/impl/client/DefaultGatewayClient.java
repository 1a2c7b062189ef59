package org.abstractica.gateway.impl.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.gateway.ConnectionClosedException;
import org.abstractica.gateway.ConnectionState;
import org.abstractica.gateway.GatewayCallbacks;
import org.abstractica.gateway.GatewayClient;
import org.abstractica.gateway.MalformedFrameException;
import org.abstractica.gateway.NotConnectedException;
import org.abstractica.gateway.Transport;
import org.abstractica.gateway.TransportChannel;
import org.abstractica.gateway.TransportException;
import org.abstractica.gateway.TransportListener;
import org.abstractica.gateway.handlers.CloseHandler;
import org.abstractica.gateway.handlers.ErrorHandler;
import org.abstractica.gateway.handlers.EventHandler;
import org.abstractica.gateway.handlers.HelloHandler;
import org.abstractica.gateway.impl.protocol.ConnectParams;
import org.abstractica.gateway.impl.protocol.EventFrame;
import org.abstractica.gateway.impl.protocol.Frame;
import org.abstractica.gateway.impl.protocol.FrameCodec;
import org.abstractica.gateway.impl.protocol.RequestFrame;
import org.abstractica.gateway.impl.protocol.ResponseFrame;
import org.abstractica.gateway.impl.session.HandshakeNegotiator;
import org.abstractica.gateway.impl.session.RequestCorrelator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of the GatewayClient interface.
 *
 * <p>Owns one transport channel per connection attempt, sequences the
 * handshake, and routes inbound frames to the request correlator or the
 * event dispatcher.</p>
 *
 * <p>All session state is confined to a single event loop thread. Caller
 * calls, transport callbacks and the settle timer are queued onto it, so
 * they never interleave.</p>
 */
public class DefaultGatewayClient implements GatewayClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultGatewayClient.class);

    static final int NORMAL_CLOSURE = 1000;
    static final String CLIENT_DISCONNECT_REASON = "client disconnect";
    static final String DEFAULT_CLOSE_REASON = "closed";

    private final URI uri;
    private final Transport transport;
    private final ConnectParams connectParams;
    private final Duration settleDelay;
    private final EventDispatcher dispatcher;
    private final ScheduledExecutorService eventLoop;

    private volatile boolean enabled;
    private volatile boolean closed;
    private volatile ConnectionState state;

    // Event loop only
    private ConnectionAttempt current;
    private long attemptCounter;

    /**
     * Creates a new client.
     *
     * @param uri           the gateway address, or null if none is configured
     * @param transport     the transport to open channels with
     * @param connectParams the handshake parameters
     * @param settleDelay   pause between channel open and handshake
     * @param enabled       whether the client starts enabled
     */
    DefaultGatewayClient(
            URI uri,
            Transport transport,
            ConnectParams connectParams,
            Duration settleDelay,
            boolean enabled
    )
    {
        this.uri = uri;
        this.transport = Objects.requireNonNull(transport, "transport");
        this.connectParams = Objects.requireNonNull(connectParams, "connectParams");
        this.settleDelay = Objects.requireNonNull(settleDelay, "settleDelay");
        this.enabled = enabled;
        this.dispatcher = new EventDispatcher();
        this.state = ConnectionState.IDLE;

        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable ->
        {
            Thread thread = Executors.defaultThreadFactory().newThread(runnable);
            thread.setName("gateway-client-loop");
            thread.setDaemon(true);
            return thread;
        });
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        this.eventLoop = executor;
    }

    // ========== GatewayClient Interface ==========

    @Override
    public void connect()
    {
        if (closed)
        {
            throw new IllegalStateException("Gateway client is closed");
        }
        runOnLoop(this::openConnection);
    }

    @Override
    public void disconnect()
    {
        if (closed)
        {
            return;
        }
        runOnLoop(this::closeConnection);
    }

    @Override
    public void setEnabled(boolean enabled)
    {
        this.enabled = enabled;
        if (enabled)
        {
            connect();
        }
        else
        {
            disconnect();
        }
    }

    @Override
    public void close()
    {
        if (closed)
        {
            return;
        }
        closed = true;
        enabled = false;
        runOnLoop(this::closeConnection);
        eventLoop.shutdown();
    }

    @Override
    public CompletableFuture<JsonNode> send(String method, Object params)
    {
        Objects.requireNonNull(method, "method");

        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        try
        {
            eventLoop.execute(() -> sendOnLoop(method, params, result));
        }
        catch (RejectedExecutionException e)
        {
            result.completeExceptionally(new NotConnectedException("gateway client is closed"));
        }
        return result;
    }

    @Override
    public CompletableFuture<JsonNode> request(String method, Object params)
    {
        return send(method, params);
    }

    @Override
    public void setCallbacks(GatewayCallbacks callbacks)
    {
        dispatcher.setCallbacks(callbacks);
    }

    @Override
    public void onEvent(EventHandler handler)
    {
        dispatcher.update(callbacks -> callbacks.withEvent(handler));
    }

    @Override
    public void onHello(HelloHandler handler)
    {
        dispatcher.update(callbacks -> callbacks.withHello(handler));
    }

    @Override
    public void onClose(CloseHandler handler)
    {
        dispatcher.update(callbacks -> callbacks.withClose(handler));
    }

    @Override
    public void onError(ErrorHandler handler)
    {
        dispatcher.update(callbacks -> callbacks.withError(handler));
    }

    @Override
    public ConnectionState getState()
    {
        return state;
    }

    @Override
    public boolean isConnected()
    {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * Returns a future that completes once every task queued before this
     * call has run on the event loop.
     *
     * @return the future
     */
    CompletableFuture<Void> flush()
    {
        return CompletableFuture.runAsync(() -> {}, eventLoop);
    }

    // ========== Connection Lifecycle ==========

    private void openConnection()
    {
        if (!enabled)
        {
            LOG.debug("Connect ignored: client disabled");
            return;
        }
        if (uri == null)
        {
            LOG.debug("Connect ignored: no gateway URL");
            return;
        }
        if (current != null && current.isLive())
        {
            LOG.debug("Connect ignored: {} still active", current);
            return;
        }

        ConnectionAttempt attempt = new ConnectionAttempt(++attemptCounter);
        current = attempt;
        state = ConnectionState.CONNECTING;

        LOG.info("Connecting to {} ({})", uri, attempt);

        TransportChannel channel;
        try
        {
            channel = transport.open(uri, new AttemptListener(attempt));
        }
        catch (RuntimeException e)
        {
            LOG.warn("Failed to open transport to {}: {}", uri, e.getMessage());
            current = null;
            state = ConnectionState.CLOSED;
            attempt.markClosed();
            attempt.markCloseReported();
            dispatcher.fireError(new TransportException("Failed to open transport", e));
            dispatcher.fireClose(e.getMessage() != null ? e.getMessage() : DEFAULT_CLOSE_REASON);
            return;
        }

        RequestCorrelator correlator = new RequestCorrelator(channel);
        HandshakeNegotiator handshake = new HandshakeNegotiator(
                connectParams, correlator, new HandshakeOutcome(attempt));
        attempt.bind(channel, correlator, handshake);
    }

    private void closeConnection()
    {
        ConnectionAttempt attempt = current;
        if (attempt == null)
        {
            LOG.debug("Disconnect ignored: no transport");
            return;
        }

        LOG.info("Disconnecting from {} ({})", uri, attempt);

        current = null;
        state = ConnectionState.CLOSED;
        attempt.cancelSettleTimer();
        attempt.markClosed();

        if (attempt.isBound())
        {
            attempt.channel().close(NORMAL_CLOSURE, CLIENT_DISCONNECT_REASON);
            attempt.correlator().purgeAll(
                    new ConnectionClosedException(NORMAL_CLOSURE, CLIENT_DISCONNECT_REASON));
        }

        if (attempt.markCloseReported())
        {
            dispatcher.fireClose(CLIENT_DISCONNECT_REASON);
        }
    }

    private void sendOnLoop(String method, Object params, CompletableFuture<JsonNode> result)
    {
        ConnectionAttempt attempt = current;
        if (attempt == null || !attempt.isBound())
        {
            result.completeExceptionally(new NotConnectedException());
            return;
        }

        attempt.correlator().request(method, params).whenComplete((payload, error) ->
        {
            if (error == null)
            {
                result.complete(payload);
            }
            else
            {
                result.completeExceptionally(error);
            }
        });
    }

    // ========== Handshake ==========

    private void triggerHandshake(ConnectionAttempt attempt)
    {
        if (attempt != current || attempt.isClosed())
        {
            return;
        }

        attempt.cancelSettleTimer();
        if (attempt.handshake().negotiate())
        {
            LOG.debug("Handshake sent ({})", attempt);
        }
    }

    /**
     * Applies the handshake result to the attempt it was sent on.
     */
    private final class HandshakeOutcome implements HandshakeNegotiator.Listener
    {
        private final ConnectionAttempt attempt;

        private HandshakeOutcome(ConnectionAttempt attempt)
        {
            this.attempt = attempt;
        }

        @Override
        public void onAccepted(JsonNode hello)
        {
            if (attempt != current || attempt.isClosed())
            {
                LOG.debug("Ignoring hello for stale {}", attempt);
                return;
            }

            state = ConnectionState.CONNECTED;
            LOG.info("Gateway session established ({})", attempt);
            dispatcher.fireHello(hello);
        }

        @Override
        public void onFailed(Throwable error)
        {
            if (attempt != current)
            {
                LOG.debug("Ignoring handshake failure for stale {}: {}", attempt, error.getMessage());
                return;
            }

            LOG.warn("Gateway handshake failed ({}): {}", attempt, error.getMessage());
            state = ConnectionState.CLOSED;
            attempt.cancelSettleTimer();
            dispatcher.fireClose(error.getMessage());

            TransportChannel channel = attempt.channel();
            if (channel.isOpen() || channel.isConnecting())
            {
                channel.close(HandshakeNegotiator.CONNECT_FAILED_CODE, HandshakeNegotiator.CONNECT_FAILED_REASON);
            }
        }
    }

    // ========== Transport Events ==========

    private void handleOpen(ConnectionAttempt attempt)
    {
        if (attempt != current || attempt.isClosed())
        {
            LOG.debug("Closing channel of stale {}", attempt);
            attempt.channel().close(NORMAL_CLOSURE, CLIENT_DISCONNECT_REASON);
            return;
        }

        state = ConnectionState.HANDSHAKING;
        LOG.debug("Transport open ({}), handshake in {} ms", attempt, settleDelay.toMillis());

        attempt.setSettleTimer(eventLoop.schedule(
                () -> triggerHandshake(attempt),
                settleDelay.toMillis(),
                TimeUnit.MILLISECONDS));
    }

    private void handleMessage(ConnectionAttempt attempt, String text)
    {
        if (attempt != current)
        {
            LOG.debug("Dropping message for stale {}", attempt);
            return;
        }

        Frame frame;
        try
        {
            frame = FrameCodec.decode(text);
        }
        catch (MalformedFrameException e)
        {
            LOG.debug("Dropping malformed frame: {}", e.getMessage());
            return;
        }

        if (frame instanceof EventFrame event)
        {
            if (event.isChallenge())
            {
                LOG.debug("Handshake challenge received ({})", attempt);
                triggerHandshake(attempt);
            }
            else
            {
                dispatcher.fireEvent(event.event(), event.payload());
            }
        }
        else if (frame instanceof ResponseFrame response)
        {
            if (!attempt.correlator().complete(response))
            {
                LOG.debug("No pending request for response {}", response.id());
            }
        }
        else if (frame instanceof RequestFrame request)
        {
            LOG.debug("Ignoring server request {} ({})", request.method(), request.id());
        }
    }

    private void handleError(ConnectionAttempt attempt, Throwable error)
    {
        if (attempt != current)
        {
            LOG.debug("Ignoring transport error for stale {}: {}", attempt, error.getMessage());
            return;
        }

        LOG.warn("Transport error ({}): {}", attempt, error.getMessage());
        TransportException failure = (error instanceof TransportException te)
                ? te
                : new TransportException("Transport error", error);
        dispatcher.fireError(failure);
    }

    private void handleClose(ConnectionAttempt attempt, int code, String reason)
    {
        attempt.cancelSettleTimer();
        attempt.markClosed();

        // Pending requests fail before the close notification goes out
        int failed = attempt.isBound()
                ? attempt.correlator().purgeAll(new ConnectionClosedException(code, reason))
                : 0;

        String closeReason = (reason == null || reason.isEmpty()) ? DEFAULT_CLOSE_REASON : reason;

        if (attempt != current)
        {
            // Superseded by a newer connect() before its close arrived: report it, leave state alone
            if (attempt.markCloseReported())
            {
                LOG.info("Gateway connection closed ({}, superseded): code={} reason={} pending={}",
                        attempt, code, reason, failed);
                dispatcher.fireClose(closeReason);
            }
            else
            {
                LOG.debug("Closed stale {} ({} pending failed)", attempt, failed);
            }
            return;
        }

        current = null;
        state = ConnectionState.CLOSED;
        attempt.markCloseReported();

        LOG.info("Gateway connection closed ({}): code={} reason={} pending={}", attempt, code, reason, failed);
        dispatcher.fireClose(closeReason);
    }

    // ========== Helpers ==========

    private void runOnLoop(Runnable task)
    {
        try
        {
            eventLoop.execute(task);
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Event loop stopped, task dropped");
        }
    }

    /**
     * Queues one attempt's transport events onto the event loop.
     */
    private final class AttemptListener implements TransportListener
    {
        private final ConnectionAttempt attempt;

        private AttemptListener(ConnectionAttempt attempt)
        {
            this.attempt = attempt;
        }

        @Override
        public void onOpen()
        {
            runOnLoop(() -> handleOpen(attempt));
        }

        @Override
        public void onMessage(String text)
        {
            runOnLoop(() -> handleMessage(attempt, text));
        }

        @Override
        public void onError(Throwable error)
        {
            runOnLoop(() -> handleError(attempt, error));
        }

        @Override
        public void onClose(int code, String reason)
        {
            runOnLoop(() -> handleClose(attempt, code, reason));
        }
    }
}
