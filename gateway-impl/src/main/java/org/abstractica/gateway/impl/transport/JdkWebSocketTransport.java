package org.abstractica.gateway.impl.transport;

import org.abstractica.gateway.Transport;
import org.abstractica.gateway.TransportChannel;
import org.abstractica.gateway.TransportException;
import org.abstractica.gateway.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Transport over the JDK's {@link java.net.http.WebSocket} client.
 *
 * <p>Opening is asynchronous: {@link #open} returns a channel in the
 * connecting state and reports the outcome through the listener. Text
 * messages split across several frames are reassembled before delivery.</p>
 */
public class JdkWebSocketTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final int ABNORMAL_CLOSURE = 1006;
    private static final long CLOSE_GRACE_SECONDS = 5;

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkWebSocketTransport()
    {
        this(HttpClient.newHttpClient(), DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * Creates a transport on a caller-supplied HTTP client.
     *
     * @param httpClient     the client used to open WebSockets
     * @param connectTimeout the opening handshake timeout
     */
    public JdkWebSocketTransport(HttpClient httpClient, Duration connectTimeout)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public TransportChannel open(URI uri, TransportListener listener)
    {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(listener, "listener");

        Channel channel = new Channel(listener);
        LOG.debug("Opening WebSocket to {}", uri);
        httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, channel)
                .whenComplete((socket, error) ->
                {
                    if (error != null)
                    {
                        channel.failOpen(unwrap(error));
                    }
                });
        return channel;
    }

    private static Throwable unwrap(Throwable error)
    {
        if (error instanceof CompletionException && error.getCause() != null)
        {
            return error.getCause();
        }
        return error;
    }

    // ========== Channel ==========

    enum State
    {
        CONNECTING,
        OPEN,
        CLOSING,
        CLOSED
    }

    /**
     * One socket's view for the client plus the JDK listener feeding it.
     */
    static final class Channel implements TransportChannel, WebSocket.Listener
    {
        private final TransportListener listener;
        private final AtomicReference<State> state;
        private final AtomicBoolean closeReported;
        private final StringBuilder partial;
        private final Object sendLock;

        private volatile WebSocket socket;
        private CompletableFuture<WebSocket> sendChain;

        Channel(TransportListener listener)
        {
            this.listener = listener;
            this.state = new AtomicReference<>(State.CONNECTING);
            this.closeReported = new AtomicBoolean(false);
            this.partial = new StringBuilder();
            this.sendLock = new Object();
        }

        // ---------- TransportChannel ----------

        @Override
        public void send(String text)
        {
            WebSocket ws = socket;
            if (state.get() != State.OPEN || ws == null)
            {
                throw new TransportException("WebSocket is not open");
            }
            // The JDK rejects a sendText issued before the previous one completed.
            synchronized (sendLock)
            {
                CompletableFuture<WebSocket> previous =
                        sendChain == null ? CompletableFuture.completedFuture(ws) : sendChain;
                sendChain = previous
                        .exceptionally(error -> ws)
                        .thenCompose(w -> w.sendText(text, true))
                        .whenComplete((w, error) ->
                        {
                            if (error != null)
                            {
                                LOG.debug("WebSocket send failed", error);
                                listener.onError(new TransportException("WebSocket send failed", unwrap(error)));
                            }
                        });
            }
        }

        @Override
        public void close(int code, String reason)
        {
            State previous = state.getAndUpdate(s -> s == State.CLOSED ? s : State.CLOSING);
            if (previous == State.CLOSED || previous == State.CLOSING)
            {
                return;
            }
            WebSocket ws = socket;
            if (ws == null)
            {
                // Still opening: the socket is aborted once buildAsync delivers it.
                reportClose(code, reason);
                return;
            }
            ws.sendClose(code, reason == null ? "" : reason)
                    .orTimeout(CLOSE_GRACE_SECONDS, TimeUnit.SECONDS)
                    .whenComplete((w, error) ->
                    {
                        if (error != null)
                        {
                            LOG.debug("Close handshake failed, aborting", error);
                            ws.abort();
                        }
                    });
            reportClose(code, reason);
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

        // ---------- WebSocket.Listener ----------

        @Override
        public void onOpen(WebSocket webSocket)
        {
            socket = webSocket;
            if (!state.compareAndSet(State.CONNECTING, State.OPEN))
            {
                webSocket.abort();
                return;
            }
            webSocket.request(1);
            listener.onOpen();
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last)
        {
            String message = null;
            synchronized (partial)
            {
                partial.append(data);
                if (last)
                {
                    message = partial.toString();
                    partial.setLength(0);
                }
            }
            if (message != null && state.get() == State.OPEN)
            {
                listener.onMessage(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason)
        {
            state.set(State.CLOSED);
            reportClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error)
        {
            State previous = state.getAndSet(State.CLOSED);
            if (previous != State.CLOSED)
            {
                listener.onError(new TransportException("WebSocket error", error));
            }
            reportClose(ABNORMAL_CLOSURE, error.getMessage());
        }

        State state()
        {
            return state.get();
        }

        void failOpen(Throwable error)
        {
            if (state.compareAndSet(State.CONNECTING, State.CLOSED))
            {
                listener.onError(new TransportException("WebSocket open failed", error));
            }
            reportClose(ABNORMAL_CLOSURE, error.getMessage());
        }

        private void reportClose(int code, String reason)
        {
            state.set(State.CLOSED);
            if (closeReported.compareAndSet(false, true))
            {
                listener.onClose(code, reason == null ? "" : reason);
            }
        }
    }
}
