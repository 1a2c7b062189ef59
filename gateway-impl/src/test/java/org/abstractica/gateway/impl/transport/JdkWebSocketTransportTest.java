package org.abstractica.gateway.impl.transport;

import org.abstractica.gateway.TransportChannel;
import org.abstractica.gateway.TransportException;
import org.abstractica.gateway.TransportListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link JdkWebSocketTransport}.
 *
 * <p>The channel is driven through its {@link WebSocket.Listener} callbacks
 * with a recording {@link WebSocket} standing in for the JDK socket.</p>
 */
class JdkWebSocketTransportTest
{
    private RecordingListener listener;
    private JdkWebSocketTransport.Channel channel;
    private RecordingWebSocket socket;

    @BeforeEach
    void setUp()
    {
        listener = new RecordingListener();
        channel = new JdkWebSocketTransport.Channel(listener);
        socket = new RecordingWebSocket();
    }

    // ========== Opening ==========

    @Test
    void onOpen_reportsOpenAndRequestsFirstMessage()
    {
        assertTrue(channel.isConnecting());

        channel.onOpen(socket);

        assertTrue(channel.isOpen());
        assertEquals(List.of("open"), listener.calls);
        assertEquals(1, socket.requested);
    }

    @Test
    void failOpen_reportsErrorThenAbnormalClose()
    {
        channel.failOpen(new ConnectException("refused"));

        assertEquals(List.of("error:WebSocket open failed", "close:1006:refused"), listener.calls);
        assertEquals(JdkWebSocketTransport.State.CLOSED, channel.state());
    }

    @Test
    void open_unreachableGateway_reportsAbnormalClose() throws Exception
    {
        int port;
        try (ServerSocket reserved = new ServerSocket(0))
        {
            port = reserved.getLocalPort();
        }
        CountDownLatch closed = new CountDownLatch(1);
        RecordingListener remote = new RecordingListener()
        {
            @Override
            public void onClose(int code, String reason)
            {
                super.onClose(code, reason);
                closed.countDown();
            }
        };
        JdkWebSocketTransport transport = new JdkWebSocketTransport(HttpClient.newHttpClient(), Duration.ofSeconds(2));

        TransportChannel opened = transport.open(URI.create("ws://127.0.0.1:" + port + "/"), remote);

        assertTrue(closed.await(10, TimeUnit.SECONDS));
        assertFalse(opened.isOpen());
        assertTrue(remote.calls.get(0).startsWith("error:"));
        assertTrue(remote.calls.get(1).startsWith("close:1006:"));
    }

    // ========== Receiving ==========

    @Test
    void onText_reassemblesPartialMessages()
    {
        channel.onOpen(socket);

        channel.onText(socket, "{\"type\":", false);
        channel.onText(socket, "\"event\"}", true);
        channel.onText(socket, "next", true);

        assertEquals(List.of("open", "message:{\"type\":\"event\"}", "message:next"), listener.calls);
        assertEquals(4, socket.requested);
    }

    @Test
    void onText_afterCloseIsDropped()
    {
        channel.onOpen(socket);
        channel.onClose(socket, 1001, "going away");

        channel.onText(socket, "late", true);

        assertEquals(List.of("open", "close:1001:going away"), listener.calls);
    }

    @Test
    void onError_reportsErrorThenAbnormalClose()
    {
        channel.onOpen(socket);

        channel.onError(socket, new IOException("reset"));

        assertEquals(List.of("open", "error:WebSocket error", "close:1006:reset"), listener.calls);
        assertFalse(channel.isOpen());
    }

    // ========== Sending ==========

    @Test
    void send_beforeOpenFails()
    {
        assertThrows(TransportException.class, () -> channel.send("early"));
        assertTrue(socket.texts.isEmpty());
    }

    @Test
    void send_waitsForPreviousWrite()
    {
        socket.holdSends = true;
        channel.onOpen(socket);

        channel.send("a");
        channel.send("b");
        assertEquals(List.of("a"), socket.texts);

        socket.pending.get(0).complete(socket);
        assertEquals(List.of("a", "b"), socket.texts);
    }

    @Test
    void send_failureReportsErrorAndLaterSendsContinue()
    {
        socket.holdSends = true;
        channel.onOpen(socket);

        channel.send("a");
        channel.send("b");
        socket.pending.get(0).completeExceptionally(new IOException("broken pipe"));

        assertEquals(List.of("a", "b"), socket.texts);
        assertEquals(List.of("open", "error:WebSocket send failed"), listener.calls);
    }

    // ========== Closing ==========

    @Test
    void close_whenOpen_sendsCloseFrameAndReportsOnce()
    {
        channel.onOpen(socket);

        channel.close(4008, "connect failed");
        channel.close(1000, "again");
        channel.onClose(socket, 4008, "connect failed");

        assertEquals(4008, socket.closeCode);
        assertEquals("connect failed", socket.closeReason);
        assertEquals(List.of("open", "close:4008:connect failed"), listener.calls);
        assertFalse(socket.aborted);
        assertThrows(TransportException.class, () -> channel.send("after"));
    }

    @Test
    void close_failedCloseHandshakeAborts()
    {
        socket.closeResult = CompletableFuture.failedFuture(new IOException("peer gone"));
        channel.onOpen(socket);

        channel.close(1000, "client disconnect");

        assertTrue(socket.aborted);
        assertEquals(List.of("open", "close:1000:client disconnect"), listener.calls);
    }

    @Test
    void close_whileConnecting_abortsLateSocket()
    {
        channel.close(1000, "client disconnect");
        assertEquals(List.of("close:1000:client disconnect"), listener.calls);
        assertFalse(channel.isConnecting());

        channel.onOpen(socket);

        assertTrue(socket.aborted);
        assertFalse(channel.isOpen());
        assertEquals(List.of("close:1000:client disconnect"), listener.calls);
    }

    // ========== Helpers ==========

    private static class RecordingListener implements TransportListener
    {
        final List<String> calls = new CopyOnWriteArrayList<>();

        @Override
        public void onOpen()
        {
            calls.add("open");
        }

        @Override
        public void onMessage(String text)
        {
            calls.add("message:" + text);
        }

        @Override
        public void onError(Throwable error)
        {
            calls.add("error:" + error.getMessage());
        }

        @Override
        public void onClose(int code, String reason)
        {
            calls.add("close:" + code + ":" + reason);
        }
    }

    private static final class RecordingWebSocket implements WebSocket
    {
        final List<String> texts = new ArrayList<>();
        final List<CompletableFuture<WebSocket>> pending = new ArrayList<>();
        boolean holdSends;
        long requested;
        int closeCode = -1;
        String closeReason;
        boolean aborted;
        CompletableFuture<WebSocket> closeResult = CompletableFuture.completedFuture(this);

        @Override
        public CompletableFuture<WebSocket> sendText(CharSequence data, boolean last)
        {
            texts.add(data.toString());
            if (!holdSends)
            {
                return CompletableFuture.completedFuture(this);
            }
            CompletableFuture<WebSocket> result = new CompletableFuture<>();
            pending.add(result);
            return result;
        }

        @Override
        public CompletableFuture<WebSocket> sendBinary(ByteBuffer data, boolean last)
        {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendPing(ByteBuffer message)
        {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendPong(ByteBuffer message)
        {
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public CompletableFuture<WebSocket> sendClose(int statusCode, String reason)
        {
            closeCode = statusCode;
            closeReason = reason;
            return closeResult;
        }

        @Override
        public void request(long n)
        {
            requested += n;
        }

        @Override
        public String getSubprotocol()
        {
            return "";
        }

        @Override
        public boolean isOutputClosed()
        {
            return closeCode != -1;
        }

        @Override
        public boolean isInputClosed()
        {
            return false;
        }

        @Override
        public void abort()
        {
            aborted = true;
        }
    }
}
