package org.abstractica.gateway.impl.session;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.gateway.HandshakeRejectedException;
import org.abstractica.gateway.RequestRejectedException;
import org.abstractica.gateway.impl.protocol.ConnectParams;
import org.abstractica.gateway.impl.protocol.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletionException;

/**
 * Sends the {@code connect} request that turns an open channel into a session.
 *
 * <p>One negotiator serves one channel and sends at most one handshake.
 * Later triggers, from the settle timer or a {@code connect.challenge}
 * event, are no-ops.</p>
 */
public class HandshakeNegotiator
{
    private static final Logger LOG = LoggerFactory.getLogger(HandshakeNegotiator.class);

    /**
     * The single protocol version this client speaks.
     */
    public static final int PROTOCOL_VERSION = 3;

    public static final String CONNECT_METHOD = "connect";

    /**
     * Close code used when the handshake fails.
     */
    public static final int CONNECT_FAILED_CODE = 4008;
    public static final String CONNECT_FAILED_REASON = "connect failed";

    /**
     * Receives the handshake outcome.
     */
    public interface Listener
    {
        /**
         * The gateway accepted the handshake.
         *
         * @param hello the response payload
         */
        void onAccepted(JsonNode hello);

        /**
         * The handshake was rejected or the channel was lost while it was in flight.
         *
         * @param error the failure
         */
        void onFailed(Throwable error);
    }

    private final ConnectParams params;
    private final RequestCorrelator correlator;
    private final Listener listener;
    private boolean sent;

    public HandshakeNegotiator(ConnectParams params, RequestCorrelator correlator, Listener listener)
    {
        this.params = Objects.requireNonNull(params, "params");
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Sends the handshake unless it was already sent.
     *
     * @return true if this call sent it
     */
    public boolean negotiate()
    {
        if (sent)
        {
            LOG.debug("Handshake already sent");
            return false;
        }
        sent = true;

        correlator.request(CONNECT_METHOD, FrameCodec.encode(params))
                .whenComplete((hello, error) ->
                {
                    if (error == null)
                    {
                        listener.onAccepted(hello);
                    }
                    else
                    {
                        listener.onFailed(translate(unwrap(error)));
                    }
                });
        return true;
    }

    /**
     * Returns true once the handshake has been sent.
     *
     * @return true if sent
     */
    public boolean isSent()
    {
        return sent;
    }

    private static Throwable translate(Throwable error)
    {
        if (error instanceof RequestRejectedException)
        {
            return new HandshakeRejectedException("handshake rejected: " + error.getMessage(), error);
        }
        return error;
    }

    private static Throwable unwrap(Throwable error)
    {
        if (error instanceof CompletionException && error.getCause() != null)
        {
            return error.getCause();
        }
        return error;
    }
}
