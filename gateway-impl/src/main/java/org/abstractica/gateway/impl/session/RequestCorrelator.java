package org.abstractica.gateway.impl.session;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.gateway.NotConnectedException;
import org.abstractica.gateway.RequestRejectedException;
import org.abstractica.gateway.TransportChannel;
import org.abstractica.gateway.TransportException;
import org.abstractica.gateway.impl.protocol.FrameCodec;
import org.abstractica.gateway.impl.protocol.RequestFrame;
import org.abstractica.gateway.impl.protocol.ResponseFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Turns a transport channel into request/response calls.
 *
 * <p>Each request gets a fresh identifier and a pending entry. The entry is
 * removed before its future completes, so every request completes exactly
 * once: by its response, or by {@link #purgeAll(Throwable)} when the channel
 * goes away. One correlator serves one channel.</p>
 *
 * <p>Requests have no timeout; an unanswered request stays pending until the
 * channel closes.</p>
 */
public class RequestCorrelator
{
    private static final Logger LOG = LoggerFactory.getLogger(RequestCorrelator.class);

    private final TransportChannel channel;
    private final Supplier<String> idGenerator;
    private final Map<String, PendingRequest> pending;

    /**
     * Creates a correlator issuing random UUID identifiers.
     *
     * @param channel the channel to send requests on
     */
    public RequestCorrelator(TransportChannel channel)
    {
        this(channel, () -> UUID.randomUUID().toString());
    }

    /**
     * Creates a correlator with a custom identifier source.
     *
     * @param channel     the channel to send requests on
     * @param idGenerator produces request identifiers
     */
    public RequestCorrelator(TransportChannel channel, Supplier<String> idGenerator)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.pending = new ConcurrentHashMap<>();
    }

    // ========== Sending ==========

    /**
     * Sends a request.
     *
     * @param method the method name
     * @param params the parameters, or null
     * @return a future for the response payload
     */
    public CompletableFuture<JsonNode> request(String method, Object params)
    {
        Objects.requireNonNull(method, "method");

        if (!channel.isOpen())
        {
            return CompletableFuture.failedFuture(new NotConnectedException());
        }

        JsonNode tree;
        try
        {
            tree = FrameCodec.toTree(params);
        }
        catch (IllegalArgumentException e)
        {
            return CompletableFuture.failedFuture(e);
        }

        String id = idGenerator.get();
        PendingRequest entry = new PendingRequest(id, method, new CompletableFuture<>(), Instant.now());
        if (pending.putIfAbsent(id, entry) != null)
        {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Duplicate request id: " + id));
        }

        try
        {
            channel.send(FrameCodec.encode(new RequestFrame(id, method, tree)));
        }
        catch (RuntimeException e)
        {
            pending.remove(id);
            TransportException failure = (e instanceof TransportException te)
                    ? te
                    : new TransportException("Failed to send " + method, e);
            entry.future().completeExceptionally(failure);
            return entry.future();
        }

        LOG.debug("Sent request {} ({})", method, id);
        return entry.future();
    }

    // ========== Completion ==========

    /**
     * Completes the pending request a response belongs to.
     *
     * @param response the response
     * @return true if a pending request matched
     */
    public boolean complete(ResponseFrame response)
    {
        if (response.ok())
        {
            return resolve(response.id(), response.payload());
        }
        String message = response.errorMessage() != null
                ? response.errorMessage()
                : ResponseFrame.DEFAULT_ERROR_MESSAGE;
        return reject(response.id(), message);
    }

    /**
     * Resolves a pending request. Unknown identifiers are ignored.
     *
     * @param id      the request identifier
     * @param payload the result
     * @return true if a pending request matched
     */
    public boolean resolve(String id, JsonNode payload)
    {
        PendingRequest entry = pending.remove(id);
        if (entry == null)
        {
            return false;
        }
        entry.future().complete(payload);
        return true;
    }

    /**
     * Rejects a pending request. Unknown identifiers are ignored.
     *
     * @param id      the request identifier
     * @param message the failure description from the gateway
     * @return true if a pending request matched
     */
    public boolean reject(String id, String message)
    {
        PendingRequest entry = pending.remove(id);
        if (entry == null)
        {
            return false;
        }
        entry.future().completeExceptionally(new RequestRejectedException(entry.method(), message));
        return true;
    }

    /**
     * Fails every pending request.
     *
     * @param error the failure to report
     * @return the number of requests failed
     */
    public int purgeAll(Throwable error)
    {
        List<PendingRequest> purged = new ArrayList<>();
        for (String id : List.copyOf(pending.keySet()))
        {
            PendingRequest entry = pending.remove(id);
            if (entry != null)
            {
                purged.add(entry);
            }
        }

        for (PendingRequest entry : purged)
        {
            entry.future().completeExceptionally(error);
        }

        if (!purged.isEmpty())
        {
            LOG.debug("Failed {} pending request(s): {}", purged.size(), error.getMessage());
        }
        return purged.size();
    }

    /**
     * Returns the number of requests awaiting a response.
     *
     * @return pending count
     */
    public int pendingCount()
    {
        return pending.size();
    }
}
