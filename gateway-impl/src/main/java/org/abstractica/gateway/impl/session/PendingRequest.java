package org.abstractica.gateway.impl.session;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A sent request waiting for its response.
 *
 * @param id        the request identifier
 * @param method    the method name
 * @param future    completed by the response or failed on close
 * @param createdAt when the request was sent
 */
public record PendingRequest(
        String id,
        String method,
        CompletableFuture<JsonNode> future,
        Instant createdAt
)
{
    public PendingRequest
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(future, "future");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
