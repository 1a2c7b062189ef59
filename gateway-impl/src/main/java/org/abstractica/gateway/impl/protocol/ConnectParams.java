package org.abstractica.gateway.impl.protocol;

import org.abstractica.gateway.ClientIdentity;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of the {@code connect} handshake request.
 *
 * <p>Wire format:</p>
 * <pre>
 * {
 *   "minProtocol": 3, "maxProtocol": 3,
 *   "client": {"id", "displayName", "version", "platform", "mode"},
 *   "role": "operator", "scopes": [...], "caps": [...],
 *   "auth"?: {"token"?, "password"?},
 *   "locale": "en-US", "userAgent": "..."
 * }
 * </pre>
 *
 * @param minProtocol lowest protocol version the client speaks
 * @param maxProtocol highest protocol version the client speaks
 * @param client      client identity
 * @param role        requested role
 * @param scopes      requested scopes
 * @param caps        declared capabilities
 * @param auth        credentials, empty when none were configured
 * @param locale      locale tag
 * @param userAgent   user agent string
 */
public record ConnectParams(
        int minProtocol,
        int maxProtocol,
        ClientIdentity client,
        String role,
        List<String> scopes,
        List<String> caps,
        Optional<Auth> auth,
        String locale,
        String userAgent
)
{
    public ConnectParams
    {
        if (minProtocol > maxProtocol)
        {
            throw new IllegalArgumentException(
                    "minProtocol " + minProtocol + " exceeds maxProtocol " + maxProtocol);
        }
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(role, "role");
        scopes = List.copyOf(scopes);
        caps = List.copyOf(caps);
        Objects.requireNonNull(auth, "auth");
        Objects.requireNonNull(locale, "locale");
        Objects.requireNonNull(userAgent, "userAgent");
    }

    /**
     * Credentials block. Each member is present only if it was non-blank.
     *
     * @param token    bearer token
     * @param password password
     */
    public record Auth(Optional<String> token, Optional<String> password)
    {
        public Auth
        {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(password, "password");
        }

        /**
         * Builds the credentials block from raw settings.
         *
         * <p>Values are trimmed; blank values are dropped. If both end up
         * blank there is no block at all.</p>
         *
         * @param token    the token, may be null
         * @param password the password, may be null
         * @return the block, or empty if neither value is usable
         */
        public static Optional<Auth> of(String token, String password)
        {
            Optional<String> trimmedToken = trimToEmpty(token);
            Optional<String> trimmedPassword = trimToEmpty(password);
            if (trimmedToken.isEmpty() && trimmedPassword.isEmpty())
            {
                return Optional.empty();
            }
            return Optional.of(new Auth(trimmedToken, trimmedPassword));
        }

        private static Optional<String> trimToEmpty(String value)
        {
            if (value == null)
            {
                return Optional.empty();
            }
            String trimmed = value.trim();
            return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
        }
    }
}
