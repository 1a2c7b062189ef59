package org.abstractica.gateway;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

/**
 * Factory for creating GatewayClient instances.
 *
 * <p>Use the builder to configure the client before creation:</p>
 * <pre>{@code
 * GatewayClientFactory factory = new DefaultGatewayClientFactory();
 * GatewayClient client = factory.builder()
 *     .url("ws://localhost:18789")
 *     .token(token)
 *     .build();
 * }</pre>
 */
public interface GatewayClientFactory
{
    /**
     * Creates a new client builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a GatewayClient.
     */
    interface Builder
    {
        /**
         * Sets the gateway address, e.g. {@code ws://localhost:18789}.
         *
         * <p>A client without a URL can be built but never connects.</p>
         *
         * @param url the gateway URL
         * @return this builder
         */
        Builder url(String url);

        /**
         * Sets the bearer token sent in the handshake. Blank means none.
         *
         * @param token the token, may be null
         * @return this builder
         */
        Builder token(String token);

        /**
         * Sets the password sent in the handshake. Blank means none.
         *
         * @param password the password, may be null
         * @return this builder
         */
        Builder password(String password);

        /**
         * Sets how the client introduces itself.
         *
         * <p>Optional. Defaults to {@link ClientIdentity#webchat()}.</p>
         *
         * @param identity the identity
         * @return this builder
         */
        Builder identity(ClientIdentity identity);

        /**
         * Sets the requested role. Defaults to {@code operator}.
         *
         * @param role the role
         * @return this builder
         */
        Builder role(String role);

        /**
         * Sets the requested scopes. Defaults to
         * {@code operator.read, operator.write}.
         *
         * @param scopes the scopes
         * @return this builder
         */
        Builder scopes(List<String> scopes);

        /**
         * Sets the declared capabilities. Defaults to none.
         *
         * @param caps the capabilities
         * @return this builder
         */
        Builder caps(List<String> caps);

        /**
         * Sets the locale tag. Defaults to the JVM's default locale.
         *
         * @param locale the locale tag, e.g. {@code en-US}
         * @return this builder
         */
        Builder locale(String locale);

        /**
         * Sets the user agent string.
         *
         * @param userAgent the user agent
         * @return this builder
         */
        Builder userAgent(String userAgent);

        /**
         * Sets the pause between the socket opening and the handshake.
         *
         * <p>Optional. Defaults to 750 ms. A {@code connect.challenge} event
         * from the gateway cuts the pause short.</p>
         *
         * @param settleDelay the delay
         * @return this builder
         */
        Builder settleDelay(Duration settleDelay);

        /**
         * Sets the transport used to reach the gateway.
         *
         * <p>Optional. Defaults to a WebSocket transport.</p>
         *
         * @param transport the transport
         * @return this builder
         */
        Builder transport(Transport transport);

        /**
         * Sets whether the client starts enabled. Defaults to true.
         *
         * @param enabled the setting
         * @return this builder
         */
        Builder enabled(boolean enabled);

        /**
         * Applies settings from properties.
         *
         * <p>Recognized keys: {@code gateway.url}, {@code gateway.token},
         * {@code gateway.password}, {@code gateway.role},
         * {@code gateway.scopes} (comma separated), {@code gateway.locale},
         * {@code gateway.settleDelayMs}. Absent keys leave the current
         * setting unchanged.</p>
         *
         * @param properties the properties
         * @return this builder
         * @throws IllegalArgumentException if a value cannot be parsed
         */
        Builder properties(Properties properties);

        /**
         * Builds the client.
         *
         * @return the configured client
         * @throws IllegalArgumentException if the URL is not a valid URI
         */
        GatewayClient build();
    }
}
