package org.abstractica.gateway.impl.client;

import org.abstractica.gateway.ClientIdentity;
import org.abstractica.gateway.GatewayClient;
import org.abstractica.gateway.GatewayClientFactory;
import org.abstractica.gateway.Transport;
import org.abstractica.gateway.impl.protocol.ConnectParams;
import org.abstractica.gateway.impl.session.HandshakeNegotiator;
import org.abstractica.gateway.impl.transport.JdkWebSocketTransport;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Default implementation of GatewayClientFactory.
 */
public class DefaultGatewayClientFactory implements GatewayClientFactory
{
    public static final Duration DEFAULT_SETTLE_DELAY = Duration.ofMillis(750);
    public static final String DEFAULT_ROLE = "operator";
    public static final List<String> DEFAULT_SCOPES = List.of("operator.read", "operator.write");

    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private String url;
        private String token;
        private String password;
        private ClientIdentity identity = ClientIdentity.webchat();
        private String role = DEFAULT_ROLE;
        private List<String> scopes = DEFAULT_SCOPES;
        private List<String> caps = List.of();
        private String locale = Locale.getDefault().toLanguageTag();
        private String userAgent = defaultUserAgent(identity);
        private Duration settleDelay = DEFAULT_SETTLE_DELAY;
        private Transport transport; // Optional custom transport (defaults to JdkWebSocketTransport)
        private boolean enabled = true;

        @Override
        public Builder url(String url)
        {
            this.url = url;
            return this;
        }

        @Override
        public Builder token(String token)
        {
            this.token = token;
            return this;
        }

        @Override
        public Builder password(String password)
        {
            this.password = password;
            return this;
        }

        @Override
        public Builder identity(ClientIdentity identity)
        {
            this.identity = Objects.requireNonNull(identity, "identity");
            return this;
        }

        @Override
        public Builder role(String role)
        {
            this.role = Objects.requireNonNull(role, "role");
            return this;
        }

        @Override
        public Builder scopes(List<String> scopes)
        {
            this.scopes = List.copyOf(Objects.requireNonNull(scopes, "scopes"));
            return this;
        }

        @Override
        public Builder caps(List<String> caps)
        {
            this.caps = List.copyOf(Objects.requireNonNull(caps, "caps"));
            return this;
        }

        @Override
        public Builder locale(String locale)
        {
            this.locale = Objects.requireNonNull(locale, "locale");
            return this;
        }

        @Override
        public Builder userAgent(String userAgent)
        {
            this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
            return this;
        }

        @Override
        public Builder settleDelay(Duration settleDelay)
        {
            Objects.requireNonNull(settleDelay, "settleDelay");
            if (settleDelay.isNegative())
            {
                throw new IllegalArgumentException("Settle delay must not be negative: " + settleDelay);
            }
            this.settleDelay = settleDelay;
            return this;
        }

        @Override
        public Builder transport(Transport transport)
        {
            this.transport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        @Override
        public Builder enabled(boolean enabled)
        {
            this.enabled = enabled;
            return this;
        }

        @Override
        public Builder properties(Properties properties)
        {
            Objects.requireNonNull(properties, "properties");

            String value = properties.getProperty("gateway.url");
            if (value != null)
            {
                url(value);
            }
            value = properties.getProperty("gateway.token");
            if (value != null)
            {
                token(value);
            }
            value = properties.getProperty("gateway.password");
            if (value != null)
            {
                password(value);
            }
            value = properties.getProperty("gateway.role");
            if (value != null)
            {
                role(value.trim());
            }
            value = properties.getProperty("gateway.scopes");
            if (value != null)
            {
                scopes(splitList(value));
            }
            value = properties.getProperty("gateway.locale");
            if (value != null)
            {
                locale(value.trim());
            }
            value = properties.getProperty("gateway.settleDelayMs");
            if (value != null)
            {
                try
                {
                    settleDelay(Duration.ofMillis(Long.parseLong(value.trim())));
                }
                catch (NumberFormatException e)
                {
                    throw new IllegalArgumentException("Invalid gateway.settleDelayMs: " + value, e);
                }
            }
            return this;
        }

        @Override
        public GatewayClient build()
        {
            URI uri = parseUri(url);

            ConnectParams params = new ConnectParams(
                    HandshakeNegotiator.PROTOCOL_VERSION,
                    HandshakeNegotiator.PROTOCOL_VERSION,
                    identity,
                    role,
                    scopes,
                    caps,
                    ConnectParams.Auth.of(token, password),
                    locale,
                    userAgent);

            Transport t = (transport != null) ? transport : new JdkWebSocketTransport();

            return new DefaultGatewayClient(uri, t, params, settleDelay, enabled);
        }

        private static URI parseUri(String url)
        {
            if (url == null || url.isBlank())
            {
                return null;
            }
            try
            {
                URI uri = new URI(url.trim());
                if (uri.getScheme() == null || uri.getHost() == null)
                {
                    throw new IllegalArgumentException("Gateway URL needs a scheme and host: " + url);
                }
                return uri;
            }
            catch (URISyntaxException e)
            {
                throw new IllegalArgumentException("Invalid gateway URL: " + url, e);
            }
        }

        private static List<String> splitList(String value)
        {
            List<String> items = new ArrayList<>();
            for (String part : value.split(","))
            {
                String trimmed = part.trim();
                if (!trimmed.isEmpty())
                {
                    items.add(trimmed);
                }
            }
            return items;
        }

        private static String defaultUserAgent(ClientIdentity identity)
        {
            return "gateway-client/" + identity.version() + " Java/" + System.getProperty("java.version", "unknown");
        }
    }
}
