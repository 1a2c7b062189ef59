/**
 * Gateway client implementation module.
 *
 * <p>Provides the default implementation of the gateway client API.</p>
 */
module gateway.impl
{
    requires gateway.api;
    requires com.fasterxml.jackson.databind;
    requires java.net.http;
    requires org.slf4j;

    // Export factory implementation for external use
    exports org.abstractica.gateway.impl.client;
    exports org.abstractica.gateway.impl.transport;

    // Export frame codec for tools that speak the wire format
    exports org.abstractica.gateway.impl.protocol;
}
