/**
 * Gateway client API module.
 *
 * <p>Provides interfaces for a persistent gateway session carrying
 * request/response calls and server-pushed events over one socket.</p>
 */
module gateway.api
{
    requires transitive com.fasterxml.jackson.databind;
    requires org.slf4j;

    exports org.abstractica.gateway;
    exports org.abstractica.gateway.handlers;
}
