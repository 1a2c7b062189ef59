/**
 * Demo client module.
 *
 * <p>An interactive console over a live gateway connection.</p>
 */
module demo.client
{
    requires gateway.api;
    requires gateway.impl;
    requires com.fasterxml.jackson.databind;
    requires org.slf4j;
}
