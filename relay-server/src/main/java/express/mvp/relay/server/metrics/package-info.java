/** Server-wide counters, logged when the server stops. */
package express.mvp.relay.server.metrics;
