/**
 * Blocking client for the relay protocol, used by tools and integration tests.
 */
package express.mvp.relay.transport.client;
