/**
 * The relay server process: configuration, startup, connection wiring and graceful shutdown.
 *
 * @see express.mvp.relay.server.RelayServer
 * @see express.mvp.relay.server.RelayServerMain
 */
package express.mvp.relay.server;
