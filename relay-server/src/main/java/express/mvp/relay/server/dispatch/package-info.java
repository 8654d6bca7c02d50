/**
 * Message validation and routing.
 *
 * @see express.mvp.relay.server.dispatch.Dispatcher
 */
package express.mvp.relay.server.dispatch;
