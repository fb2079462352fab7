package stargate.websocket.client;

/**
 * Role-specific handling of a connection's inbound text messages.
 * <p>
 * Handlers run on the connection's event loop, one message at a time. Ping and pong
 * frames never reach a handler. An exception thrown by a handler terminates the
 * connection process, which is then restarted by its supervisor.
 */
public interface ConnectionHandler {

    /**
     * Called on the event loop once the connection is established, before any message.
     */
    default void onConnect(ConnectionProcess connection) throws Exception {
    }

    void onMessage(ConnectionProcess connection, String message) throws Exception;
}
