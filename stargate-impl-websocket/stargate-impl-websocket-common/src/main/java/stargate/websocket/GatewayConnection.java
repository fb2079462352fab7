package stargate.websocket;

/**
 * An established websocket connection to the gateway.
 */
public interface GatewayConnection extends FrameSender, AutoCloseable {

    String getId();

    boolean isOpen();

    /**
     * Closes the connection normally. Failures are logged, not thrown, since the
     * connection is being discarded anyway.
     *
     * @param reason close reason phrase; truncated if too long for a close frame
     */
    void close(String reason);

    @Override
    default void close() {
        close("Client closed");
    }
}
