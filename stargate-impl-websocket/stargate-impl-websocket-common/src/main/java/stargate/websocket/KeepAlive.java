package stargate.websocket;

import java.nio.ByteBuffer;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Connection keepalive policy, attached by a connection process to its own event loop.
 * <p>
 * All methods are called on the connection's event loop. Timers must be scheduled on
 * that loop so that they end together with the connection process.
 */
public interface KeepAlive {

    /**
     * Called once the websocket handshake has completed.
     *
     * @param sender    outbound side of the connection
     * @param eventLoop the connection's event loop
     */
    void onConnect(FrameSender sender, ScheduledExecutorService eventLoop);

    void onPing(FrameSender sender, ByteBuffer payload);

    void onPong(ByteBuffer payload);
}
