package stargate.websocket;

import stargate.common.TransportOptions;
import stargate.common.TransportStartException;

import java.net.URI;

/**
 * The socket layer: establishes websocket connections to the gateway.
 * <p>
 * Implementations apply the given {@link TransportOptions} (headers, TLS, timeouts)
 * and deliver the connection's inbound events to the listener.
 */
public interface GatewayTransport extends AutoCloseable {

    /**
     * Connects and blocks until the websocket handshake has completed.
     *
     * @param uri      the gateway endpoint
     * @param options  transport options
     * @param listener receives inbound frames and close/error events
     * @return the open connection
     * @throws TransportStartException if the connection could not be established
     */
    GatewayConnection connect(URI uri, TransportOptions options, FrameListener listener) throws TransportStartException;

    /**
     * Releases resources held by the transport. Connections it created are closed.
     */
    @Override
    void close();
}
