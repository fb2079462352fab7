package stargate.websocket.client;

import jakarta.websocket.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stargate.websocket.CloseReasons;
import stargate.websocket.GatewayConnection;
import stargate.websocket.GatewayEndpoint;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * A gateway connection backed by a Jakarta websocket {@link Session}.
 * Sends are blocking and must not be issued concurrently; connection processes
 * only send from their event loop.
 */
class JakartaGatewayConnection implements GatewayConnection {
    private static final Logger logger = LoggerFactory.getLogger(JakartaGatewayConnection.class);

    private final Session session;
    private final GatewayEndpoint endpoint;

    JakartaGatewayConnection(Session session, GatewayEndpoint endpoint) {
        this.session = session;
        this.endpoint = endpoint;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void sendText(String text) throws IOException {
        session.getBasicRemote().sendText(text);
    }

    @Override
    public void sendPing(ByteBuffer payload) throws IOException {
        session.getBasicRemote().sendPing(payload);
    }

    @Override
    public void sendPong(ByteBuffer payload) throws IOException {
        session.getBasicRemote().sendPong(payload);
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            endpoint.closeSession(session, CloseReasons.normal(reason));
        } catch (IOException e) {
            logger.warn("Failed to close session {}", session.getId(), e);
        }
    }

    @Override
    public String toString() {
        return "{session=" + session.getId() + "}";
    }
}
