package stargate.websocket;

import jakarta.websocket.CloseReason;
import jakarta.websocket.Endpoint;
import jakarta.websocket.EndpointConfig;
import jakarta.websocket.MessageHandler;
import jakarta.websocket.PongMessage;
import jakarta.websocket.Session;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;

/**
 * Jakarta websocket endpoint that forwards the events of one gateway connection to a
 * {@link FrameListener}.
 * <p>
 * Closing a session is a two-way handshake: the closing side sends a close frame and
 * waits for the peer's answer before dropping the TCP connection. Behind some
 * proxies (observed with nginx ingress controllers on Kubernetes), the TCP connection
 * is gone before the answer arrives, and Jetty then reports a
 * {@link ClosedChannelException} instead of a normal closure. This endpoint detects
 * that case after a locally initiated close and reports the closure the client asked
 * for. The listener's {@code onClose} is called exactly once.
 * <p>
 * Sessions must be closed with {@link #closeSession(Session, CloseReason)} for the
 * detection to work.
 * <p>
 * Inbound pings are answered by the container; the Jakarta API does not expose them,
 * so only text messages and pongs reach the listener.
 */
public class GatewayEndpoint extends Endpoint {

    private final FrameListener listener;
    private final long maxIdleTimeoutMs;

    private volatile CloseReason localCloseReason;
    private volatile boolean closed = false;

    /**
     * @param listener         receives the connection events
     * @param maxIdleTimeoutMs idle timeout of the session; 0 disables it
     */
    public GatewayEndpoint(FrameListener listener, long maxIdleTimeoutMs) {
        this.listener = Objects.requireNonNull(listener);
        this.maxIdleTimeoutMs = maxIdleTimeoutMs;
    }

    @Override
    public void onOpen(Session session, EndpointConfig config) {
        // 0 means no timeout; liveness is ensured by the keepalive pings
        session.setMaxIdleTimeout(maxIdleTimeoutMs);
        // anonymous classes rather than lambdas: Jetty resolves the message type from the handler's generic interface
        session.addMessageHandler(String.class, new MessageHandler.Whole<String>() {
            @Override
            public void onMessage(String text) {
                listener.onText(text);
            }
        });
        session.addMessageHandler(PongMessage.class, new MessageHandler.Whole<PongMessage>() {
            @Override
            public void onMessage(PongMessage pong) {
                listener.onPong(pong.getApplicationData());
            }
        });
    }

    /**
     * Closes the session, remembering the reason in case the close handshake is cut short.
     */
    public final void closeSession(Session session, CloseReason closeReason) throws IOException {
        this.localCloseReason = closeReason;
        session.close(closeReason);
    }

    @Override
    public final void onError(Session session, Throwable throwable) {
        if (throwable instanceof ClosedChannelException && localCloseReason != null) {
            onClose(session, localCloseReason);
        } else {
            listener.onError(throwable);
        }
    }

    @Override
    public final void onClose(Session session, CloseReason closeReason) {
        // a second call follows the workaround in onError; the first one wins
        if (!closed) {
            closed = true;
            String phrase = closeReason.getReasonPhrase();
            listener.onClose(closeReason.getCloseCode().getCode(), phrase == null ? "" : phrase);
        }
    }
}
