package stargate.websocket;

import java.nio.ByteBuffer;

/**
 * Inbound events of a gateway connection. Transports may invoke these methods from
 * their own threads; implementations are expected to hand them over to their event loop.
 */
public interface FrameListener {
    void onText(String text);

    void onPing(ByteBuffer payload);

    void onPong(ByteBuffer payload);

    /**
     * The connection was closed, by either side. Called at most once.
     *
     * @param code   websocket close code
     * @param reason close reason phrase, possibly empty
     */
    void onClose(int code, String reason);

    void onError(Throwable throwable);
}
