package stargate.websocket;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Outbound side of a gateway connection.
 */
public interface FrameSender {
    void sendText(String text) throws IOException;

    void sendPing(ByteBuffer payload) throws IOException;

    void sendPong(ByteBuffer payload) throws IOException;
}
