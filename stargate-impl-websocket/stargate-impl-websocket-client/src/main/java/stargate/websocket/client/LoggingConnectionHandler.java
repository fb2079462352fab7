package stargate.websocket.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handler used when none is configured: inbound messages are logged and otherwise ignored.
 */
public class LoggingConnectionHandler implements ConnectionHandler {
    private static final Logger logger = LoggerFactory.getLogger(LoggingConnectionHandler.class);

    @Override
    public void onMessage(ConnectionProcess connection, String message) {
        logger.debug("{} Received message: {}", connection, message);
    }
}
