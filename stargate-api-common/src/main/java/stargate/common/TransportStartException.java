package stargate.common;

import java.io.IOException;

/**
 * The socket layer could not establish a connection to the gateway.
 */
public class TransportStartException extends IOException {
    public TransportStartException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransportStartException(String message) {
        super(message);
    }
}
