package stargate.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Sends a ping every 30 seconds, and answers pings with pongs. Pongs are accepted
 * without further action; no round-trip times are tracked.
 * <p>
 * The keepalive keeps the connection from being considered idle by the gateway and
 * by proxies in between. A failed ping is only logged: if the connection is really
 * gone, the transport reports the closure or error and the connection process terminates.
 */
public class PingPongKeepAlive implements KeepAlive {
    private static final Logger logger = LoggerFactory.getLogger(PingPongKeepAlive.class);

    public static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(30);

    private final long pingIntervalMs;

    public PingPongKeepAlive() {
        this(DEFAULT_PING_INTERVAL);
    }

    public PingPongKeepAlive(Duration pingInterval) {
        this.pingIntervalMs = Objects.requireNonNull(pingInterval).toMillis();
        if (pingIntervalMs <= 0) {
            throw new IllegalArgumentException("pingInterval must be positive");
        }
    }

    public Duration getPingInterval() {
        return Duration.ofMillis(pingIntervalMs);
    }

    @Override
    public void onConnect(FrameSender sender, ScheduledExecutorService eventLoop) {
        eventLoop.scheduleAtFixedRate(() -> sendPing(sender), pingIntervalMs, pingIntervalMs, TimeUnit.MILLISECONDS);
    }

    private void sendPing(FrameSender sender) {
        try {
            if (logger.isTraceEnabled()) {
                logger.trace("Sending ping on {}", sender);
            }
            sender.sendPing(ByteBuffer.allocate(0));
        } catch (IOException | RuntimeException e) {
            // must not escape, or the scheduler silently cancels all further pings
            logger.warn("Failed to send ping on {}", sender, e);
        }
    }

    @Override
    public void onPing(FrameSender sender, ByteBuffer payload) {
        try {
            sender.sendPong(payload);
        } catch (IOException e) {
            logger.warn("Failed to answer ping on {}", sender, e);
        }
    }

    @Override
    public void onPong(ByteBuffer payload) {
        if (logger.isTraceEnabled()) {
            logger.trace("Pong received ({} bytes)", payload.remaining());
        }
    }
}
