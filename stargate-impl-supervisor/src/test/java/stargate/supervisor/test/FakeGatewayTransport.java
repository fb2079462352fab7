package stargate.supervisor.test;

import stargate.common.TransportOptions;
import stargate.common.TransportStartException;
import stargate.websocket.FrameListener;
import stargate.websocket.GatewayConnection;
import stargate.websocket.GatewayTransport;

import java.net.URI;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * In-memory transport for supervision tests. Every connect succeeds immediately
 * unless refused; the gateway side of a connection can be closed by the test.
 */
public class FakeGatewayTransport implements GatewayTransport {
    private final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
    private final AtomicInteger ids = new AtomicInteger();
    private volatile Predicate<URI> refuse = uri -> false;
    private volatile boolean closed;

    @Override
    public GatewayConnection connect(URI uri, TransportOptions options, FrameListener listener) throws TransportStartException {
        if (refuse.test(uri)) {
            throw new TransportStartException("Connection refused: " + uri);
        }
        FakeConnection connection = new FakeConnection("fake-" + ids.incrementAndGet(), uri, listener);
        connections.add(connection);
        return connection;
    }

    public void refuseWhen(Predicate<URI> refuse) {
        this.refuse = refuse;
    }

    public List<FakeConnection> getConnections() {
        return connections;
    }

    /**
     * @return the most recent connection whose URL contains the given text
     */
    public Optional<FakeConnection> latest(String urlPart) {
        for (int i = connections.size() - 1; i >= 0; i--) {
            if (connections.get(i).getUri().toString().contains(urlPart)) {
                return Optional.of(connections.get(i));
            }
        }
        return Optional.empty();
    }

    public long openConnections() {
        return connections.stream().filter(FakeConnection::isOpen).count();
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public static class FakeConnection implements GatewayConnection {
        private final String id;
        private final URI uri;
        private final FrameListener listener;
        private final List<String> sentTexts = new CopyOnWriteArrayList<>();
        private volatile boolean open = true;

        FakeConnection(String id, URI uri, FrameListener listener) {
            this.id = id;
            this.uri = uri;
            this.listener = listener;
        }

        public URI getUri() {
            return uri;
        }

        public List<String> getSentTexts() {
            return sentTexts;
        }

        public void closeRemotely(int code, String reason) {
            open = false;
            listener.onClose(code, reason);
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close(String reason) {
            open = false;
        }

        @Override
        public void sendText(String text) {
            sentTexts.add(text);
        }

        @Override
        public void sendPing(ByteBuffer payload) {
        }

        @Override
        public void sendPong(ByteBuffer payload) {
        }

        @Override
        public String toString() {
            return id + " " + uri;
        }
    }
}
