package stargate.websocket.client;

import jakarta.websocket.ClientEndpointConfig;
import jakarta.websocket.DeploymentException;
import jakarta.websocket.Session;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.http.HttpClientTransportOverHTTP;
import org.eclipse.jetty.io.ClientConnector;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.eclipse.jetty.websocket.core.client.WebSocketCoreClient;
import org.eclipse.jetty.websocket.jakarta.client.internal.JakartaWebSocketClientContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stargate.common.Header;
import stargate.common.TransportOptions;
import stargate.common.TransportStartException;
import stargate.websocket.FrameListener;
import stargate.websocket.GatewayConnection;
import stargate.websocket.GatewayEndpoint;
import stargate.websocket.GatewayTransport;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Method;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link GatewayTransport} on top of the Jetty implementation of the Jakarta websocket
 * client API.
 * <p>
 * Transport options are applied as follows:
 * <ul>
 *   <li>{@code extra_headers}: added to the upgrade request.</li>
 *   <li>{@code socket_connect_timeout}: connect timeout of the underlying HTTP client.</li>
 *   <li>{@code socket_recv_timeout}: maximum idle time of the session; no timeout if absent.</li>
 *   <li>{@code insecure}: any server certificate is trusted and host names are not verified.</li>
 *   <li>{@code cacerts}: the listed certificates replace the default trust store.</li>
 * </ul>
 * Connections with the same TLS and connect timeout settings share a websocket
 * container; all containers are stopped when the transport is closed.
 */
public class JakartaGatewayTransport implements GatewayTransport {
    private static final Logger logger = LoggerFactory.getLogger(JakartaGatewayTransport.class);

    private final Map<ContainerKey, JakartaWebSocketClientContainer> containers = new ConcurrentHashMap<>();
    private final Set<JakartaGatewayConnection> connections = ConcurrentHashMap.newKeySet();
    private volatile boolean closed = false;

    @Override
    public GatewayConnection connect(URI uri, TransportOptions options, FrameListener listener) throws TransportStartException {
        if (closed) {
            throw new TransportStartException("Transport is closed");
        }
        JakartaWebSocketClientContainer container = containerFor(new ContainerKey(options));
        ConnectionTracker tracker = new ConnectionTracker(listener);
        GatewayEndpoint endpoint = new GatewayEndpoint(tracker, options.getSocketRecvTimeoutMs().orElse(0L));
        ClientEndpointConfig config = ClientEndpointConfig.Builder.create()
                .configurator(new HeadersConfigurator(options.getExtraHeaders()))
                .build();
        Session session;
        try {
            session = container.connectToServer(endpoint, config, uri);
        } catch (DeploymentException | IOException e) {
            throw new TransportStartException("Failed to connect to " + uri + ": " + e.getMessage(), e);
        }
        JakartaGatewayConnection connection = new JakartaGatewayConnection(session, endpoint);
        tracker.connection = connection;
        connections.add(connection);
        logger.debug("{} Connected to {}", connection, uri);
        return connection;
    }

    private JakartaWebSocketClientContainer containerFor(ContainerKey key) throws TransportStartException {
        JakartaWebSocketClientContainer container = containers.get(key);
        if (container != null) {
            return container;
        }
        synchronized (containers) {
            container = containers.get(key);
            if (container == null) {
                container = createContainer(key);
                containers.put(key, container);
            }
            return container;
        }
    }

    private static JakartaWebSocketClientContainer createContainer(ContainerKey key) throws TransportStartException {
        SslContextFactory.Client sslContextFactory = new SslContextFactory.Client(key.insecure);
        if (key.insecure) {
            sslContextFactory.setEndpointIdentificationAlgorithm(null);
        }
        if (!key.cacerts.isEmpty()) {
            sslContextFactory.setTrustStore(loadTrustStore(key.cacerts));
        }
        ClientConnector clientConnector = new ClientConnector();
        clientConnector.setSslContextFactory(sslContextFactory);
        HttpClient httpClient = new HttpClient(new HttpClientTransportOverHTTP(clientConnector));
        key.connectTimeoutMs.ifPresent(httpClient::setConnectTimeout);

        JakartaWebSocketClientContainer container = new JakartaWebSocketClientContainer(httpClient);
        try {
            container.start();
            startCoreClient(container);
        } catch (Exception e) {
            throw new TransportStartException("Failed to start websocket container: " + e.getMessage(), e);
        }
        return container;
    }

    // The core client is created lazily on first use, and that lazy start is not safe when
    // several connections are opened concurrently from different threads. Start it eagerly.
    private static void startCoreClient(JakartaWebSocketClientContainer container) throws Exception {
        Method getWebSocketCoreClient = JakartaWebSocketClientContainer.class.getDeclaredMethod("getWebSocketCoreClient");
        getWebSocketCoreClient.setAccessible(true);
        WebSocketCoreClient coreClient = (WebSocketCoreClient) getWebSocketCoreClient.invoke(container);
        coreClient.start();
        int waits = 10;
        while (!coreClient.isStarted() && waits-- > 0) {
            logger.debug("Waiting for websocket core client to start (iterations left: {})", waits);
            Thread.sleep(100);
        }
    }

    private static KeyStore loadTrustStore(List<String> certificatePaths) throws TransportStartException {
        try {
            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            CertificateFactory certificateFactory = CertificateFactory.getInstance("X.509");
            int index = 0;
            for (String path : certificatePaths) {
                try (InputStream in = Files.newInputStream(Path.of(path))) {
                    Collection<? extends Certificate> certificates = certificateFactory.generateCertificates(in);
                    if (certificates.isEmpty()) {
                        throw new TransportStartException("No certificate found in " + path);
                    }
                    for (Certificate certificate : certificates) {
                        trustStore.setCertificateEntry("stargate-ca-" + index++, certificate);
                    }
                }
            }
            return trustStore;
        } catch (IOException | GeneralSecurityException e) {
            throw new TransportStartException("Failed to load CA certificates " + certificatePaths + ": " + e.getMessage(), e);
        }
    }

    // number of distinct client containers, one per TLS and connect timeout combination
    int containerCount() {
        return containers.size();
    }

    @Override
    public void close() {
        closed = true;
        for (JakartaGatewayConnection connection : Set.copyOf(connections)) {
            connection.close("Transport closed");
        }
        connections.clear();
        synchronized (containers) {
            for (JakartaWebSocketClientContainer container : containers.values()) {
                try {
                    container.stop();
                } catch (Exception e) {
                    logger.warn("Failed to stop websocket container {}", container, e);
                }
            }
            containers.clear();
        }
    }

    private static class HeadersConfigurator extends ClientEndpointConfig.Configurator {
        private final List<Header> headers;

        HeadersConfigurator(List<Header> headers) {
            this.headers = headers;
        }

        @Override
        public void beforeRequest(Map<String, List<String>> requestHeaders) {
            for (Header header : headers) {
                List<String> values = new ArrayList<>(requestHeaders.getOrDefault(header.getName(), List.of()));
                values.add(header.getValue());
                requestHeaders.put(header.getName(), values);
            }
        }
    }

    // Forgets connections once they are closed, so that the transport only closes live ones.
    private class ConnectionTracker implements FrameListener {
        private final FrameListener delegate;
        private volatile JakartaGatewayConnection connection;

        ConnectionTracker(FrameListener delegate) {
            this.delegate = Objects.requireNonNull(delegate);
        }

        @Override
        public void onText(String text) {
            delegate.onText(text);
        }

        @Override
        public void onPing(ByteBuffer payload) {
            delegate.onPing(payload);
        }

        @Override
        public void onPong(ByteBuffer payload) {
            delegate.onPong(payload);
        }

        @Override
        public void onClose(int code, String reason) {
            if (connection != null) {
                connections.remove(connection);
            }
            delegate.onClose(code, reason);
        }

        @Override
        public void onError(Throwable throwable) {
            delegate.onError(throwable);
        }
    }

    private static final class ContainerKey {
        private final List<String> cacerts;
        private final boolean insecure;
        private final Optional<Long> connectTimeoutMs;

        ContainerKey(TransportOptions options) {
            this.cacerts = options.getCacerts();
            this.insecure = options.isInsecure();
            this.connectTimeoutMs = options.getSocketConnectTimeoutMs();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ContainerKey that = (ContainerKey) o;
            return insecure == that.insecure && cacerts.equals(that.cacerts) && connectTimeoutMs.equals(that.connectTimeoutMs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cacerts, insecure, connectTimeoutMs);
        }
    }
}
