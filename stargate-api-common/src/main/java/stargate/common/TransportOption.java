package stargate.common;

import java.util.Optional;

/**
 * The transport settings that are passed on to the socket layer. Any other
 * configuration key given as a transport option is ignored.
 * <p>
 * The declaration order is the order in which settings appear in a built
 * {@link TransportOptions}.
 */
public enum TransportOption {
    /** Bearer token; converted into an {@code Authorization} header and never forwarded itself. */
    AUTH_TOKEN("auth_token"),
    /** Paths of trusted X.509 certificates (PEM or DER). */
    CACERTS("cacerts"),
    /** Trust any server certificate and skip hostname verification. */
    INSECURE("insecure"),
    /** Connect timeout in milliseconds. */
    SOCKET_CONNECT_TIMEOUT("socket_connect_timeout"),
    /** Idle (receive) timeout in milliseconds. */
    SOCKET_RECV_TIMEOUT("socket_recv_timeout"),
    /** Additional upgrade request headers. */
    EXTRA_HEADERS("extra_headers");

    private final String key;

    TransportOption(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<TransportOption> forKey(String key) {
        for (TransportOption option : values()) {
            if (option.key.equals(key)) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return key;
    }
}
