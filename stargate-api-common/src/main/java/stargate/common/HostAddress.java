package stargate.common;

import java.util.Objects;

/**
 * An address/port pair identifying a gateway node.
 */
public final class HostAddress {
    private final String host;
    private final int port;

    public HostAddress(String host, int port) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        if (host.isEmpty()) {
            throw new IllegalArgumentException("host must not be empty");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        this.port = port;
    }

    public static HostAddress of(String host, int port) {
        return new HostAddress(host, port);
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HostAddress that = (HostAddress) o;
        return port == that.port && host.equals(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    /**
     * @return the canonical {@code host:port} form
     */
    @Override
    public String toString() {
        return host + ":" + port;
    }
}
