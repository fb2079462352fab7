package stargate.common;

import java.util.Objects;

/**
 * The resolved wire endpoint of a single gateway connection, together with the
 * values it was derived from.
 * <p>
 * Instances are immutable. The URL is a pure function of the other fields, the
 * client role, the subscription (consumers only) and the query string, so building
 * settings twice from the same input yields equal objects with identical URLs.
 */
public final class ConnectionSettings {
    private final String url;
    private final String host;
    private final String protocol;
    private final String persistence;
    private final String tenant;
    private final String namespace;
    private final String topic;

    public ConnectionSettings(String url, String host, String protocol, String persistence,
                              String tenant, String namespace, String topic) {
        this.url = Objects.requireNonNull(url);
        this.host = Objects.requireNonNull(host);
        this.protocol = Objects.requireNonNull(protocol);
        this.persistence = Objects.requireNonNull(persistence);
        this.tenant = Objects.requireNonNull(tenant);
        this.namespace = Objects.requireNonNull(namespace);
        this.topic = Objects.requireNonNull(topic);
    }

    public String getUrl() {
        return url;
    }

    public String getHost() {
        return host;
    }

    public String getProtocol() {
        return protocol;
    }

    public String getPersistence() {
        return persistence;
    }

    public String getTenant() {
        return tenant;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getTopic() {
        return topic;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConnectionSettings that = (ConnectionSettings) o;
        return url.equals(that.url) && host.equals(that.host) && protocol.equals(that.protocol)
                && persistence.equals(that.persistence) && tenant.equals(that.tenant)
                && namespace.equals(that.namespace) && topic.equals(that.topic);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, host, protocol, persistence, tenant, namespace, topic);
    }

    @Override
    public String toString() {
        return "ConnectionSettings{" +
                "url='" + url + '\'' +
                ", host='" + host + '\'' +
                ", protocol='" + protocol + '\'' +
                ", persistence='" + persistence + '\'' +
                ", tenant='" + tenant + '\'' +
                ", namespace='" + namespace + '\'' +
                ", topic='" + topic + '\'' +
                '}';
    }
}
