package stargate.common;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete configuration of one client instance: where the gateway is, how to talk
 * to it, and which producer, consumer and reader connections to maintain.
 * <p>
 * Example, as a map tree:
 * <pre>
 * name: orders
 * host: broker:8080
 * protocol: ws
 * transport_opts: {auth_token: ..., socket_connect_timeout: 5000}
 * producer:
 *   - {tenant: public, namespace: default, topic: orders}
 *   - {tenant: public, namespace: default, topic: audit}
 * consumer: {tenant: public, namespace: default, topic: orders, subscription: billing}
 * </pre>
 */
public final class ClientConfig {
    public static final String DEFAULT_NAME = "default";
    public static final String DEFAULT_PROTOCOL = "ws";

    public static final String NAME = "name";
    public static final String HOST = "host";
    public static final String PROTOCOL = "protocol";
    public static final String TRANSPORT_OPTS = "transport_opts";
    public static final String PRODUCER = "producer";
    public static final String CONSUMER = "consumer";
    public static final String READER = "reader";

    private final String name;
    private final Object host;
    private final String protocol;
    private final List<Map.Entry<String, Object>> transportOptions;
    private final RoleSection producer;
    private final RoleSection consumer;
    private final RoleSection reader;

    private ClientConfig(Builder builder) {
        this.name = builder.name != null ? builder.name : DEFAULT_NAME;
        this.host = builder.host;
        this.protocol = builder.protocol != null ? builder.protocol : DEFAULT_PROTOCOL;
        this.transportOptions = Collections.unmodifiableList(new ArrayList<>(builder.transportOptions));
        this.producer = builder.producer;
        this.consumer = builder.consumer;
        this.reader = builder.reader;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a configuration from a generic map tree, as produced e.g. by a JSON or
     * YAML parser. Role sections may be maps, or (producer only) lists of maps.
     *
     * @param tree configuration tree
     * @return the configuration
     * @throws ConfigException if the tree has the wrong shape
     */
    public static ClientConfig fromMap(Map<String, ?> tree) {
        Builder builder = builder();
        Object name = tree.get(NAME);
        if (name != null) {
            builder.name(String.valueOf(name));
        }
        builder.host(tree.get(HOST));
        Object protocol = tree.get(PROTOCOL);
        if (protocol != null) {
            builder.protocol(String.valueOf(protocol));
        }
        Object transportOpts = tree.get(TRANSPORT_OPTS);
        if (transportOpts != null) {
            builder.transportOptions(toEntries(TRANSPORT_OPTS, transportOpts));
        }
        builder.producer(toSection(PRODUCER, tree.get(PRODUCER)));
        builder.consumer(toSection(CONSUMER, tree.get(CONSUMER)));
        builder.reader(toSection(READER, tree.get(READER)));
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private static RoleSection toSection(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof RoleSection) {
            return (RoleSection) value;
        }
        if (value instanceof RoleArgs) {
            return RoleSection.one((RoleArgs) value);
        }
        if (value instanceof Map) {
            return RoleSection.one(RoleArgs.of((Map<String, ?>) value));
        }
        if (value instanceof List) {
            List<RoleArgs> args = new ArrayList<>();
            for (Object element : (List<?>) value) {
                if (element instanceof RoleArgs) {
                    args.add((RoleArgs) element);
                } else if (element instanceof Map) {
                    args.add(RoleArgs.of((Map<String, ?>) element));
                } else {
                    throw new ConfigException("Entries of " + key + " must be maps, got: " + element);
                }
            }
            return RoleSection.many(args);
        }
        throw new ConfigException(key + " must be a map or a list of maps, got: " + value);
    }

    /**
     * Converts a map or a key/value list into an ordered entry list. Repeated keys
     * are kept.
     */
    @SuppressWarnings("unchecked")
    public static List<Map.Entry<String, Object>> toEntries(String key, Object value) {
        List<Map.Entry<String, Object>> entries = new ArrayList<>();
        if (value instanceof Map) {
            ((Map<String, Object>) value).forEach((k, v) -> entries.add(new AbstractMap.SimpleImmutableEntry<>(k, v)));
        } else if (value instanceof List) {
            for (Object element : (List<?>) value) {
                if (element instanceof Map.Entry) {
                    Map.Entry<?, ?> entry = (Map.Entry<?, ?>) element;
                    entries.add(new AbstractMap.SimpleImmutableEntry<>(String.valueOf(entry.getKey()), entry.getValue()));
                } else if (element instanceof Map) {
                    ((Map<String, Object>) element).forEach((k, v) -> entries.add(new AbstractMap.SimpleImmutableEntry<>(k, v)));
                } else {
                    throw new ConfigException("Entries of " + key + " must be key/value pairs, got: " + element);
                }
            }
        } else {
            throw new ConfigException(key + " must be a map or a list of key/value pairs, got: " + value);
        }
        return entries;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the host as configured; a {@code "host:port"} string, a {@link HostAddress}, or {@code null}
     */
    public Object getHost() {
        return host;
    }

    public String getProtocol() {
        return protocol;
    }

    public List<Map.Entry<String, Object>> getTransportOptions() {
        return transportOptions;
    }

    public Optional<RoleSection> getProducer() {
        return Optional.ofNullable(producer);
    }

    public Optional<RoleSection> getConsumer() {
        return Optional.ofNullable(consumer);
    }

    public Optional<RoleSection> getReader() {
        return Optional.ofNullable(reader);
    }

    @Override
    public String toString() {
        return "ClientConfig{" +
                "name='" + name + '\'' +
                ", host=" + host +
                ", protocol='" + protocol + '\'' +
                ", producer=" + producer +
                ", consumer=" + consumer +
                ", reader=" + reader +
                '}';
    }

    public static final class Builder {
        private String name;
        private Object host;
        private String protocol;
        private final List<Map.Entry<String, Object>> transportOptions = new ArrayList<>();
        private RoleSection producer;
        private RoleSection consumer;
        private RoleSection reader;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder host(String host, int port) {
            this.host = HostAddress.of(host, port);
            return this;
        }

        /**
         * Sets the host in any of the accepted shapes; the shape is validated when the
         * connection settings are built.
         */
        public Builder host(Object host) {
            this.host = host;
            return this;
        }

        public Builder protocol(String protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder transportOption(String key, Object value) {
            transportOptions.add(new AbstractMap.SimpleImmutableEntry<>(Objects.requireNonNull(key), value));
            return this;
        }

        public Builder transportOptions(List<Map.Entry<String, Object>> options) {
            options.forEach(e -> transportOption(e.getKey(), e.getValue()));
            return this;
        }

        public Builder producer(RoleArgs args) {
            return producer(RoleSection.one(args));
        }

        public Builder producers(List<RoleArgs> args) {
            return producer(RoleSection.many(args));
        }

        public Builder producer(RoleSection section) {
            this.producer = section;
            return this;
        }

        public Builder consumer(RoleArgs args) {
            return consumer(RoleSection.one(args));
        }

        public Builder consumer(RoleSection section) {
            this.consumer = section;
            return this;
        }

        public Builder reader(RoleArgs args) {
            return reader(RoleSection.one(args));
        }

        public Builder reader(RoleSection section) {
            this.reader = section;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
