package stargate.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable key/value arguments of one client connection.
 * <p>
 * Role arguments as supplied by the caller carry the topic coordinates and any
 * role-specific settings; once merged with the shared client settings by the
 * planner, they additionally carry the host, protocol, transport options and the
 * registry the connection registers itself in.
 */
public final class RoleArgs {
    public static final String HOST = "host";
    public static final String PROTOCOL = "protocol";
    public static final String PERSISTENCE = "persistence";
    public static final String TENANT = "tenant";
    public static final String NAMESPACE = "namespace";
    public static final String TOPIC = "topic";
    public static final String SUBSCRIPTION = "subscription";
    public static final String QUERY_PARAMS = "query_params";
    public static final String HANDLER = "handler";
    public static final String TRANSPORT_OPTS = "transport_opts";
    public static final String REGISTRY = "registry";

    private static final RoleArgs EMPTY = new RoleArgs(Collections.emptyMap());

    private final Map<String, Object> values;

    private RoleArgs(Map<String, Object> values) {
        this.values = values;
    }

    public static RoleArgs empty() {
        return EMPTY;
    }

    public static RoleArgs of(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "argument name must not be null"), v));
        return new RoleArgs(Collections.unmodifiableMap(copy));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String key) {
        return values.get(key) != null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Optional<Object> find(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public <T> Optional<T> find(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            throw new ConfigException("Argument " + key + " must be of type " + type.getSimpleName()
                    + ", got " + value.getClass().getSimpleName());
        }
        return Optional.of(type.cast(value));
    }

    /**
     * Returns the string form of a scalar argument, or the default if absent.
     */
    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    /**
     * Returns the string form of a required scalar argument.
     *
     * @throws ConfigException if the argument is absent or empty
     */
    public String requireString(String key) {
        String value = getString(key, null);
        if (value == null || value.isEmpty()) {
            throw ConfigException.missing(key);
        }
        return value;
    }

    /**
     * Merges {@code other} into this argument set. Keys present in only one set are
     * kept; for keys present in both, {@code resolver} receives the key, this set's
     * value and {@code other}'s value and returns the value to keep. Keys keep the
     * position of their first occurrence.
     */
    public RoleArgs merge(RoleArgs other, MergeResolver resolver) {
        Map<String, Object> merged = new LinkedHashMap<>(values);
        other.values.forEach((key, value) -> {
            if (merged.containsKey(key)) {
                merged.put(key, resolver.resolve(key, merged.get(key), value));
            } else {
                merged.put(key, value);
            }
        });
        return new RoleArgs(Collections.unmodifiableMap(merged));
    }

    @FunctionalInterface
    public interface MergeResolver {
        Object resolve(String key, Object ownValue, Object otherValue);
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, Object value) {
            values.put(key, value);
            return this;
        }

        public Builder tenant(String tenant) {
            return put(TENANT, tenant);
        }

        public Builder namespace(String namespace) {
            return put(NAMESPACE, namespace);
        }

        public Builder topic(String topic) {
            return put(TOPIC, topic);
        }

        public Builder persistence(String persistence) {
            return put(PERSISTENCE, persistence);
        }

        public Builder subscription(String subscription) {
            return put(SUBSCRIPTION, subscription);
        }

        public Builder queryParams(Map<String, ?> queryParams) {
            return put(QUERY_PARAMS, queryParams);
        }

        public Builder handler(Object handler) {
            return put(HANDLER, handler);
        }

        public RoleArgs build() {
            return RoleArgs.of(values);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((RoleArgs) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RoleArgs" + values;
    }
}
