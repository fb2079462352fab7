package stargate.common;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Filtered transport settings for one gateway connection, in {@link TransportOption}
 * declaration order.
 * <p>
 * An auth token never appears here: it has already been turned into the first entry
 * of {@link #getExtraHeaders()}.
 */
public final class TransportOptions {
    private static final TransportOptions EMPTY = new TransportOptions(new EnumMap<>(TransportOption.class));

    private final EnumMap<TransportOption, Object> settings;

    private TransportOptions(EnumMap<TransportOption, Object> settings) {
        this.settings = settings;
    }

    public static TransportOptions empty() {
        return EMPTY;
    }

    /**
     * Creates options from already normalized values. Values must have the types
     * returned by the typed getters of this class.
     *
     * @param settings normalized settings
     * @return the options
     * @throws IllegalArgumentException if {@link TransportOption#AUTH_TOKEN} is present
     */
    public static TransportOptions of(Map<TransportOption, ?> settings) {
        if (settings.containsKey(TransportOption.AUTH_TOKEN)) {
            throw new IllegalArgumentException("auth_token must be converted to an Authorization header");
        }
        EnumMap<TransportOption, Object> copy = new EnumMap<>(TransportOption.class);
        settings.forEach((option, value) -> {
            if (option == TransportOption.EXTRA_HEADERS || option == TransportOption.CACERTS) {
                copy.put(option, List.copyOf((List<?>) value));
            } else {
                copy.put(option, Objects.requireNonNull(value, option.getKey()));
            }
        });
        return copy.isEmpty() ? EMPTY : new TransportOptions(copy);
    }

    public boolean contains(TransportOption option) {
        return settings.containsKey(option);
    }

    public boolean isEmpty() {
        return settings.isEmpty();
    }

    @SuppressWarnings("unchecked")
    public List<String> getCacerts() {
        return (List<String>) settings.getOrDefault(TransportOption.CACERTS, List.of());
    }

    public boolean isInsecure() {
        return (Boolean) settings.getOrDefault(TransportOption.INSECURE, Boolean.FALSE);
    }

    public Optional<Long> getSocketConnectTimeoutMs() {
        return Optional.ofNullable((Long) settings.get(TransportOption.SOCKET_CONNECT_TIMEOUT));
    }

    public Optional<Long> getSocketRecvTimeoutMs() {
        return Optional.ofNullable((Long) settings.get(TransportOption.SOCKET_RECV_TIMEOUT));
    }

    @SuppressWarnings("unchecked")
    public List<Header> getExtraHeaders() {
        return (List<Header>) settings.getOrDefault(TransportOption.EXTRA_HEADERS, List.of());
    }

    /**
     * Returns the settings as an ordered key/value list, as forwarded to the socket layer.
     *
     * @return unmodifiable list of entries
     */
    public List<Map.Entry<TransportOption, Object>> asList() {
        List<Map.Entry<TransportOption, Object>> entries = new ArrayList<>(settings.size());
        settings.forEach((k, v) -> entries.add(new AbstractMap.SimpleImmutableEntry<>(k, v)));
        return Collections.unmodifiableList(entries);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return settings.equals(((TransportOptions) o).settings);
    }

    @Override
    public int hashCode() {
        return settings.hashCode();
    }

    @Override
    public String toString() {
        return "TransportOptions" + settings;
    }
}
