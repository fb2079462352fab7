package stargate.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stargate.common.ClientConfig;
import stargate.common.ConfigException;
import stargate.common.Header;
import stargate.common.TransportOption;
import stargate.common.TransportOptions;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw transport settings into the {@link TransportOptions} forwarded to the
 * socket layer.
 * <p>
 * Rules:
 * <ul>
 *   <li>Keys that are not a {@link TransportOption} are dropped.</li>
 *   <li>{@code extra_headers} may be one header, a list of headers, or a map of
 *       header name to value. A header is a {@link Header}, a map entry, a two-element
 *       list, or a map with exactly the keys {@code name} and {@code value}.</li>
 *   <li>{@code extra_headers} given more than once are concatenated in input order.</li>
 *   <li>{@code auth_token} is removed and becomes exactly one
 *       {@code Authorization: Bearer <token>} header, always the first header. If it is
 *       given more than once, the last token is used.</li>
 *   <li>Any other repeated key keeps its last value.</li>
 * </ul>
 */
public final class TransportOptionsBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TransportOptionsBuilder.class);

    private TransportOptionsBuilder() {
    }

    public static TransportOptions build(Map<String, ?> rawOptions) {
        return build(ClientConfig.toEntries("transport options", rawOptions));
    }

    /**
     * @param rawOptions ordered key/value settings; keys may repeat
     * @return the filtered options
     * @throws ConfigException if a recognized setting has a value of the wrong type
     */
    public static TransportOptions build(List<? extends Map.Entry<String, ?>> rawOptions) {
        EnumMap<TransportOption, Object> settings = new EnumMap<>(TransportOption.class);
        List<Header> headers = new ArrayList<>();
        boolean headersGiven = false;
        String authToken = null;

        for (Map.Entry<String, ?> raw : rawOptions) {
            TransportOption option = TransportOption.forKey(raw.getKey()).orElse(null);
            if (option == null) {
                logger.debug("Ignoring unsupported transport option {}", raw.getKey());
                continue;
            }
            Object value = raw.getValue();
            if (value == null) {
                logger.debug("Ignoring transport option {} without value", option);
                continue;
            }
            switch (option) {
                case AUTH_TOKEN:
                    authToken = toToken(value);
                    break;
                case EXTRA_HEADERS:
                    headers.addAll(toHeaders(value));
                    headersGiven = true;
                    break;
                case CACERTS:
                    settings.put(option, toPaths(value));
                    break;
                case INSECURE:
                    settings.put(option, toBoolean(option, value));
                    break;
                case SOCKET_CONNECT_TIMEOUT:
                case SOCKET_RECV_TIMEOUT:
                    settings.put(option, toMillis(option, value));
                    break;
                default:
                    throw new IllegalStateException("Unhandled transport option " + option);
            }
        }
        if (authToken != null) {
            headers.add(0, Header.bearer(authToken));
        }
        if (authToken != null || headersGiven) {
            settings.put(TransportOption.EXTRA_HEADERS, headers);
        }
        return TransportOptions.of(settings);
    }

    private static String toToken(Object value) {
        if (!(value instanceof String) || ((String) value).isEmpty()) {
            throw new ConfigException("auth_token must be a non-empty string");
        }
        return (String) value;
    }

    private static List<Header> toHeaders(Object value) {
        List<Header> headers = new ArrayList<>();
        if (isNameValuePair(value)) {
            headers.add(toHeader(value));
        } else if (value instanceof Map) {
            ((Map<?, ?>) value).forEach((k, v) -> headers.add(Header.of(String.valueOf(k), String.valueOf(v))));
        } else if (value instanceof List) {
            for (Object element : (List<?>) value) {
                headers.add(toHeader(element));
            }
        } else {
            headers.add(toHeader(value));
        }
        return headers;
    }

    private static Header toHeader(Object element) {
        if (element instanceof Header) {
            return (Header) element;
        }
        if (element instanceof Map.Entry) {
            Map.Entry<?, ?> entry = (Map.Entry<?, ?>) element;
            return Header.of(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
        }
        if (element instanceof List && ((List<?>) element).size() == 2) {
            List<?> pair = (List<?>) element;
            return Header.of(String.valueOf(pair.get(0)), String.valueOf(pair.get(1)));
        }
        if (isNameValuePair(element)) {
            Map<?, ?> map = (Map<?, ?>) element;
            return Header.of(String.valueOf(map.get("name")), String.valueOf(map.get("value")));
        }
        throw new ConfigException("Invalid extra_headers entry, expected a {name, value} pair: " + element);
    }

    // {"name": ..., "value": ...} is one header, not two
    private static boolean isNameValuePair(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        Map<?, ?> map = (Map<?, ?>) value;
        return map.size() == 2 && map.containsKey("name") && map.containsKey("value");
    }

    private static List<String> toPaths(Object value) {
        List<String> paths = new ArrayList<>();
        if (value instanceof List) {
            for (Object element : (List<?>) value) {
                paths.add(String.valueOf(element));
            }
        } else {
            paths.add(String.valueOf(value));
        }
        return paths;
    }

    private static Boolean toBoolean(TransportOption option, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if ("true".equalsIgnoreCase(String.valueOf(value))) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(String.valueOf(value))) {
            return Boolean.FALSE;
        }
        throw new ConfigException(option + " must be a boolean, got: " + value);
    }

    private static Long toMillis(TransportOption option, Object value) {
        long millis;
        if (value instanceof Number) {
            millis = ((Number) value).longValue();
        } else {
            try {
                millis = Long.parseLong(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                throw new ConfigException(option + " must be a number of milliseconds, got: " + value, e);
            }
        }
        if (millis < 0) {
            throw new ConfigException(option + " must not be negative, got: " + value);
        }
        return millis;
    }
}
