package stargate.connection;

import stargate.common.ClientConfig;
import stargate.common.ClientRole;
import stargate.common.ConfigException;
import stargate.common.ConnectionSettings;
import stargate.common.HostAddress;
import stargate.common.InvalidHostFormatException;
import stargate.common.MissingSubscriptionException;
import stargate.common.RoleArgs;

import java.util.List;
import java.util.Map;

/**
 * Derives the gateway endpoint of a connection from its arguments.
 * <p>
 * The gateway parses the path positionally, so the segment order and separators
 * produced here must not change:
 * <pre>
 * {protocol}://{host}/ws/v2/{role}/{persistence}/{tenant}/{namespace}/{topic}[/{subscription}][?{query}]
 * </pre>
 * The subscription segment is only present for consumers.
 */
public final class ConnectionSettingsBuilder {
    public static final String DEFAULT_PERSISTENCE = "persistent";
    public static final String GATEWAY_PATH_PREFIX = "/ws/v2/";

    private ConnectionSettingsBuilder() {
    }

    /**
     * Builds the connection settings of a connection with the given role.
     *
     * @param args       connection arguments; {@code host}, {@code tenant}, {@code namespace}
     *                   and {@code topic} are required, {@code subscription} too for consumers
     * @param role       the client role
     * @param extraQuery query string without the leading {@code ?}; may be {@code null} or empty
     * @return the settings
     * @throws ConfigException if a required argument is missing or the host is malformed
     */
    public static ConnectionSettings build(RoleArgs args, ClientRole role, String extraQuery) {
        Object rawHost = args.get(RoleArgs.HOST);
        if (rawHost == null) {
            throw ConfigException.missing(RoleArgs.HOST);
        }
        String host = formatHost(rawHost);
        String protocol = args.getString(RoleArgs.PROTOCOL, ClientConfig.DEFAULT_PROTOCOL);
        String persistence = args.getString(RoleArgs.PERSISTENCE, DEFAULT_PERSISTENCE);
        String tenant = args.requireString(RoleArgs.TENANT);
        String namespace = args.requireString(RoleArgs.NAMESPACE);
        String topic = args.requireString(RoleArgs.TOPIC);

        StringBuilder url = new StringBuilder()
                .append(protocol).append("://").append(host)
                .append(GATEWAY_PATH_PREFIX).append(role.getPathSegment())
                .append('/').append(persistence)
                .append('/').append(tenant)
                .append('/').append(namespace)
                .append('/').append(topic);
        if (role == ClientRole.CONSUMER) {
            String subscription = args.getString(RoleArgs.SUBSCRIPTION, null);
            if (subscription == null || subscription.isEmpty()) {
                throw new MissingSubscriptionException();
            }
            url.append('/').append(subscription);
        }
        if (extraQuery != null && !extraQuery.isEmpty()) {
            url.append('?').append(extraQuery);
        }
        return new ConnectionSettings(url.toString(), host, protocol, persistence, tenant, namespace, topic);
    }

    /**
     * Renders a host given as {@code "host:port"}, as a {@link HostAddress}, as a
     * host/port map entry, or as a one-element list of either pair form, to the
     * canonical {@code "host:port"} string.
     *
     * @param host the configured host
     * @return the canonical string
     * @throws InvalidHostFormatException for any other shape
     */
    public static String formatHost(Object host) {
        if (host instanceof String) {
            if (((String) host).isEmpty()) {
                throw new InvalidHostFormatException(host);
            }
            return (String) host;
        }
        if (host instanceof List && ((List<?>) host).size() == 1) {
            return formatPair(((List<?>) host).get(0), host);
        }
        return formatPair(host, host);
    }

    private static String formatPair(Object pair, Object original) {
        if (pair instanceof HostAddress) {
            return pair.toString();
        }
        if (pair instanceof Map.Entry) {
            Map.Entry<?, ?> entry = (Map.Entry<?, ?>) pair;
            if (entry.getKey() instanceof String && entry.getValue() instanceof Number) {
                try {
                    return HostAddress.of((String) entry.getKey(), ((Number) entry.getValue()).intValue()).toString();
                } catch (IllegalArgumentException e) {
                    throw new InvalidHostFormatException(original);
                }
            }
        }
        throw new InvalidHostFormatException(original);
    }
}
