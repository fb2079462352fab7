package stargate.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stargate.common.ClientRole;
import stargate.common.ConfigException;
import stargate.common.RoleArgs;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders the role-specific {@code query_params} of a connection into the query
 * string understood by the gateway.
 * <p>
 * Parameters appear in a fixed order per role, regardless of the order in which
 * they were configured, so that the resulting URL is reproducible. Keys the gateway
 * does not know for the given role are dropped.
 */
public final class QueryParams {
    private static final Logger logger = LoggerFactory.getLogger(QueryParams.class);

    private static final Map<String, String> PRODUCER = ordered(
            "send_timeout", "sendTimeoutMillis",
            "batch_enabled", "batchingEnabled",
            "batch_max_msg", "batchingMaxMessages",
            "max_pending_msg", "maxPendingMessages",
            "batch_max_delay", "batchingMaxPublishDelay",
            "routing_mode", "messageRoutingMode",
            "compression_type", "compressionType",
            "name", "producerName",
            "initial_seq_id", "initialSequenceId",
            "hashing_scheme", "hashingScheme");

    private static final Map<String, String> CONSUMER = ordered(
            "ack_timeout", "ackTimeoutMillis",
            "subscription_type", "subscriptionType",
            "queue_size", "receiverQueueSize",
            "name", "consumerName",
            "priority", "priorityLevel",
            "max_redeliver_count", "maxRedeliverCount",
            "dead_letter_topic", "deadLetterTopic",
            "pull_mode", "pullMode");

    private static final Map<String, String> READER = ordered(
            "name", "readerName",
            "queue_size", "receiverQueueSize",
            "starting_message", "messageId");

    private QueryParams() {
    }

    /**
     * @param role the client role
     * @param args connection arguments, of which only {@code query_params} is read
     * @return the query string without leading {@code ?}; empty if there are no parameters
     */
    public static String forRole(ClientRole role, RoleArgs args) {
        Object raw = args.get(RoleArgs.QUERY_PARAMS);
        if (raw == null) {
            return "";
        }
        if (!(raw instanceof Map)) {
            throw new ConfigException(RoleArgs.QUERY_PARAMS + " must be a map, got: " + raw);
        }
        Map<?, ?> supplied = (Map<?, ?>) raw;
        Map<String, String> known = parameterNames(role);
        for (Object key : supplied.keySet()) {
            if (!known.containsKey(String.valueOf(key))) {
                logger.debug("Ignoring unsupported {} query parameter {}", role, key);
            }
        }
        StringJoiner query = new StringJoiner("&");
        known.forEach((key, parameter) -> {
            Object value = supplied.get(key);
            if (value != null) {
                query.add(parameter + "=" + URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8));
            }
        });
        return query.toString();
    }

    /**
     * @return configuration key to gateway parameter name, in rendering order
     */
    public static Map<String, String> parameterNames(ClientRole role) {
        switch (role) {
            case PRODUCER:
                return PRODUCER;
            case CONSUMER:
                return CONSUMER;
            case READER:
                return READER;
            default:
                throw new IllegalArgumentException("Unknown role " + role);
        }
    }

    private static Map<String, String> ordered(String... keysAndNames) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndNames.length; i += 2) {
            map.put(keysAndNames[i], keysAndNames[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
