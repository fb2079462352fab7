package stargate.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import stargate.common.ClientConfig;
import stargate.common.ConfigException;
import stargate.common.HostAddress;
import stargate.common.InvalidHostFormatException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link ClientConfig} from a JSON tree.
 * <p>
 * Besides the plain {@code "host:port"} form, the host may be written as
 * {@code {"host": "broker", "port": 8080}}, as {@code ["broker", 8080]}, or as a
 * one-element list of either; these are converted to a {@link HostAddress}.
 * <pre>
 * {
 *   "name": "orders",
 *   "host": {"host": "broker", "port": 8080},
 *   "transport_opts": {"auth_token": "...", "extra_headers": [["X-Trace", "1"]]},
 *   "producer": [{"tenant": "public", "namespace": "default", "topic": "orders"}],
 *   "consumer": {"tenant": "public", "namespace": "default", "topic": "orders", "subscription": "billing"}
 * }
 * </pre>
 */
public class ClientConfigReader {
    private static final TypeReference<LinkedHashMap<String, Object>> TREE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public ClientConfigReader() {
        this(new ObjectMapper());
    }

    public ClientConfigReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ClientConfig read(String json) {
        try {
            return read(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid client configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    public ClientConfig read(JsonNode tree) {
        if (tree == null || !tree.isObject()) {
            throw new ConfigException("Client configuration must be a JSON object");
        }
        Map<String, Object> map = mapper.convertValue(tree, TREE_TYPE);
        Object host = map.get(ClientConfig.HOST);
        if (host != null) {
            try {
                map.put(ClientConfig.HOST, toHost(host));
            } catch (IllegalArgumentException e) {
                throw new InvalidHostFormatException(host);
            }
        }
        return ClientConfig.fromMap(map);
    }

    private static Object toHost(Object host) {
        if (host instanceof String) {
            return host;
        }
        if (host instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) host;
            Object name = map.get("host");
            Object port = map.get("port");
            if (map.size() == 2 && name instanceof String && port instanceof Number) {
                return HostAddress.of((String) name, ((Number) port).intValue());
            }
        }
        if (host instanceof List) {
            List<?> list = (List<?>) host;
            if (list.size() == 2 && list.get(0) instanceof String && list.get(1) instanceof Number) {
                return HostAddress.of((String) list.get(0), ((Number) list.get(1)).intValue());
            }
            if (list.size() == 1) {
                return List.of(toHost(list.get(0)));
            }
        }
        // left as is; rejected with a precise message when the connection settings are built
        return host;
    }
}
