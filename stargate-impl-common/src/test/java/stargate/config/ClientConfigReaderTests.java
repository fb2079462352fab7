package stargate.config;

import org.junit.Test;
import stargate.common.ClientConfig;
import stargate.common.ConfigException;
import stargate.common.HostAddress;
import stargate.common.InvalidHostFormatException;
import stargate.common.RoleArgs;
import stargate.common.RoleSection;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ClientConfigReaderTests {
    private final ClientConfigReader reader = new ClientConfigReader();

    @Test
    public void fullConfiguration() {
        ClientConfig config = reader.read("{"
                + "\"name\": \"orders\","
                + "\"host\": {\"host\": \"broker\", \"port\": 8080},"
                + "\"protocol\": \"wss\","
                + "\"transport_opts\": {\"auth_token\": \"t\", \"socket_connect_timeout\": 5000},"
                + "\"producer\": [{\"tenant\": \"public\", \"namespace\": \"default\", \"topic\": \"a\"},"
                + "               {\"tenant\": \"public\", \"namespace\": \"default\", \"topic\": \"b\"}],"
                + "\"consumer\": {\"tenant\": \"public\", \"namespace\": \"default\", \"topic\": \"a\", \"subscription\": \"s\"}"
                + "}");
        assertEquals("orders", config.getName());
        assertEquals(HostAddress.of("broker", 8080), config.getHost());
        assertEquals("wss", config.getProtocol());
        assertEquals(2, config.getTransportOptions().size());
        assertEquals("auth_token", config.getTransportOptions().get(0).getKey());

        RoleSection producers = config.getProducer().orElseThrow();
        assertTrue(producers.isFanOut());
        assertEquals("b", producers.getArgs().get(1).get(RoleArgs.TOPIC));

        RoleSection consumer = config.getConsumer().orElseThrow();
        assertFalse(consumer.isFanOut());
        assertEquals("s", consumer.getArgs().get(0).get(RoleArgs.SUBSCRIPTION));
        assertFalse(config.getReader().isPresent());
    }

    @Test
    public void defaults() {
        ClientConfig config = reader.read("{\"host\": \"localhost:8080\"}");
        assertEquals(ClientConfig.DEFAULT_NAME, config.getName());
        assertEquals(ClientConfig.DEFAULT_PROTOCOL, config.getProtocol());
        assertEquals("localhost:8080", config.getHost());
        assertTrue(config.getTransportOptions().isEmpty());
    }

    @Test
    public void hostPairForms() {
        assertEquals(HostAddress.of("b", 1), reader.read("{\"host\": [\"b\", 1]}").getHost());
        assertEquals(List.of(HostAddress.of("b", 1)), reader.read("{\"host\": [[\"b\", 1]]}").getHost());
    }

    @Test(expected = InvalidHostFormatException.class)
    public void invalidPortIsRejected() {
        reader.read("{\"host\": {\"host\": \"b\", \"port\": 99999}}");
    }

    @Test
    public void queryParamsStayMaps() {
        ClientConfig config = reader.read("{\"host\": \"h:1\", \"reader\": {\"tenant\": \"t\", \"namespace\": \"n\", \"topic\": \"x\","
                + "\"query_params\": {\"starting_message\": \"earliest\"}}}");
        Object params = config.getReader().orElseThrow().getArgs().get(0).get(RoleArgs.QUERY_PARAMS);
        assertEquals(Map.of("starting_message", "earliest"), params);
    }

    @Test(expected = ConfigException.class)
    public void malformedJsonIsAConfigError() {
        reader.read("{\"host\": ");
    }

    @Test(expected = ConfigException.class)
    public void nonObjectIsRejected() {
        reader.read("[1, 2]");
    }
}
