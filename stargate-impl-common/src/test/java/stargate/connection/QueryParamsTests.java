package stargate.connection;

import org.junit.Test;
import stargate.common.ClientRole;
import stargate.common.ConfigException;
import stargate.common.RoleArgs;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class QueryParamsTests {

    private static RoleArgs withParams(Map<String, ?> params) {
        return RoleArgs.builder().queryParams(params).build();
    }

    @Test
    public void noParamsGiveEmptyQuery() {
        assertEquals("", QueryParams.forRole(ClientRole.PRODUCER, RoleArgs.empty()));
        assertEquals("", QueryParams.forRole(ClientRole.READER, withParams(Map.of())));
    }

    @Test
    public void producerParamsAreRenamedAndOrdered() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", "p1");
        params.put("send_timeout", 3000);
        params.put("batch_enabled", true);
        assertEquals("sendTimeoutMillis=3000&batchingEnabled=true&producerName=p1",
                QueryParams.forRole(ClientRole.PRODUCER, withParams(params)));
    }

    @Test
    public void paramsUnknownToTheRoleAreDropped() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("subscription_type", "Shared");
        params.put("bogus", "x");
        params.put("send_timeout", 1);
        assertEquals("sendTimeoutMillis=1", QueryParams.forRole(ClientRole.PRODUCER, withParams(params)));
        assertEquals("subscriptionType=Shared", QueryParams.forRole(ClientRole.CONSUMER, withParams(params)));
    }

    @Test
    public void valuesAreUrlEncoded() {
        assertEquals("readerName=a+b%26c&messageId=latest",
                QueryParams.forRole(ClientRole.READER, withParams(Map.of("starting_message", "latest", "name", "a b&c"))));
    }

    @Test(expected = ConfigException.class)
    public void nonMapParamsAreRejected() {
        QueryParams.forRole(ClientRole.CONSUMER, RoleArgs.builder().put(RoleArgs.QUERY_PARAMS, "a=b").build());
    }
}
