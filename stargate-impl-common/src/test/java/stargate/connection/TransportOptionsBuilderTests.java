package stargate.connection;

import org.junit.Test;
import stargate.common.ConfigException;
import stargate.common.Header;
import stargate.common.TransportOption;
import stargate.common.TransportOptions;

import java.util.AbstractMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class TransportOptionsBuilderTests {

    private static Map.Entry<String, Object> opt(String key, Object value) {
        return new AbstractMap.SimpleImmutableEntry<>(key, value);
    }

    private static List<TransportOption> keys(TransportOptions options) {
        return options.asList().stream().map(Map.Entry::getKey).collect(Collectors.toList());
    }

    @Test
    public void emptyInputGivesEmptyOptions() {
        TransportOptions options = TransportOptionsBuilder.build(List.of());
        assertTrue(options.isEmpty());
        assertEquals(List.of(), options.getExtraHeaders());
        assertEquals(Optional.empty(), options.getSocketConnectTimeoutMs());
        assertFalse(options.isInsecure());
    }

    @Test
    public void unknownKeysAreDropped() {
        TransportOptions options = TransportOptionsBuilder.build(List.of(
                opt("foo", "bar"),
                opt("socket_connect_timeout", 5000),
                opt("mode", "binary")));
        assertEquals(List.of(TransportOption.SOCKET_CONNECT_TIMEOUT), keys(options));
        assertEquals(Optional.of(5000L), options.getSocketConnectTimeoutMs());
    }

    @Test
    public void authTokenBecomesSingleLeadingHeader() {
        TransportOptions options = TransportOptionsBuilder.build(List.of(
                opt("extra_headers", List.of(List.of("X-A", "1"))),
                opt("auth_token", "secret")));
        assertFalse(options.contains(TransportOption.AUTH_TOKEN));
        assertEquals(List.of(Header.of("Authorization", "Bearer secret"), Header.of("X-A", "1")), options.getExtraHeaders());
    }

    @Test
    public void lastAuthTokenWins() {
        TransportOptions options = TransportOptionsBuilder.build(List.of(
                opt("auth_token", "first"),
                opt("auth_token", "second")));
        List<Header> headers = options.getExtraHeaders();
        assertEquals(1, headers.size());
        assertEquals("Bearer second", headers.get(0).getValue());
    }

    @Test
    public void extraHeadersAreConcatenatedInOrder() {
        Map<String, Object> asMap = new LinkedHashMap<>();
        asMap.put("name", "X-C");
        asMap.put("value", "3");
        TransportOptions options = TransportOptionsBuilder.build(List.of(
                opt("extra_headers", List.of(Header.of("X-A", "1"), Map.entry("X-B", "2"))),
                opt("insecure", true),
                opt("extra_headers", List.of(asMap))));
        assertEquals(List.of(Header.of("X-A", "1"), Header.of("X-B", "2"), Header.of("X-C", "3")), options.getExtraHeaders());
        assertTrue(options.isInsecure());
    }

    @Test
    public void singleNameValueObjectIsOneHeader() {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("name", "X-A");
        header.put("value", "1");
        TransportOptions options = TransportOptionsBuilder.build(List.of(opt("extra_headers", header)));
        assertEquals(List.of(Header.of("X-A", "1")), options.getExtraHeaders());
    }

    @Test
    public void objectOfHeaderNamesToValues() {
        Map<String, Object> headers = new LinkedHashMap<>();
        headers.put("X-A", "1");
        headers.put("X-B", "2");
        TransportOptions options = TransportOptionsBuilder.build(List.of(opt("extra_headers", headers)));
        assertEquals(List.of(Header.of("X-A", "1"), Header.of("X-B", "2")), options.getExtraHeaders());
    }

    @Test
    public void optionsFollowDeclarationOrder() {
        TransportOptions options = TransportOptionsBuilder.build(List.of(
                opt("socket_recv_timeout", "250"),
                opt("cacerts", "/etc/ca.pem"),
                opt("auth_token", "t")));
        assertEquals(List.of(TransportOption.CACERTS, TransportOption.SOCKET_RECV_TIMEOUT, TransportOption.EXTRA_HEADERS), keys(options));
        assertEquals(List.of("/etc/ca.pem"), options.getCacerts());
        assertEquals(Optional.of(250L), options.getSocketRecvTimeoutMs());
    }

    @Test
    public void mapInputIsAccepted() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("auth_token", "abc");
        raw.put("unknown", 1);
        TransportOptions options = TransportOptionsBuilder.build(raw);
        assertEquals(List.of(Header.bearer("abc")), options.getExtraHeaders());
    }

    @Test(expected = ConfigException.class)
    public void negativeTimeoutIsRejected() {
        TransportOptionsBuilder.build(List.of(opt("socket_connect_timeout", -1)));
    }

    @Test(expected = ConfigException.class)
    public void malformedHeaderIsRejected() {
        TransportOptionsBuilder.build(List.of(opt("extra_headers", List.of("just-a-string"))));
    }

    @Test(expected = ConfigException.class)
    public void nonBooleanInsecureIsRejected() {
        TransportOptionsBuilder.build(List.of(opt("insecure", "maybe")));
    }

    @Test
    public void authorizationValueIsMaskedInToString() {
        TransportOptions options = TransportOptionsBuilder.build(List.of(opt("auth_token", "secret")));
        assertFalse(options.toString().contains("secret"));
    }
}
