package stargate.common;

import java.util.Objects;

/**
 * A single HTTP header sent with the websocket upgrade request.
 */
public final class Header {
    public static final String AUTHORIZATION = "Authorization";

    private final String name;
    private final String value;

    public Header(String name, String value) {
        this.name = Objects.requireNonNull(name, "header name must not be null");
        this.value = Objects.requireNonNull(value, "header value must not be null");
    }

    public static Header of(String name, String value) {
        return new Header(name, value);
    }

    public static Header bearer(String token) {
        return new Header(AUTHORIZATION, "Bearer " + token);
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Header header = (Header) o;
        return name.equals(header.name) && value.equals(header.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        // never log credentials
        return name + ": " + (AUTHORIZATION.equalsIgnoreCase(name) ? "***" : value);
    }
}
