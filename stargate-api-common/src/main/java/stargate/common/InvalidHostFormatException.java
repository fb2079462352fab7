package stargate.common;

/**
 * The configured host was neither a {@code "host:port"} string nor a single address/port pair.
 */
public class InvalidHostFormatException extends ConfigException {
    public InvalidHostFormatException(Object host) {
        super("Invalid host format, expected \"host:port\" or a single address/port pair, got: " + host);
    }
}
