package stargate.common;

/**
 * Signals an invalid or incomplete client configuration. Configuration errors are
 * detected before any connection is attempted and are never retried.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigException missing(String field) {
        return new ConfigException("Missing required configuration field: " + field);
    }
}
