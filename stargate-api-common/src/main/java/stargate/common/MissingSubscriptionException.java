package stargate.common;

/**
 * A consumer connection was configured without a subscription name.
 */
public class MissingSubscriptionException extends ConfigException {
    public MissingSubscriptionException() {
        super("Missing required configuration field: " + RoleArgs.SUBSCRIPTION + " (required for consumer connections)");
    }
}
