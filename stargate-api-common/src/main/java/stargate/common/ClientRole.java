package stargate.common;

/**
 * The kind of gateway connection a client process holds. The role determines the
 * shape of the connection URL and which query parameters the gateway accepts.
 */
public enum ClientRole {
    PRODUCER("producer"),
    CONSUMER("consumer"),
    READER("reader");

    private final String pathSegment;

    ClientRole(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    /**
     * Returns the role segment used in the gateway path, e.g. {@code producer} in
     * {@code /ws/v2/producer/...}.
     *
     * @return the lower-case path segment
     */
    public String getPathSegment() {
        return pathSegment;
    }

    @Override
    public String toString() {
        return pathSegment;
    }
}
