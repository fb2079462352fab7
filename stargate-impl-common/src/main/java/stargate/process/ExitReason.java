package stargate.process;

import java.util.Optional;

/**
 * Why a supervised process terminated.
 */
public final class ExitReason {
    public enum Kind {
        /** Stopped on request, e.g. by its supervisor during shutdown or a restart cascade. */
        SHUTDOWN,
        /** The remote side closed the connection. */
        CLOSED,
        /** Terminated because of an error. */
        ERROR,
        /** Terminated on request by an abnormal kill. */
        KILLED
    }

    private final Kind kind;
    private final String description;
    private final Throwable cause;

    private ExitReason(Kind kind, String description, Throwable cause) {
        this.kind = kind;
        this.description = description;
        this.cause = cause;
    }

    public static ExitReason shutdown() {
        return new ExitReason(Kind.SHUTDOWN, "shutdown", null);
    }

    public static ExitReason closed(String description) {
        return new ExitReason(Kind.CLOSED, description, null);
    }

    public static ExitReason error(Throwable cause) {
        return new ExitReason(Kind.ERROR, String.valueOf(cause), cause);
    }

    public static ExitReason killed(String description) {
        return new ExitReason(Kind.KILLED, description, null);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isShutdown() {
        return kind == Kind.SHUTDOWN;
    }

    public String getDescription() {
        return description;
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return kind + "(" + description + ")";
    }
}
