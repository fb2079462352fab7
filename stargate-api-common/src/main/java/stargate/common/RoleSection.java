package stargate.common;

import java.util.List;
import java.util.Objects;

/**
 * The configuration of one role in a client config: either a single connection, or
 * a sequence of connections of the same role (fan-out).
 */
public abstract class RoleSection {

    private RoleSection() {
    }

    public static RoleSection one(RoleArgs args) {
        return new One(args);
    }

    public static RoleSection many(List<RoleArgs> args) {
        return new Many(args);
    }

    /**
     * @return {@code true} if this section was given as a sequence, even one of length 1
     */
    public abstract boolean isFanOut();

    /**
     * @return the arguments of every connection in this section, in declaration order
     */
    public abstract List<RoleArgs> getArgs();

    private static final class One extends RoleSection {
        private final RoleArgs args;

        private One(RoleArgs args) {
            this.args = Objects.requireNonNull(args);
        }

        @Override
        public boolean isFanOut() {
            return false;
        }

        @Override
        public List<RoleArgs> getArgs() {
            return List.of(args);
        }

        @Override
        public String toString() {
            return "One(" + args + ")";
        }
    }

    private static final class Many extends RoleSection {
        private final List<RoleArgs> args;

        private Many(List<RoleArgs> args) {
            this.args = List.copyOf(args);
        }

        @Override
        public boolean isFanOut() {
            return true;
        }

        @Override
        public List<RoleArgs> getArgs() {
            return args;
        }

        @Override
        public String toString() {
            return "Many(" + args + ")";
        }
    }
}
