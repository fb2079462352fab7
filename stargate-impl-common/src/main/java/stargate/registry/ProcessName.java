package stargate.registry;

import stargate.common.ClientRole;

import java.util.Objects;

/**
 * Logical name of a supervised process: a role, plus an index for fanned-out roles.
 * The string form is {@code producer}, {@code producer-0}, {@code consumer}, ...
 */
public final class ProcessName {
    private final String role;
    private final Integer index;

    private ProcessName(String role, Integer index) {
        this.role = Objects.requireNonNull(role);
        if (role.isEmpty()) {
            throw new IllegalArgumentException("role must not be empty");
        }
        if (index != null && index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        this.index = index;
    }

    public static ProcessName of(String role) {
        return new ProcessName(role, null);
    }

    public static ProcessName of(ClientRole role) {
        return new ProcessName(role.getPathSegment(), null);
    }

    public static ProcessName of(ClientRole role, int index) {
        return new ProcessName(role.getPathSegment(), index);
    }

    public String getRole() {
        return role;
    }

    public boolean hasIndex() {
        return index != null;
    }

    public int getIndex() {
        if (index == null) {
            throw new IllegalStateException(role + " has no index");
        }
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcessName that = (ProcessName) o;
        return role.equals(that.role) && Objects.equals(index, that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, index);
    }

    @Override
    public String toString() {
        return index == null ? role : role + "-" + index;
    }
}
