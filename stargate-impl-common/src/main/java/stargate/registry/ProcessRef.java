package stargate.registry;

import java.util.Objects;
import java.util.Optional;

/**
 * An addressable handle on a name in a {@link ProcessRegistry}. The handle does not
 * hold on to a process; every lookup resolves to whichever process currently holds
 * the name, so a handle stays valid across restarts.
 */
public final class ProcessRef {
    private final ProcessRegistry registry;
    private final ProcessName name;

    ProcessRef(ProcessRegistry registry, ProcessName name) {
        this.registry = Objects.requireNonNull(registry);
        this.name = Objects.requireNonNull(name);
    }

    public ProcessRegistry getRegistry() {
        return registry;
    }

    public ProcessName getName() {
        return name;
    }

    public Optional<Object> resolve() {
        return registry.whereis(name);
    }

    public <T> Optional<T> resolve(Class<T> type) {
        return registry.whereis(name, type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcessRef that = (ProcessRef) o;
        return registry == that.registry && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(registry), name);
    }

    @Override
    public String toString() {
        return registry.getName() + "/" + name;
    }
}
