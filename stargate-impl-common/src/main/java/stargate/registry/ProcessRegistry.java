package stargate.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stargate.common.DuplicateRegistrationException;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Namespace of the processes belonging to one client instance.
 * <p>
 * Each process registers itself once when it starts and is removed when it
 * terminates. A registry is created per client instance and handed to every
 * process at construction time; it is not a global. Closing the registry drops all
 * entries and refuses further registrations until it is opened again.
 */
public class ProcessRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ProcessRegistry.class);

    public static final String NAME_PREFIX = "sg_reg_";

    private final String name;
    private final ConcurrentHashMap<ProcessName, Object> entries = new ConcurrentHashMap<>();
    private volatile boolean open;

    public ProcessRegistry(String name) {
        this.name = Objects.requireNonNull(name);
    }

    /**
     * @param clientName the client instance name
     * @return the name of the registry belonging to that client instance
     */
    public static String registryName(String clientName) {
        return NAME_PREFIX + clientName;
    }

    public String getName() {
        return name;
    }

    public void open() {
        open = true;
        logger.debug("Registry {} opened", name);
    }

    public void close() {
        open = false;
        if (!entries.isEmpty()) {
            logger.debug("Registry {} closed, dropping {} entries: {}", name, entries.size(), entries.keySet());
        }
        entries.clear();
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Registers a process under a name.
     *
     * @param processName the name
     * @param process     the process
     * @return an addressable handle on the name
     * @throws DuplicateRegistrationException if the name is taken
     * @throws IllegalStateException          if the registry is closed
     */
    public ProcessRef register(ProcessName processName, Object process) {
        Objects.requireNonNull(process);
        if (!open) {
            throw new IllegalStateException("Registry " + name + " is not open");
        }
        Object existing = entries.putIfAbsent(processName, process);
        if (existing != null) {
            throw new DuplicateRegistrationException(name, processName.toString());
        }
        logger.debug("Registered {} in {}", processName, name);
        return new ProcessRef(this, processName);
    }

    /**
     * Removes a registration, but only if the name is still held by the given process.
     *
     * @return {@code true} if an entry was removed
     */
    public boolean unregister(ProcessName processName, Object process) {
        boolean removed = entries.remove(processName, process);
        if (removed) {
            logger.debug("Unregistered {} from {}", processName, name);
        }
        return removed;
    }

    public ProcessRef via(ProcessName processName) {
        return new ProcessRef(this, processName);
    }

    public Optional<Object> whereis(ProcessName processName) {
        return Optional.ofNullable(entries.get(processName));
    }

    public <T> Optional<T> whereis(ProcessName processName, Class<T> type) {
        return whereis(processName).filter(type::isInstance).map(type::cast);
    }

    public Set<ProcessName> registeredNames() {
        return Set.copyOf(entries.keySet());
    }

    @Override
    public String toString() {
        return name;
    }
}
