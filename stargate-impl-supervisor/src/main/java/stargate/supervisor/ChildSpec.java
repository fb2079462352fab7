package stargate.supervisor;

import stargate.common.ClientRole;
import stargate.common.ConnectionSettings;
import stargate.common.RoleArgs;
import stargate.registry.ProcessName;

import java.util.Objects;
import java.util.Optional;

/**
 * Specification of one child of a client supervisor: either the registry, or a
 * connection with its merged arguments.
 */
public final class ChildSpec {
    public static final ProcessName REGISTRY_NAME = ProcessName.of("registry");

    private final ProcessName name;
    private final ClientRole role;
    private final RoleArgs args;
    private final ConnectionSettings settings;

    private ChildSpec(ProcessName name, ClientRole role, RoleArgs args, ConnectionSettings settings) {
        this.name = Objects.requireNonNull(name);
        this.role = role;
        this.args = args;
        this.settings = settings;
    }

    static ChildSpec registry() {
        return new ChildSpec(REGISTRY_NAME, null, RoleArgs.empty(), null);
    }

    static ChildSpec connection(ProcessName name, ClientRole role, RoleArgs args, ConnectionSettings settings) {
        return new ChildSpec(name, Objects.requireNonNull(role), Objects.requireNonNull(args), Objects.requireNonNull(settings));
    }

    public ProcessName getName() {
        return name;
    }

    public boolean isRegistry() {
        return role == null;
    }

    /**
     * @return the connection role; empty for the registry
     */
    public Optional<ClientRole> getRole() {
        return Optional.ofNullable(role);
    }

    public RoleArgs getArgs() {
        return args;
    }

    /**
     * @return the connection settings resolved while planning; empty for the registry
     */
    public Optional<ConnectionSettings> getSettings() {
        return Optional.ofNullable(settings);
    }

    @Override
    public String toString() {
        return isRegistry() ? name.toString() : name + "(" + settings.getUrl() + ")";
    }
}
