package stargate.common;

/**
 * A process tried to register under a name that is already taken in its registry.
 * Names are derived so that they are unique, so this always indicates a bug and is
 * never recovered from by restarting.
 */
public class DuplicateRegistrationException extends IllegalStateException {
    private final String registryName;
    private final String processName;

    public DuplicateRegistrationException(String registryName, String processName) {
        super("Name " + processName + " is already registered in " + registryName);
        this.registryName = registryName;
        this.processName = processName;
    }

    public String getRegistryName() {
        return registryName;
    }

    public String getProcessName() {
        return processName;
    }
}
