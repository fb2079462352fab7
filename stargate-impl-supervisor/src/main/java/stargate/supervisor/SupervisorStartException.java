package stargate.supervisor;

import stargate.registry.ProcessName;

/**
 * A child could not be started during the initial start of a client supervisor.
 * The supervisor has stopped the children it had already started.
 */
public class SupervisorStartException extends Exception {
    private final ProcessName child;

    public SupervisorStartException(String supervisorName, ProcessName child, Throwable cause) {
        super(supervisorName + ": failed to start child " + child + ": " + cause.getMessage(), cause);
        this.child = child;
    }

    public ProcessName getChild() {
        return child;
    }
}
