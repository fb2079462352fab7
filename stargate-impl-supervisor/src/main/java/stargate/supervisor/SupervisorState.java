package stargate.supervisor;

public enum SupervisorState {
    NOT_STARTED,
    STARTING,
    RUNNING,
    STOPPED,
    FAILED
}
