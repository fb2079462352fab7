package stargate.process;

import stargate.registry.ProcessName;

import java.util.concurrent.CompletableFuture;

/**
 * A process that can be started, stopped and restarted by a supervisor.
 * <p>
 * An instance is started at most once; a restart creates a new instance. Whatever
 * the reason, termination completes {@link #getExitFuture()} exactly once.
 */
public interface SupervisedProcess {

    ProcessName getName();

    /**
     * Starts the process and blocks until it is running.
     *
     * @throws Exception if the process could not be started; it is then already terminated
     */
    void start() throws Exception;

    /**
     * Stops the process in an orderly fashion. Does nothing if it has already terminated.
     */
    void stop();

    /**
     * Terminates the process abnormally, as if it had crashed.
     *
     * @param reason description, for logging
     */
    void kill(String reason);

    boolean isAlive();

    CompletableFuture<ExitReason> getExitFuture();
}
