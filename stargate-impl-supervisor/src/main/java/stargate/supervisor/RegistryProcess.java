package stargate.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stargate.process.ExitReason;
import stargate.process.SupervisedProcess;
import stargate.registry.ProcessName;
import stargate.registry.ProcessRegistry;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a {@link ProcessRegistry} as the first child of a client supervisor. The
 * registry is open while this process is alive; when the process terminates, the
 * registry is closed and loses all its entries.
 */
public class RegistryProcess implements SupervisedProcess {
    private static final Logger logger = LoggerFactory.getLogger(RegistryProcess.class);

    private final ProcessName name;
    private final ProcessRegistry registry;
    private final CompletableFuture<ExitReason> exitFuture = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    public RegistryProcess(ProcessName name, ProcessRegistry registry) {
        this.name = name;
        this.registry = registry;
    }

    @Override
    public ProcessName getName() {
        return name;
    }

    public ProcessRegistry getRegistry() {
        return registry;
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Registry process " + registry.getName() + " was already started");
        }
        registry.open();
    }

    @Override
    public void stop() {
        terminate(ExitReason.shutdown());
    }

    @Override
    public void kill(String reason) {
        terminate(ExitReason.killed(reason));
    }

    private void terminate(ExitReason reason) {
        if (terminated.compareAndSet(false, true)) {
            if (!reason.isShutdown()) {
                logger.warn("Registry {} terminating abnormally: {}", registry.getName(), reason);
            }
            registry.close();
            exitFuture.complete(reason);
        }
    }

    @Override
    public boolean isAlive() {
        return started.get() && !terminated.get();
    }

    @Override
    public CompletableFuture<ExitReason> getExitFuture() {
        return exitFuture;
    }

    @Override
    public String toString() {
        return "{" + registry.getName() + "}";
    }
}
