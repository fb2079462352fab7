package stargate.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stargate.common.ClientConfig;
import stargate.common.DuplicateRegistrationException;
import stargate.process.ExitReason;
import stargate.process.SupervisedProcess;
import stargate.registry.ProcessName;
import stargate.registry.ProcessRegistry;
import stargate.util.ThreadPools;
import stargate.websocket.GatewayTransport;
import stargate.websocket.client.JakartaGatewayTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Top-level supervisor of one client instance.
 * <p>
 * Children are started in plan order: the registry, the producers, the consumer, the
 * reader. Once running, the supervisor applies a rest-for-one policy: when a child
 * terminates, for whatever reason, every child started after it is stopped (last
 * first), and then the terminated child and all later children are started again, in
 * order. Children started before the terminated one are not touched. Restarts are
 * unconditional and immediate; a restart that fails counts as another termination of
 * the same child. A {@link DuplicateRegistrationException} is the only exception to
 * this: it means the plan is broken, so the supervisor stops everything and fails.
 * <p>
 * Exit notifications and restarts are handled one at a time on the supervisor's own
 * event loop.
 * <pre>
 * NOT_STARTED -&gt; STARTING -&gt; RUNNING -&gt; STOPPED
 *                        \-&gt; FAILED
 * </pre>
 */
public class StargateSupervisor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StargateSupervisor.class);

    public static final String NAME_PREFIX = "sg_sup_";
    private static final long STOP_TIMEOUT_SECONDS = 60;

    private final String name;
    private final SupervisionPlan plan;
    private final ProcessFactory processFactory;
    private final AutoCloseable ownedTransport;
    private final List<Child> children = new ArrayList<>();
    private final ScheduledExecutorService loop;

    private volatile SupervisorState state = SupervisorState.NOT_STARTED;

    private static final class Child {
        private final ChildSpec spec;
        private volatile SupervisedProcess process;
        // incremented whenever the supervisor replaces or stops the process; exit events of older generations are ignored
        private long generation;
        private volatile int restarts;

        private Child(ChildSpec spec) {
            this.spec = spec;
        }
    }

    public StargateSupervisor(SupervisionPlan plan, ProcessFactory processFactory) {
        this(plan, processFactory, null);
    }

    private StargateSupervisor(SupervisionPlan plan, ProcessFactory processFactory, AutoCloseable ownedTransport) {
        this.plan = Objects.requireNonNull(plan);
        this.processFactory = Objects.requireNonNull(processFactory);
        this.ownedTransport = ownedTransport;
        this.name = supervisorName(plan.getClientName());
        for (ChildSpec spec : plan.getChildren()) {
            children.add(new Child(spec));
        }
        this.loop = ThreadPools.newEventLoop(name);
    }

    public static String supervisorName(String clientName) {
        return NAME_PREFIX + clientName;
    }

    /**
     * Plans and starts a client instance using the Jetty websocket transport. The
     * transport is closed when the supervisor stops.
     *
     * @param config client configuration
     * @return the running supervisor
     * @throws stargate.common.ConfigException if the configuration is invalid; nothing was started
     * @throws SupervisorStartException        if a child could not be started
     */
    public static StargateSupervisor start(ClientConfig config) throws SupervisorStartException {
        JakartaGatewayTransport transport = new JakartaGatewayTransport();
        try {
            return start(config, new DefaultProcessFactory(transport), transport);
        } catch (RuntimeException e) {
            transport.close();
            throw e;
        }
    }

    /**
     * Plans and starts a client instance on the given transport. The transport stays
     * open when the supervisor stops.
     */
    public static StargateSupervisor start(ClientConfig config, GatewayTransport transport) throws SupervisorStartException {
        return start(config, new DefaultProcessFactory(transport), null);
    }

    private static StargateSupervisor start(ClientConfig config, ProcessFactory processFactory, AutoCloseable ownedTransport) throws SupervisorStartException {
        SupervisionPlan plan = new SupervisionPlanner().plan(config);
        StargateSupervisor supervisor = new StargateSupervisor(plan, processFactory, ownedTransport);
        supervisor.start();
        return supervisor;
    }

    /**
     * Starts all children in order and blocks until they are running.
     *
     * @throws SupervisorStartException if a child fails to start; the children started so far are stopped again
     */
    public void start() throws SupervisorStartException {
        synchronized (this) {
            if (state != SupervisorState.NOT_STARTED) {
                throw new IllegalStateException(name + " cannot be started in state " + state);
            }
            state = SupervisorState.STARTING;
        }
        logger.info("{} Starting {} children: {}", name, children.size(), plan.getChildren());
        SupervisorStartException failure;
        try {
            failure = loop.submit(this::startAll).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = new SupervisorStartException(name, ChildSpec.REGISTRY_NAME, e);
        } catch (ExecutionException e) {
            failure = new SupervisorStartException(name, ChildSpec.REGISTRY_NAME, e.getCause());
        }
        if (failure != null) {
            state = SupervisorState.FAILED;
            releaseResources();
            throw failure;
        }
    }

    // runs on the supervisor loop
    private SupervisorStartException startAll() {
        for (int i = 0; i < children.size(); i++) {
            try {
                startChild(i);
            } catch (Exception e) {
                logger.error("{} Failed to start child {}", name, children.get(i).spec.getName(), e);
                state = SupervisorState.FAILED;
                stopChildren(0);
                return new SupervisorStartException(name, children.get(i).spec.getName(), e);
            }
        }
        state = SupervisorState.RUNNING;
        logger.info("{} Running", name);
        return null;
    }

    private void startChild(int index) throws Exception {
        Child child = children.get(index);
        long generation = ++child.generation;
        SupervisedProcess process = processFactory.create(child.spec, plan);
        child.process = process;
        process.getExitFuture().thenAccept(reason -> onChildExit(index, generation, reason));
        process.start();
        logger.debug("{} Started child {}", name, child.spec.getName());
    }

    private void onChildExit(int index, long generation, ExitReason reason) {
        try {
            loop.execute(() -> handleChildExit(index, generation, reason));
        } catch (RejectedExecutionException e) {
            logger.debug("{} Ignoring exit of {} after shutdown: {}", name, children.get(index).spec.getName(), reason);
        }
    }

    private void handleChildExit(int index, long generation, ExitReason reason) {
        Child child = children.get(index);
        if (state != SupervisorState.RUNNING || child.generation != generation) {
            logger.debug("{} Ignoring exit of {} (state {}): {}", name, child.spec.getName(), state, reason);
            return;
        }
        logger.warn("{} Child {} exited: {}; restarting it and the {} children started after it",
                name, child.spec.getName(), reason, children.size() - index - 1);
        restartFrom(index);
    }

    private void restartFrom(int index) {
        if (state != SupervisorState.RUNNING) {
            return;
        }
        stopChildren(index);
        for (int i = index; i < children.size(); i++) {
            Child child = children.get(i);
            child.restarts++;
            try {
                startChild(i);
            } catch (DuplicateRegistrationException e) {
                fail(e);
                return;
            } catch (Exception e) {
                logger.warn("{} Restart of {} failed: {}", name, child.spec.getName(), e.toString());
                child.generation++;
                int failed = i;
                loop.execute(() -> restartFrom(failed));
                return;
            }
        }
        logger.info("{} Restarted children {} to {}", name, children.get(index).spec.getName(), children.get(children.size() - 1).spec.getName());
    }

    // stops children n-1 .. fromIndex, last first
    private void stopChildren(int fromIndex) {
        for (int i = children.size() - 1; i >= fromIndex; i--) {
            Child child = children.get(i);
            child.generation++;
            SupervisedProcess process = child.process;
            if (process != null && process.isAlive()) {
                logger.debug("{} Stopping child {}", name, child.spec.getName());
                process.stop();
            }
        }
    }

    private void fail(Throwable cause) {
        logger.error("{} Unrecoverable child failure, stopping all children", name, cause);
        state = SupervisorState.FAILED;
        stopChildren(0);
    }

    /**
     * Stops all children, last first. Idempotent.
     */
    public void stop() {
        synchronized (this) {
            if (state == SupervisorState.STOPPED) {
                return;
            }
        }
        try {
            Future<?> stopped = loop.submit(() -> {
                state = SupervisorState.STOPPED;
                stopChildren(0);
            });
            stopped.get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            logger.info("{} Stopped", name);
        } catch (RejectedExecutionException e) {
            state = SupervisorState.STOPPED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("{} Failed to stop children cleanly", name, e);
        } finally {
            state = SupervisorState.STOPPED;
            releaseResources();
        }
    }

    @Override
    public void close() {
        stop();
    }

    private void releaseResources() {
        loop.shutdown();
        if (ownedTransport != null) {
            try {
                ownedTransport.close();
            } catch (Exception e) {
                logger.warn("{} Failed to close transport", name, e);
            }
        }
    }

    /**
     * Kills a child abnormally, as if it had crashed. The restart policy applies.
     *
     * @return {@code false} if no such child is alive
     */
    public boolean terminateChild(ProcessName childName) {
        int index = plan.indexOf(childName);
        if (index < 0) {
            return false;
        }
        SupervisedProcess process = children.get(index).process;
        if (process == null || !process.isAlive()) {
            return false;
        }
        process.kill("terminated on request");
        return true;
    }

    public String getName() {
        return name;
    }

    public SupervisionPlan getPlan() {
        return plan;
    }

    public ProcessRegistry getRegistry() {
        return plan.getRegistry();
    }

    public SupervisorState getState() {
        return state;
    }

    /**
     * @return the current process of a child, alive or not; empty if the name is not part of the plan
     */
    public Optional<SupervisedProcess> getChild(ProcessName childName) {
        int index = plan.indexOf(childName);
        return index < 0 ? Optional.empty() : Optional.ofNullable(children.get(index).process);
    }

    /**
     * @return how often a child has been restarted since the supervisor started
     */
    public int getRestartCount(ProcessName childName) {
        int index = plan.indexOf(childName);
        if (index < 0) {
            throw new IllegalArgumentException("No child " + childName + " in " + name);
        }
        return children.get(index).restarts;
    }

    /**
     * Looks up a process by name in this client's registry.
     */
    public Optional<Object> whereis(ProcessName processName) {
        return plan.getRegistry().whereis(processName);
    }

    @Override
    public String toString() {
        return name;
    }
}
