package stargate.websocket.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stargate.common.ClientConfig;
import stargate.common.ClientRole;
import stargate.common.ConfigException;
import stargate.common.ConnectionSettings;
import stargate.common.RoleArgs;
import stargate.common.TransportOptions;
import stargate.common.TransportStartException;
import stargate.connection.ConnectionSettingsBuilder;
import stargate.connection.QueryParams;
import stargate.connection.TransportOptionsBuilder;
import stargate.process.ExitReason;
import stargate.process.SupervisedProcess;
import stargate.registry.ProcessName;
import stargate.registry.ProcessRegistry;
import stargate.util.ThreadPools;
import stargate.websocket.FrameListener;
import stargate.websocket.GatewayConnection;
import stargate.websocket.GatewayTransport;
import stargate.websocket.KeepAlive;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One supervised websocket connection to the gateway, in the producer, consumer or
 * reader role.
 * <p>
 * Each process owns a single-threaded event loop. Connecting, inbound frames, close
 * and error notifications, keepalive ticks and outbound sends are all handled on it,
 * one at a time and in arrival order. When the process terminates, the loop is shut
 * down, which also cancels the keepalive timer.
 * <p>
 * At start, the process computes its URL from its arguments, registers itself in the
 * registry passed in the {@code registry} argument, and connects. It unregisters
 * itself when it terminates, whatever the reason. A closed or failed connection is
 * never re-established by the process itself; that is the supervisor's job.
 */
public class ConnectionProcess implements SupervisedProcess, FrameListener {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionProcess.class);

    private static final long STOP_TIMEOUT_SECONDS = 10;

    public enum State {
        NEW,
        CONNECTING,
        CONNECTED,
        TERMINATED
    }

    private final ProcessName name;
    private final ClientRole role;
    private final RoleArgs args;
    private final ProcessRegistry registry;
    private final GatewayTransport transport;
    private final KeepAlive keepAlive;
    private final ConnectionHandler handler;

    private final CompletableFuture<ExitReason> exitFuture = new CompletableFuture<>();
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    private volatile State state = State.NEW;
    private volatile ScheduledExecutorService eventLoop;
    private volatile ConnectionSettings settings;
    private volatile GatewayConnection connection;

    /**
     * @param name      registered name of the process
     * @param role      connection role
     * @param args      merged connection arguments; must contain the {@code registry}
     * @param transport socket layer used to connect
     * @param keepAlive keepalive policy attached once connected
     */
    public ConnectionProcess(ProcessName name, ClientRole role, RoleArgs args, GatewayTransport transport, KeepAlive keepAlive) {
        this.name = Objects.requireNonNull(name);
        this.role = Objects.requireNonNull(role);
        this.args = Objects.requireNonNull(args);
        this.transport = Objects.requireNonNull(transport);
        this.keepAlive = Objects.requireNonNull(keepAlive);
        this.registry = args.find(RoleArgs.REGISTRY, ProcessRegistry.class)
                .orElseThrow(() -> ConfigException.missing(RoleArgs.REGISTRY));
        this.handler = args.find(RoleArgs.HANDLER, ConnectionHandler.class)
                .orElseGet(LoggingConnectionHandler::new);
    }

    /**
     * Resolves the transport options of a connection from its {@code transport_opts}
     * argument, which may be already built options, a map, or a key/value list.
     */
    public static TransportOptions transportOptions(RoleArgs args) {
        Object raw = args.get(RoleArgs.TRANSPORT_OPTS);
        if (raw == null) {
            return TransportOptions.empty();
        }
        if (raw instanceof TransportOptions) {
            return (TransportOptions) raw;
        }
        return TransportOptionsBuilder.build(ClientConfig.toEntries(RoleArgs.TRANSPORT_OPTS, raw));
    }

    @Override
    public void start() throws Exception {
        if (state != State.NEW) {
            throw new IllegalStateException(this + " was already started");
        }
        state = State.CONNECTING;
        try {
            settings = ConnectionSettingsBuilder.build(args, role, QueryParams.forRole(role, args));
            TransportOptions options = transportOptions(args);
            eventLoop = ThreadPools.newEventLoop("stargate-" + registry.getName() + "-" + name);
            registry.register(name, this);
            eventLoop.submit(() -> {
                connect(options);
                return null;
            }).get();
        } catch (ExecutionException e) {
            Exception cause = e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
            terminate(ExitReason.error(cause));
            throw cause;
        } catch (CancellationException e) {
            // the connect task was still queued when the process was terminated
            throw new TransportStartException(this + " was terminated before connecting");
        } catch (Exception e) {
            terminate(ExitReason.error(e));
            throw e;
        }
    }

    // runs on the event loop
    private void connect(TransportOptions options) throws Exception {
        logger.debug("{} Connecting to {}", this, settings.getUrl());
        GatewayConnection established = transport.connect(URI.create(settings.getUrl()), options, this);
        // published before checking for termination, so that either this method or terminate() closes it
        connection = established;
        synchronized (this) {
            if (!terminated.get()) {
                state = State.CONNECTED;
            }
        }
        if (terminated.get()) {
            established.close(name + " terminated while connecting");
            throw new TransportStartException(this + " was terminated while connecting");
        }
        try {
            keepAlive.onConnect(established, eventLoop);
        } catch (RejectedExecutionException e) {
            // terminated right after the check above; terminate() closes the connection
            throw new TransportStartException(this + " was terminated while connecting", e);
        }
        handler.onConnect(this);
        logger.info("{} Connected to {}", this, settings.getUrl());
    }

    /**
     * Sends a text frame on the event loop.
     *
     * @param text the message
     * @return completed once the frame was sent; completed exceptionally if the process is not connected or the send failed
     */
    public CompletableFuture<Void> send(String text) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        boolean queued = runOnLoop(() -> {
            if (state != State.CONNECTED) {
                result.completeExceptionally(new IOException(this + " is not connected (state " + state + ")"));
                return;
            }
            try {
                connection.sendText(text);
                result.complete(null);
            } catch (IOException | RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        if (!queued) {
            result.completeExceptionally(new IOException(this + " is terminated"));
        }
        return result;
    }

    @Override
    public void onText(String text) {
        runOnLoop(() -> {
            if (state != State.CONNECTED) {
                return;
            }
            try {
                handler.onMessage(this, text);
            } catch (Exception e) {
                logger.error("{} Message handler failed", this, e);
                terminate(ExitReason.error(e));
            }
        });
    }

    @Override
    public void onPing(ByteBuffer payload) {
        runOnLoop(() -> {
            if (state == State.CONNECTED) {
                keepAlive.onPing(connection, payload);
            }
        });
    }

    @Override
    public void onPong(ByteBuffer payload) {
        runOnLoop(() -> keepAlive.onPong(payload));
    }

    @Override
    public void onClose(int code, String reason) {
        if (!runOnLoop(() -> terminate(ExitReason.closed(code + " " + reason)))) {
            terminate(ExitReason.closed(code + " " + reason));
        }
    }

    @Override
    public void onError(Throwable throwable) {
        if (!runOnLoop(() -> terminate(ExitReason.error(throwable)))) {
            terminate(ExitReason.error(throwable));
        }
    }

    @Override
    public void stop() {
        if (terminated.get()) {
            return;
        }
        if (runOnLoop(() -> terminate(ExitReason.shutdown()))) {
            try {
                exitFuture.get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                logger.warn("{} Did not stop in time, terminating", this, e);
            }
        }
        terminate(ExitReason.shutdown());
    }

    @Override
    public void kill(String reason) {
        terminate(ExitReason.killed(reason));
    }

    private void terminate(ExitReason reason) {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        State previous;
        synchronized (this) {
            previous = state;
            state = State.TERMINATED;
        }
        if (reason.isShutdown()) {
            logger.debug("{} Terminating: {}", this, reason);
        } else {
            logger.warn("{} Terminating abnormally in state {}: {}", this, previous, reason);
        }
        registry.unregister(name, this);
        GatewayConnection current = connection;
        if (current != null && current.isOpen()) {
            current.close(name + " " + reason.getKind().name().toLowerCase());
        }
        if (eventLoop != null) {
            for (Runnable pending : eventLoop.shutdownNow()) {
                if (pending instanceof Future) {
                    ((Future<?>) pending).cancel(false);
                }
            }
        }
        exitFuture.complete(reason);
    }

    private boolean runOnLoop(Runnable task) {
        ScheduledExecutorService loop = eventLoop;
        if (loop == null || loop.isShutdown()) {
            logger.debug("{} Event loop is not running; dropping task", this);
            return false;
        }
        try {
            loop.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            logger.debug("{} Task rejected (loop terminated): {}", this, e.toString());
            return false;
        }
    }

    @Override
    public ProcessName getName() {
        return name;
    }

    public ClientRole getRole() {
        return role;
    }

    public State getState() {
        return state;
    }

    /**
     * @return the settings computed at start, or {@code null} before that
     */
    public ConnectionSettings getSettings() {
        return settings;
    }

    public ProcessRegistry getRegistry() {
        return registry;
    }

    @Override
    public boolean isAlive() {
        return !terminated.get();
    }

    @Override
    public CompletableFuture<ExitReason> getExitFuture() {
        return exitFuture;
    }

    @Override
    public String toString() {
        return "{" + registry.getName() + "/" + name + "}";
    }
}
