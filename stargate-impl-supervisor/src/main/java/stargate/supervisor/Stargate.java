package stargate.supervisor;

import stargate.common.ClientConfig;
import stargate.config.ClientConfigReader;
import stargate.registry.ProcessName;
import stargate.registry.ProcessRef;
import stargate.registry.ProcessRegistry;
import stargate.websocket.client.ConnectionProcess;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Entry points for starting client instances and sending to their connections by name.
 */
public final class Stargate {

    private Stargate() {
    }

    public static StargateSupervisor start(ClientConfig config) throws SupervisorStartException {
        return StargateSupervisor.start(config);
    }

    /**
     * Starts a client instance from a JSON configuration, see {@link ClientConfigReader}.
     */
    public static StargateSupervisor start(String jsonConfig) throws SupervisorStartException {
        return StargateSupervisor.start(new ClientConfigReader().read(jsonConfig));
    }

    /**
     * Sends a text message on the connection currently registered under the given handle.
     *
     * @return completed when the frame was sent, or exceptionally if no connection is registered or the send failed
     */
    public static CompletableFuture<Void> send(ProcessRef ref, String message) {
        return ref.resolve(ConnectionProcess.class)
                .map(connection -> connection.send(message))
                .orElseGet(() -> CompletableFuture.failedFuture(new IOException("No connection registered as " + ref)));
    }

    public static CompletableFuture<Void> produce(ProcessRegistry registry, ProcessName name, String message) {
        return send(registry.via(name), message);
    }
}
