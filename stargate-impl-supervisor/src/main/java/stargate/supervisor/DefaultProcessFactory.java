package stargate.supervisor;

import stargate.process.SupervisedProcess;
import stargate.websocket.GatewayTransport;
import stargate.websocket.KeepAlive;
import stargate.websocket.PingPongKeepAlive;
import stargate.websocket.client.ConnectionProcess;

import java.util.Objects;

/**
 * Creates a {@link RegistryProcess} for the registry child and a
 * {@link ConnectionProcess} for every connection child.
 */
public class DefaultProcessFactory implements ProcessFactory {
    private final GatewayTransport transport;
    private final KeepAlive keepAlive;

    public DefaultProcessFactory(GatewayTransport transport) {
        this(transport, new PingPongKeepAlive());
    }

    public DefaultProcessFactory(GatewayTransport transport, KeepAlive keepAlive) {
        this.transport = Objects.requireNonNull(transport);
        this.keepAlive = Objects.requireNonNull(keepAlive);
    }

    @Override
    public SupervisedProcess create(ChildSpec spec, SupervisionPlan plan) {
        if (spec.isRegistry()) {
            return new RegistryProcess(spec.getName(), plan.getRegistry());
        }
        return new ConnectionProcess(spec.getName(), spec.getRole().orElseThrow(), spec.getArgs(), transport, keepAlive);
    }
}
