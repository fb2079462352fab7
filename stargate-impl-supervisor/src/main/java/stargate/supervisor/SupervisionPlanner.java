package stargate.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stargate.common.ClientConfig;
import stargate.common.ClientRole;
import stargate.common.ConfigException;
import stargate.common.ConnectionSettings;
import stargate.common.RoleArgs;
import stargate.common.RoleSection;
import stargate.connection.ConnectionSettingsBuilder;
import stargate.connection.QueryParams;
import stargate.registry.ProcessName;
import stargate.registry.ProcessRegistry;
import stargate.websocket.client.ConnectionProcess;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Expands a {@link ClientConfig} into a {@link SupervisionPlan}.
 * <p>
 * Each connection's arguments are its role arguments merged with the shared client
 * settings. The shared {@code host}, {@code protocol} and {@code registry} always win;
 * for any other key, including {@code transport_opts}, a value given in the role
 * arguments wins over the shared one.
 * <p>
 * Planning has no side effects and starts nothing. It builds the connection settings
 * and transport options of every connection, so configuration errors are reported
 * before any connection is attempted.
 */
public class SupervisionPlanner {
    private static final Logger logger = LoggerFactory.getLogger(SupervisionPlanner.class);

    private static final Set<String> SHARED_WINS = Set.of(RoleArgs.HOST, RoleArgs.PROTOCOL, RoleArgs.REGISTRY);

    /**
     * @param config the client configuration
     * @return the plan
     * @throws ConfigException if the configuration is incomplete or malformed
     */
    public SupervisionPlan plan(ClientConfig config) {
        if (config.getHost() == null) {
            throw ConfigException.missing(ClientConfig.HOST);
        }
        ProcessRegistry registry = new ProcessRegistry(ProcessRegistry.registryName(config.getName()));
        RoleArgs shared = RoleArgs.builder()
                .put(RoleArgs.HOST, config.getHost())
                .put(RoleArgs.PROTOCOL, config.getProtocol())
                .put(RoleArgs.TRANSPORT_OPTS, config.getTransportOptions())
                .put(RoleArgs.REGISTRY, registry)
                .build();

        List<ChildSpec> children = new ArrayList<>();
        children.add(ChildSpec.registry());
        config.getProducer().ifPresent(section -> addProducers(children, section, shared));
        config.getConsumer().ifPresent(section -> children.add(single(ClientRole.CONSUMER, section, shared)));
        config.getReader().ifPresent(section -> children.add(single(ClientRole.READER, section, shared)));

        SupervisionPlan plan = new SupervisionPlan(config.getName(), registry, children);
        logger.debug("Planned {}", plan);
        return plan;
    }

    private static void addProducers(List<ChildSpec> children, RoleSection section, RoleArgs shared) {
        if (!section.isFanOut()) {
            children.add(connection(ProcessName.of(ClientRole.PRODUCER), ClientRole.PRODUCER, section.getArgs().get(0), shared));
            return;
        }
        List<RoleArgs> producers = section.getArgs();
        for (int i = 0; i < producers.size(); i++) {
            children.add(connection(ProcessName.of(ClientRole.PRODUCER, i), ClientRole.PRODUCER, producers.get(i), shared));
        }
    }

    private static ChildSpec single(ClientRole role, RoleSection section, RoleArgs shared) {
        if (section.isFanOut()) {
            throw new ConfigException(role + " must be configured as a single map; only producers can be given as a list");
        }
        return connection(ProcessName.of(role), role, section.getArgs().get(0), shared);
    }

    private static ChildSpec connection(ProcessName name, ClientRole role, RoleArgs roleArgs, RoleArgs shared) {
        RoleArgs merged = mergeArgs(roleArgs, shared);
        ConnectionSettings settings = ConnectionSettingsBuilder.build(merged, role, QueryParams.forRole(role, merged));
        // fail fast on malformed transport options
        ConnectionProcess.transportOptions(merged);
        return ChildSpec.connection(name, role, merged, settings);
    }

    /**
     * Merges role arguments with the shared client settings.
     */
    public static RoleArgs mergeArgs(RoleArgs roleArgs, RoleArgs shared) {
        return roleArgs.merge(shared, (key, roleValue, sharedValue) -> {
            if (SHARED_WINS.contains(key) || roleValue == null) {
                return sharedValue;
            }
            return roleValue;
        });
    }
}
