package stargate.supervisor;

import stargate.registry.ProcessName;
import stargate.registry.ProcessRegistry;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The children of one client supervisor, in start order: the registry, then the
 * producers, then the consumer, then the reader. A plan is never modified once
 * computed.
 */
public final class SupervisionPlan {
    private final String clientName;
    private final ProcessRegistry registry;
    private final List<ChildSpec> children;

    SupervisionPlan(String clientName, ProcessRegistry registry, List<ChildSpec> children) {
        this.clientName = clientName;
        this.registry = registry;
        this.children = List.copyOf(children);
    }

    public String getClientName() {
        return clientName;
    }

    public ProcessRegistry getRegistry() {
        return registry;
    }

    public List<ChildSpec> getChildren() {
        return children;
    }

    public List<ChildSpec> getConnections() {
        return children.stream().filter(c -> !c.isRegistry()).collect(Collectors.toList());
    }

    public Optional<ChildSpec> find(ProcessName name) {
        return children.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    public int indexOf(ProcessName name) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "SupervisionPlan{" + clientName + ": " + children + "}";
    }
}
