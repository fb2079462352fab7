package stargate.supervisor;

import stargate.process.SupervisedProcess;

/**
 * Creates a fresh process for a child specification; called for the initial start
 * and for every restart.
 */
@FunctionalInterface
public interface ProcessFactory {
    SupervisedProcess create(ChildSpec spec, SupervisionPlan plan);
}
