package mcsnap.engine.repository;

import mcsnap.engine.model.TargetName;

/**
 * Answers whether a target server is currently running. Backed by the
 * container lifecycle layer, which lives outside this engine.
 */
@FunctionalInterface
public interface TargetStatusProbe {

    TargetStatusProbe NEVER_RUNNING = target -> false;

    boolean isRunning(TargetName target);
}
