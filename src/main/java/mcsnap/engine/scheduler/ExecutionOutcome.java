package mcsnap.engine.scheduler;

import mcsnap.engine.model.Artifact;

/**
 * What one execution of a schedule did.
 *
 * @param artifact the artifact produced, if any
 * @param pruned   number of artifacts removed by retention afterwards
 */
public record ExecutionOutcome(Status status, String message, Artifact artifact, int pruned) {

    public enum Status {
        /** Not run: schedule missing, disabled, or already running */
        SKIPPED,
        /** Ran and produced an artifact (or pushed without a readable reference) */
        SUCCESS,
        /** Ran, but there was nothing new to capture */
        NO_CHANGES,
        /** Ran and failed; the failure was recorded */
        FAILURE
    }

    public static ExecutionOutcome skipped(String reason) {
        return new ExecutionOutcome(Status.SKIPPED, reason, null, 0);
    }

    public static ExecutionOutcome failure(String message) {
        return new ExecutionOutcome(Status.FAILURE, message, null, 0);
    }

    public boolean recorded() {
        return status != Status.SKIPPED;
    }
}
