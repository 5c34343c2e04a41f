package mcsnap.engine.execution;

import mcsnap.engine.model.Artifact;

/**
 * Successful result of running an action: either something was captured or
 * there was nothing new. Failures are reported as
 * {@link mcsnap.engine.error.ActionFailedException}.
 *
 * @param artifact the artifact recorded, null for a no-op or an unreadable push reference
 */
public record ActionResult(boolean changed, Artifact artifact, String message) {

    public static ActionResult created(Artifact artifact, String message) {
        return new ActionResult(true, artifact, message);
    }

    public static ActionResult noChanges() {
        return new ActionResult(false, null, OutcomeClassifier.NO_CHANGES_MESSAGE);
    }

    /**
     * Success without an artifact, for a push whose reference could not be read back.
     */
    public static ActionResult withoutArtifact(String message) {
        return new ActionResult(true, null, message);
    }

    public boolean hasArtifact() {
        return artifact != null;
    }
}
