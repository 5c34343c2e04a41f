package mcsnap.engine.execution;

/**
 * Maps a finished process to success, no-op success or failure.
 */
public final class OutcomeClassifier {

    /** Output marker meaning there was nothing new to push */
    public static final String NO_OP_SIGNAL = "nothing to commit";

    public static final String NO_CHANGES_MESSAGE = "No changes to backup";

    public enum Outcome {
        SUCCESS,
        NO_CHANGES,
        FAILURE
    }

    private OutcomeClassifier() {
    }

    /**
     * A timed-out process is a failure whatever its output says.
     */
    public static Outcome classify(ProcessResult result) {
        if (result.succeeded()) {
            return Outcome.SUCCESS;
        }
        if (!result.timedOut() && isNoOp(result)) {
            return Outcome.NO_CHANGES;
        }
        return Outcome.FAILURE;
    }

    private static boolean isNoOp(ProcessResult result) {
        return contains(result.stderr()) || contains(result.stdout());
    }

    private static boolean contains(String s) {
        return s != null && s.contains(NO_OP_SIGNAL);
    }
}
