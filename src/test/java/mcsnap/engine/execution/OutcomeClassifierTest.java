package mcsnap.engine.execution;

import org.junit.jupiter.api.Test;

import static mcsnap.engine.execution.OutcomeClassifier.Outcome.*;
import static org.junit.jupiter.api.Assertions.*;

class OutcomeClassifierTest {

    @Test
    void exitZeroIsSuccess() {
        assertEquals(SUCCESS, OutcomeClassifier.classify(ProcessResult.ok("done")));
    }

    @Test
    void nothingToCommitIsNoChanges() {
        assertEquals(NO_CHANGES, OutcomeClassifier.classify(
                ProcessResult.failed(1, "On branch main\nnothing to commit, working tree clean\n", "")));
        assertEquals(NO_CHANGES, OutcomeClassifier.classify(
                ProcessResult.failed(1, "", "nothing to commit")));
    }

    @Test
    void otherNonZeroIsFailure() {
        assertEquals(FAILURE, OutcomeClassifier.classify(ProcessResult.failed(1, "", "permission denied")));
    }

    @Test
    void timeoutIsFailureEvenWithMarker() {
        assertEquals(FAILURE, OutcomeClassifier.classify(new ProcessResult(-1, "nothing to commit", "", true)));
    }
}
