package mcsnap.engine.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffResultTest {

    @Test
    void summaryCountsEachStatus() {
        DiffResult diff = DiffResult.of("a", "b", List.of(
                FileChange.added("new.yml", "h1", null),
                FileChange.modified("server.properties", "h2", "h3", null, null),
                FileChange.deleted("old.json", "h4", null),
                FileChange.added("ops.json", "h5", null)));

        assertEquals(2, diff.summary().added());
        assertEquals(1, diff.summary().modified());
        assertEquals(1, diff.summary().deleted());
        assertEquals(4, diff.summary().total());
        assertTrue(diff.hasChanges());
    }

    @Test
    void emptyDiffHasNoChanges() {
        DiffResult diff = DiffResult.of("a", "a", List.of());
        assertFalse(diff.hasChanges());
        assertEquals(0, diff.summary().total());
    }
}
