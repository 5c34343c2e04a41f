package mcsnap.engine.util;

import mcsnap.engine.error.SecurityViolationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PathGuardTest {

    @TempDir
    Path root;

    @Test
    void resolvesNestedRelativePath() {
        Path resolved = PathGuard.resolveWithin(root, "plugins/Essentials/config.yml");
        assertTrue(resolved.startsWith(root.toAbsolutePath().normalize()));
        assertTrue(resolved.endsWith(Path.of("plugins", "Essentials", "config.yml")));
    }

    @Test
    void rejectsTraversal() {
        assertThrows(SecurityViolationException.class, () -> PathGuard.resolveWithin(root, "../outside.txt"));
        assertThrows(SecurityViolationException.class, () -> PathGuard.resolveWithin(root, "a/../../outside"));
    }

    @Test
    void allowsDotSegmentsThatStayInside() {
        Path resolved = PathGuard.resolveWithin(root, "a/../b.yml");
        assertEquals(root.toAbsolutePath().normalize().resolve("b.yml"), resolved);
    }

    @Test
    void rejectsAbsoluteEmptyAndNul() {
        assertThrows(SecurityViolationException.class,
                () -> PathGuard.resolveWithin(root, root.resolve("x").toAbsolutePath().toString()));
        assertThrows(SecurityViolationException.class, () -> PathGuard.resolveWithin(root, ""));
        assertThrows(SecurityViolationException.class, () -> PathGuard.resolveWithin(root, "a\0b"));
        assertThrows(SecurityViolationException.class, () -> PathGuard.resolveWithin(root, "."));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void rejectsSymlinkEscape(@TempDir Path outside) throws Exception {
        Files.createSymbolicLink(root.resolve("link"), outside);
        assertThrows(SecurityViolationException.class, () -> PathGuard.resolveWithin(root, "link/secret.txt"));
    }

    @Test
    void relativizeUsesForwardSlashes() {
        assertEquals("a/b.yml", PathGuard.relativize(root, root.resolve("a").resolve("b.yml")));
    }
}
