package mcsnap.engine.util;

import mcsnap.engine.error.SecurityViolationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolves user- or artifact-supplied relative paths against a sandbox root and
 * rejects anything that would land outside it, including through symlinks.
 */
public final class PathGuard {

    private PathGuard() {
    }

    /**
     * Resolve {@code relative} under {@code root}.
     *
     * @throws SecurityViolationException if the result escapes the root
     */
    public static Path resolveWithin(Path root, String relative) {
        if (relative == null || relative.isBlank()) {
            throw new SecurityViolationException("Empty path");
        }
        if (relative.indexOf('\0') >= 0) {
            throw new SecurityViolationException("Path contains NUL byte: " + relative.replace('\0', '?'));
        }
        Path base = root.toAbsolutePath().normalize();
        Path candidate = Path.of(relative);
        if (candidate.isAbsolute()) {
            throw new SecurityViolationException("Absolute path not allowed: " + relative);
        }
        Path resolved = base.resolve(candidate).normalize();
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw new SecurityViolationException("Path traversal detected: " + relative);
        }

        // If the path (or its nearest existing ancestor) exists, re-check with symlinks resolved
        try {
            Path existing = resolved;
            while (existing != null && !Files.exists(existing)) {
                existing = existing.getParent();
            }
            if (existing != null && Files.exists(base)) {
                Path realBase = base.toRealPath();
                Path realExisting = existing.toRealPath();
                if (!realExisting.startsWith(realBase)) {
                    throw new SecurityViolationException("Path escapes root through a symlink: " + relative);
                }
            }
        } catch (IOException e) {
            throw new SecurityViolationException("Cannot resolve path " + relative + ": " + e.getMessage());
        }
        return resolved;
    }

    /**
     * Relative form of {@code file} under {@code root} with forward slashes.
     */
    public static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
