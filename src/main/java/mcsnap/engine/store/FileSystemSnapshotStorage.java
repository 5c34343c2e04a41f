package mcsnap.engine.store;

import mcsnap.engine.error.StorageException;
import mcsnap.engine.model.TargetName;
import mcsnap.engine.util.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Filesystem storage of config snapshot contents.
 * Layout: {@code <root>/<target>/<artifactId>/<path>}.
 * <p>
 * Writes go to a temporary sibling directory that is renamed into place, so a
 * crash never leaves a half-written snapshot under its final id.
 */
public class FileSystemSnapshotStorage {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSnapshotStorage.class);

    private final Path root;

    public FileSystemSnapshotStorage(Path root) {
        this.root = root;
    }

    /**
     * Store file contents for an artifact.
     *
     * @param files relative path to raw content
     */
    public void store(TargetName target, String artifactId, Map<String, byte[]> files) {
        Path targetRoot = root.resolve(target.value());
        Path finalDir = targetRoot.resolve(artifactId);
        Path tempDir = targetRoot.resolve(".tmp-" + UUID.randomUUID());

        try {
            Files.createDirectories(tempDir);
            for (Map.Entry<String, byte[]> file : files.entrySet()) {
                Path dest = PathGuard.resolveWithin(tempDir, file.getKey());
                Files.createDirectories(dest.getParent());
                Files.write(dest, file.getValue());
            }
            Files.move(tempDir, finalDir, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored {} file(s) for artifact {}", files.size(), artifactId);
        } catch (IOException e) {
            deleteRecursively(tempDir);
            throw new StorageException("Failed to store snapshot contents for " + artifactId, e);
        } catch (RuntimeException e) {
            deleteRecursively(tempDir);
            throw e;
        }
    }

    /**
     * Retrieve the raw file contents of an artifact, keyed and sorted by path.
     * Returns an empty map if nothing is stored under the id.
     */
    public SortedMap<String, byte[]> retrieveBytes(TargetName target, String artifactId) {
        Path dir = root.resolve(target.value()).resolve(artifactId);
        SortedMap<String, byte[]> files = new TreeMap<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.filter(Files::isRegularFile).forEach(p -> {
                try {
                    files.put(PathGuard.relativize(dir, p), Files.readAllBytes(p));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            throw new StorageException("Failed to read snapshot contents for " + artifactId, e);
        }
        return files;
    }

    /**
     * Retrieve file contents as UTF-8 text for display. Bytes that are not
     * valid UTF-8 are replaced with U+FFFD; use {@link #retrieveBytes} to
     * write contents back.
     */
    public SortedMap<String, String> retrieve(TargetName target, String artifactId) {
        SortedMap<String, String> files = new TreeMap<>();
        retrieveBytes(target, artifactId).forEach((path, content) ->
                files.put(path, new String(content, StandardCharsets.UTF_8)));
        return files;
    }

    /**
     * Delete stored contents for an artifact. Missing contents are not an error.
     */
    public void delete(TargetName target, String artifactId) {
        Path dir = root.resolve(target.value()).resolve(artifactId);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to delete snapshot contents for " + artifactId, e);
        }
    }

    public boolean exists(TargetName target, String artifactId) {
        return Files.isDirectory(root.resolve(target.value()).resolve(artifactId));
    }

    private static void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("Failed to clean up temporary snapshot dir {}: {}", dir, e.getMessage());
        }
    }
}
