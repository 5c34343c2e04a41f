package mcsnap.engine.execution;

import mcsnap.engine.error.PreconditionFailedException;
import mcsnap.engine.error.StorageException;
import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.Artifact;
import mcsnap.engine.model.ArtifactEntry;
import mcsnap.engine.model.TargetName;
import mcsnap.engine.repository.ArtifactRepository;
import mcsnap.engine.store.FileSystemSnapshotStorage;
import mcsnap.engine.util.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * File-set action: copies a server's configuration files into snapshot
 * storage and records an artifact listing them.
 */
public class ConfigSnapshotAction {

    private static final Logger log = LoggerFactory.getLogger(ConfigSnapshotAction.class);

    private final Path serversDir;
    private final FileCollector collector;
    private final FileSystemSnapshotStorage storage;
    private final ArtifactRepository artifacts;

    public ConfigSnapshotAction(Path serversDir, FileCollector collector,
            FileSystemSnapshotStorage storage, ArtifactRepository artifacts) {
        this.serversDir = serversDir;
        this.collector = collector;
        this.storage = storage;
        this.artifacts = artifacts;
    }

    public void checkPreconditions(TargetName target) {
        if (!Files.isDirectory(serversDir.resolve(target.value()))) {
            throw new PreconditionFailedException("Server directory not found: " + target);
        }
    }

    public ActionResult capture(TargetName target, String description, String scheduleId) {
        checkPreconditions(target);

        List<CollectedFile> files = collector.collect(target);
        Map<String, byte[]> contents = new LinkedHashMap<>();
        List<ArtifactEntry> entries = files.stream().map(CollectedFile::toEntry).toList();
        for (CollectedFile file : files) {
            contents.put(file.path(), file.content());
        }

        Artifact artifact = Artifact.builder()
                .id(artifacts.generateId())
                .kind(ActionKind.CONFIG_SNAPSHOT)
                .target(target)
                .createdAt(Instant.now())
                .scheduleId(scheduleId)
                .description(description)
                .entries(entries)
                .build();

        storage.store(target, artifact.id(), contents);
        try {
            artifacts.save(artifact);
        } catch (StorageException e) {
            storage.delete(target, artifact.id());
            throw e;
        }

        log.info("Config snapshot {} created for {} ({} files)", artifact.id(), target, entries.size());
        return ActionResult.created(artifact, "Snapshot created (" + entries.size() + " files)");
    }

    /**
     * Write every stored file of the artifact back into the server directory.
     *
     * @return number of files written
     */
    public int restore(Artifact artifact) {
        Map<String, byte[]> contents = storage.retrieveBytes(artifact.target(), artifact.id());
        if (contents.isEmpty() && !artifact.entries().isEmpty()) {
            throw new StorageException("No files found for snapshot: " + artifact.id());
        }

        Path serverDir = serversDir.resolve(artifact.target().value());
        try {
            Files.createDirectories(serverDir);
            for (Map.Entry<String, byte[]> file : contents.entrySet()) {
                Path dest = PathGuard.resolveWithin(serverDir, file.getKey());
                Files.createDirectories(dest.getParent());
                Files.write(dest, file.getValue());
            }
        } catch (IOException e) {
            throw new StorageException("Failed to restore snapshot " + artifact.id(), e);
        }

        log.info("Restored {} file(s) from snapshot {} into {}", contents.size(), artifact.id(), serverDir);
        return contents.size();
    }

    /**
     * Stored contents decoded as text for diff display.
     */
    public Map<String, String> contents(Artifact artifact) {
        return storage.retrieve(artifact.target(), artifact.id());
    }

    public void discard(Artifact artifact) {
        storage.delete(artifact.target(), artifact.id());
    }
}
