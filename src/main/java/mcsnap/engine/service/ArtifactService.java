package mcsnap.engine.service;

import mcsnap.engine.api.dto.ArtifactResponse;
import mcsnap.engine.api.dto.DiffResponse;
import mcsnap.engine.error.NotFoundException;
import mcsnap.engine.error.TargetBusyException;
import mcsnap.engine.execution.ActionExecutor;
import mcsnap.engine.execution.ActionResult;
import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.Artifact;
import mcsnap.engine.model.AuditAction;
import mcsnap.engine.model.AuditEvent;
import mcsnap.engine.model.DiffResult;
import mcsnap.engine.model.TargetName;
import mcsnap.engine.repository.ArtifactRepository;
import mcsnap.engine.repository.AuditSink;
import mcsnap.engine.repository.TargetStatusProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Business logic for artifacts: manual capture, listing, deletion, diff and restore.
 */
public class ArtifactService {

    private static final Logger log = LoggerFactory.getLogger(ArtifactService.class);

    private final ArtifactRepository artifacts;
    private final ActionExecutor executor;
    private final DiffEngine diffEngine;
    private final TargetStatusProbe statusProbe;
    private final AuditSink audit;

    public ArtifactService(ArtifactRepository artifacts, ActionExecutor executor, DiffEngine diffEngine,
            TargetStatusProbe statusProbe, AuditSink audit) {
        this.artifacts = artifacts;
        this.executor = executor;
        this.diffEngine = diffEngine;
        this.statusProbe = statusProbe;
        this.audit = audit;
    }

    /**
     * Capture an artifact now, outside any schedule.
     *
     * @return the new artifact, or empty when a world backup had nothing to push
     * @throws mcsnap.engine.error.ActionFailedException if the action failed
     */
    public Optional<ArtifactResponse> create(ActionKind kind, String serverName, String description) {
        TargetName target = TargetName.of(serverName);
        executor.checkPreconditions(kind, target);

        ActionResult result = executor.run(kind, target, description != null ? description.trim() : "", null);
        if (!result.hasArtifact()) {
            log.info("Manual {} for {}: {}", kind, target, result.message());
            return Optional.empty();
        }

        Artifact artifact = result.artifact();
        audit.record(AuditEvent.success(AuditAction.ARTIFACT_CREATE, AuditEvent.API_ACTOR, "server",
                target.value(), details(artifact)));
        return Optional.of(ArtifactResponse.from(artifact));
    }

    /**
     * List a server's artifacts of every kind, newest first.
     *
     * @param limit maximum results, 0 for all
     */
    public List<ArtifactResponse> list(String serverName, int limit, int offset) {
        TargetName target = TargetName.of(serverName);
        return artifacts.findByTarget(target.value()).stream()
                .skip(Math.max(0, offset))
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .map(a -> ArtifactResponse.from(a).compact())
                .toList();
    }

    /**
     * List a server's artifacts of one kind, newest first.
     */
    public List<ArtifactResponse> list(String serverName, ActionKind kind, int limit, int offset) {
        TargetName target = TargetName.of(serverName);
        return artifacts.findByTarget(target.value(), kind, limit, offset).stream()
                .map(a -> ArtifactResponse.from(a).compact())
                .toList();
    }

    public ArtifactResponse get(String serverName, String id) {
        return ArtifactResponse.from(require(TargetName.of(serverName), id));
    }

    /**
     * Delete an artifact and its stored contents. The record goes first: a
     * failure after that leaves orphaned contents, never a listed artifact
     * without contents.
     */
    public void delete(String serverName, String id) {
        Artifact artifact = require(TargetName.of(serverName), id);

        artifacts.delete(id);
        try {
            executor.discard(artifact);
        } catch (RuntimeException e) {
            log.warn("Artifact {} deleted but its stored contents remain (orphan): {}", id, e.getMessage());
        }
        log.info("Deleted artifact {} of {}", id, artifact.target());

        audit.record(AuditEvent.success(AuditAction.ARTIFACT_DELETE, AuditEvent.API_ACTOR, "server",
                artifact.target().value(), details(artifact)));
    }

    /**
     * Compare two artifacts.
     *
     * @throws mcsnap.engine.error.ValidationException if they are of different kinds
     */
    public DiffResponse diff(String baseId, String compareId) {
        Artifact base = artifacts.findById(baseId).orElseThrow(() -> NotFoundException.artifact(baseId));
        Artifact compare = artifacts.findById(compareId).orElseThrow(() -> NotFoundException.artifact(compareId));
        DiffResult diff = diffEngine.compare(base, compare);
        log.debug("Diff {} -> {}: {} change(s)", baseId, compareId, diff.summary().total());
        return DiffResponse.from(diff);
    }

    /**
     * Restore a server to an artifact.
     *
     * @throws NotFoundException    if the artifact does not exist for this server
     * @throws TargetBusyException  if the server is running and {@code force} is not set
     * @throws mcsnap.engine.error.ActionFailedException if the safety capture or the restore failed
     */
    public RestoreResult restore(String serverName, String id, RestoreOptions options) {
        TargetName target = TargetName.of(serverName);
        Artifact artifact = require(target, id);

        if (!options.force() && statusProbe.isRunning(target)) {
            throw new TargetBusyException(target.value());
        }

        Map<String, Object> details = details(artifact);
        try {
            Artifact safety = null;
            if (options.createSafetyArtifactFirst()) {
                executor.checkPreconditions(artifact.kind(), target);
                ActionResult result = executor.run(artifact.kind(), target,
                        "Safety snapshot before restoring " + id, null);
                safety = result.artifact();
                if (safety != null) {
                    details.put("safetyArtifactId", safety.id());
                    log.info("Safety artifact {} created before restoring {}", safety.id(), id);
                }
            }

            int restored = executor.restore(artifact);
            details.put("filesRestored", restored);
            audit.record(AuditEvent.success(AuditAction.ARTIFACT_RESTORE, AuditEvent.API_ACTOR, "server",
                    target.value(), details));
            log.info("Restored {} from artifact {}", target, id);

            return new RestoreResult(ArtifactResponse.from(artifact), restored,
                    safety != null ? ArtifactResponse.from(safety) : null);
        } catch (RuntimeException e) {
            audit.record(AuditEvent.failure(AuditAction.ARTIFACT_RESTORE, AuditEvent.API_ACTOR, "server",
                    target.value(), details, e.getMessage()));
            throw e;
        }
    }

    private Artifact require(TargetName target, String id) {
        return artifacts.findById(id)
                .filter(a -> a.target().equals(target))
                .orElseThrow(() -> NotFoundException.artifact(id));
    }

    private static Map<String, Object> details(Artifact artifact) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("artifactId", artifact.id());
        details.put("kind", artifact.kind().name());
        if (artifact.versionRef() != null) {
            details.put("versionRef", artifact.versionRef());
        } else {
            details.put("fileCount", artifact.entries().size());
        }
        return details;
    }
}
