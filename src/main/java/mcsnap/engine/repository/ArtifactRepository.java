package mcsnap.engine.repository;

import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.Artifact;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for artifact metadata.
 * Artifacts are append-only: there is no update operation.
 */
public interface ArtifactRepository {

    void save(Artifact artifact);

    Optional<Artifact> findById(String id);

    /**
     * Artifacts of a target and kind, newest first.
     *
     * @param limit  maximum results, or 0 for no limit
     * @param offset number of rows to skip
     */
    List<Artifact> findByTarget(String target, ActionKind kind, int limit, int offset);

    /**
     * All artifacts of a target regardless of kind, newest first.
     */
    List<Artifact> findByTarget(String target);

    /**
     * Artifacts produced by one schedule, newest first.
     */
    List<Artifact> findByScheduleId(String scheduleId);

    /**
     * Artifacts of a target and kind in deletion order: oldest first.
     */
    List<Artifact> findOldestFirst(String target, ActionKind kind);

    /**
     * Artifacts of a target and kind created strictly before the cutoff.
     */
    List<Artifact> findCreatedBefore(String target, ActionKind kind, Instant cutoff);

    int countByTarget(String target, ActionKind kind);

    boolean delete(String id);

    String generateId();
}
