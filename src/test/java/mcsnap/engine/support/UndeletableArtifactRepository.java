package mcsnap.engine.support;

import mcsnap.engine.error.StorageException;
import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.Artifact;
import mcsnap.engine.repository.ArtifactRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Delegating repository whose deletes always fail, as a locked or
 * unreachable database would.
 */
public class UndeletableArtifactRepository implements ArtifactRepository {

    private final ArtifactRepository delegate;

    public UndeletableArtifactRepository(ArtifactRepository delegate) {
        this.delegate = delegate;
    }

    @Override
    public void save(Artifact artifact) {
        delegate.save(artifact);
    }

    @Override
    public Optional<Artifact> findById(String id) {
        return delegate.findById(id);
    }

    @Override
    public List<Artifact> findByTarget(String target, ActionKind kind, int limit, int offset) {
        return delegate.findByTarget(target, kind, limit, offset);
    }

    @Override
    public List<Artifact> findByTarget(String target) {
        return delegate.findByTarget(target);
    }

    @Override
    public List<Artifact> findByScheduleId(String scheduleId) {
        return delegate.findByScheduleId(scheduleId);
    }

    @Override
    public List<Artifact> findOldestFirst(String target, ActionKind kind) {
        return delegate.findOldestFirst(target, kind);
    }

    @Override
    public List<Artifact> findCreatedBefore(String target, ActionKind kind, Instant cutoff) {
        return delegate.findCreatedBefore(target, kind, cutoff);
    }

    @Override
    public int countByTarget(String target, ActionKind kind) {
        return delegate.countByTarget(target, kind);
    }

    @Override
    public boolean delete(String id) {
        throw new StorageException("Failed to delete artifact: " + id);
    }

    @Override
    public String generateId() {
        return delegate.generateId();
    }
}
