package mcsnap.engine.scheduler;

import mcsnap.engine.execution.ActionExecutor;
import mcsnap.engine.model.Artifact;
import mcsnap.engine.model.AuditAction;
import mcsnap.engine.model.AuditEvent;
import mcsnap.engine.model.RetentionPolicy;
import mcsnap.engine.model.Schedule;
import mcsnap.engine.repository.ArtifactRepository;
import mcsnap.engine.repository.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prunes artifacts of one (target, kind) pair according to a schedule's
 * retention policy. The count bound and the age bound are applied
 * independently; the artifact a run just produced is never removed.
 */
public class RetentionEngine {

    private static final Logger log = LoggerFactory.getLogger(RetentionEngine.class);

    private final ArtifactRepository artifacts;
    private final ActionExecutor executor;
    private final AuditSink audit;

    public RetentionEngine(ArtifactRepository artifacts, ActionExecutor executor, AuditSink audit) {
        this.artifacts = artifacts;
        this.executor = executor;
        this.audit = audit;
    }

    /**
     * Apply the schedule's policy.
     *
     * @param protectedArtifactId artifact that must survive, may be null
     * @return number of artifacts pruned
     */
    public int apply(Schedule schedule, String protectedArtifactId) {
        RetentionPolicy policy = schedule.retention();
        if (policy.isEmpty()) {
            return 0;
        }

        String target = schedule.target().value();
        Map<String, Artifact> doomed = new LinkedHashMap<>();

        if (policy.hasCountBound()) {
            List<Artifact> oldestFirst = artifacts.findOldestFirst(target, schedule.kind());
            int excess = oldestFirst.size() - policy.maxCount();
            for (Artifact artifact : oldestFirst) {
                if (excess <= 0) {
                    break;
                }
                if (artifact.id().equals(protectedArtifactId)) {
                    continue;
                }
                doomed.put(artifact.id(), artifact);
                excess--;
            }
        }

        if (policy.hasAgeBound()) {
            Instant cutoff = Instant.now().minus(Duration.ofDays(policy.maxAgeDays()));
            for (Artifact artifact : artifacts.findCreatedBefore(target, schedule.kind(), cutoff)) {
                if (!artifact.id().equals(protectedArtifactId)) {
                    doomed.putIfAbsent(artifact.id(), artifact);
                }
            }
        }

        int pruned = 0;
        for (Artifact artifact : doomed.values()) {
            if (prune(artifact, schedule)) {
                pruned++;
            }
        }
        if (pruned > 0) {
            log.info("Retention removed {} artifact(s) for {} ({})", pruned, target, schedule.kind());
        }
        return pruned;
    }

    private boolean prune(Artifact artifact, Schedule schedule) {
        try {
            artifacts.delete(artifact.id());
            discardContents(artifact);
            log.info("Pruned artifact {} (retention policy, schedule: {})", artifact.id(), schedule.id());
            audit.record(AuditEvent.success(AuditAction.ARTIFACT_PRUNE, AuditEvent.SYSTEM_ACTOR,
                    "server", artifact.target().value(),
                    Map.of("artifactId", artifact.id(), "scheduleId", schedule.id())));
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to prune artifact {}: {}", artifact.id(), e.getMessage());
            return false;
        }
    }

    private void discardContents(Artifact artifact) {
        try {
            executor.discard(artifact);
        } catch (RuntimeException e) {
            log.warn("Artifact {} pruned but its stored contents remain (orphan): {}", artifact.id(), e.getMessage());
        }
    }
}
