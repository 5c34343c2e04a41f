package mcsnap.engine.scheduler;

import mcsnap.engine.model.ActionKind;

import java.time.Instant;

/**
 * Snapshot of one registered cron job.
 */
public record JobInfo(
        String scheduleId,
        String name,
        String serverName,
        ActionKind kind,
        String cronExpression,
        Instant nextFireTime) {
}
