package mcsnap.engine.store;

import mcsnap.engine.model.AuditEvent;
import mcsnap.engine.model.RunStatus;
import mcsnap.engine.repository.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audit sink that writes one line per event to the {@code mcsnap.audit} logger.
 * Used when no external audit store is wired in.
 */
public class LoggingAuditSink implements AuditSink {

    private static final Logger audit = LoggerFactory.getLogger("mcsnap.audit");

    @Override
    public void record(AuditEvent event) {
        if (event.status() == RunStatus.FAILURE) {
            audit.warn("{} actor={} {}={} status={} details={} error={}",
                    event.action().code(), event.actor(), event.targetType(), event.targetName(),
                    event.status().wire(), event.details(), event.errorMessage());
        } else {
            audit.info("{} actor={} {}={} status={} details={}",
                    event.action().code(), event.actor(), event.targetType(), event.targetName(),
                    event.status().wire(), event.details());
        }
    }
}
