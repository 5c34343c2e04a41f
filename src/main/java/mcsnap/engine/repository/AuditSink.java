package mcsnap.engine.repository;

import mcsnap.engine.model.AuditEvent;

/**
 * Receives audit events emitted by the engine. Implementations must not throw
 * back into the engine for storage failures of their own.
 */
@FunctionalInterface
public interface AuditSink {

    void record(AuditEvent event);
}
