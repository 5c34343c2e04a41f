package mcsnap.engine.model;

import java.time.Instant;
import java.util.Map;

/**
 * Audit record handed to the audit sink. Storage of these records is owned by
 * the sink implementation.
 */
public record AuditEvent(
        AuditAction action,
        String actor,
        String targetType,
        String targetName,
        RunStatus status,
        Map<String, Object> details,
        String errorMessage,
        Instant timestamp) {

    public static final String SYSTEM_ACTOR = "system:scheduler";
    public static final String API_ACTOR = "api";

    public static AuditEvent success(AuditAction action, String actor, String targetType, String targetName,
            Map<String, Object> details) {
        return new AuditEvent(action, actor, targetType, targetName, RunStatus.SUCCESS, details, null,
                Instant.now());
    }

    public static AuditEvent failure(AuditAction action, String actor, String targetType, String targetName,
            Map<String, Object> details, String errorMessage) {
        return new AuditEvent(action, actor, targetType, targetName, RunStatus.FAILURE, details, errorMessage,
                Instant.now());
    }
}
