package mcsnap.engine.model;

/**
 * Actions reported to the audit sink.
 */
public enum AuditAction {
    SCHEDULE_CREATE("schedule.create"),
    SCHEDULE_UPDATE("schedule.update"),
    SCHEDULE_TOGGLE("schedule.toggle"),
    SCHEDULE_DELETE("schedule.delete"),
    SCHEDULE_RUN("schedule.run"),
    ARTIFACT_CREATE("artifact.create"),
    ARTIFACT_DELETE("artifact.delete"),
    ARTIFACT_PRUNE("artifact.prune"),
    ARTIFACT_RESTORE("artifact.restore");

    private final String code;

    AuditAction(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
