package mcsnap.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a persisted cron-triggered job that produces
 * artifacts for one target.
 */
public final class Schedule {
    private final String id;
    private final ActionKind kind;
    private final TargetName target;
    private final String name;
    private final CronSchedule cron;
    private final boolean enabled;
    private final RetentionPolicy retention;
    private final Instant lastRunAt;
    private final RunStatus lastRunStatus;
    private final String lastRunMessage;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Schedule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.target = Objects.requireNonNull(builder.target, "target is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.cron = Objects.requireNonNull(builder.cron, "cron is required");
        this.enabled = builder.enabled;
        this.retention = builder.retention != null ? builder.retention : RetentionPolicy.none();
        this.lastRunAt = builder.lastRunAt;
        this.lastRunStatus = builder.lastRunStatus;
        this.lastRunMessage = builder.lastRunMessage;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public ActionKind kind() {
        return kind;
    }

    public TargetName target() {
        return target;
    }

    public String name() {
        return name;
    }

    public CronSchedule cron() {
        return cron;
    }

    public boolean enabled() {
        return enabled;
    }

    public RetentionPolicy retention() {
        return retention;
    }

    public Instant lastRunAt() {
        return lastRunAt;
    }

    public RunStatus lastRunStatus() {
        return lastRunStatus;
    }

    public String lastRunMessage() {
        return lastRunMessage;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Copy with the enabled flag changed and updatedAt bumped */
    public Schedule withEnabled(boolean enabled) {
        return toBuilder().enabled(enabled).updatedAt(Instant.now()).build();
    }

    /** Copy with the outcome of a run recorded */
    public Schedule withRun(RunStatus status, String message, Instant at) {
        return toBuilder()
                .lastRunAt(at)
                .lastRunStatus(status)
                .lastRunMessage(message)
                .updatedAt(at)
                .build();
    }

    /** Create a builder from this schedule (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .target(target)
                .name(name)
                .cron(cron)
                .enabled(enabled)
                .retention(retention)
                .lastRunAt(lastRunAt)
                .lastRunStatus(lastRunStatus)
                .lastRunMessage(lastRunMessage)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ActionKind kind = ActionKind.CONFIG_SNAPSHOT;
        private TargetName target;
        private String name;
        private CronSchedule cron;
        private boolean enabled = true;
        private RetentionPolicy retention;
        private Instant lastRunAt;
        private RunStatus lastRunStatus;
        private String lastRunMessage;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(ActionKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder target(TargetName target) {
            this.target = target;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder cron(CronSchedule cron) {
            this.cron = cron;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder retention(RetentionPolicy retention) {
            this.retention = retention;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder lastRunStatus(RunStatus lastRunStatus) {
            this.lastRunStatus = lastRunStatus;
            return this;
        }

        public Builder lastRunMessage(String lastRunMessage) {
            this.lastRunMessage = lastRunMessage;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Schedule build() {
            return new Schedule(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Schedule schedule))
            return false;
        return Objects.equals(id, schedule.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Schedule{id='" + id + "', kind=" + kind + ", target=" + target + ", cron='" + cron
                + "', enabled=" + enabled + "}";
    }
}
