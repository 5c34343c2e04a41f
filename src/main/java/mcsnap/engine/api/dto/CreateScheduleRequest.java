package mcsnap.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import mcsnap.engine.error.ValidationException;
import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.CronSchedule;
import mcsnap.engine.model.RetentionPolicy;
import mcsnap.engine.model.TargetName;

/**
 * Request DTO for creating a schedule. {@code kind} defaults to
 * {@code config-snapshot}; {@code enabled} defaults to true.
 */
public record CreateScheduleRequest(
        @JsonProperty("kind") String kind,
        @JsonProperty("serverName") String serverName,
        @JsonProperty("name") String name,
        @JsonProperty("cronExpression") String cronExpression,
        @JsonProperty("retentionCount") Integer retentionCount,
        @JsonProperty("retentionMaxAgeDays") Integer retentionMaxAgeDays,
        @JsonProperty("enabled") Boolean enabled) {

    public static final int MAX_NAME_LENGTH = 100;

    public static CreateScheduleRequest of(String serverName, String name, String cronExpression) {
        return new CreateScheduleRequest(null, serverName, name, cronExpression, null, null, null);
    }

    public CreateScheduleRequest withKind(ActionKind kind) {
        return new CreateScheduleRequest(ScheduleKinds.wire(kind), serverName, name, cronExpression,
                retentionCount, retentionMaxAgeDays, enabled);
    }

    public CreateScheduleRequest withRetention(Integer count, Integer maxAgeDays) {
        return new CreateScheduleRequest(kind, serverName, name, cronExpression, count, maxAgeDays, enabled);
    }

    public CreateScheduleRequest withEnabled(Boolean enabled) {
        return new CreateScheduleRequest(kind, serverName, name, cronExpression, retentionCount,
                retentionMaxAgeDays, enabled);
    }

    /** Validate the request */
    public void validate() {
        actionKind();
        target();
        trimmedName();
        cron();
        new RetentionPolicy(retentionCount, retentionMaxAgeDays);
    }

    public ActionKind actionKind() {
        return ScheduleKinds.parse(kind);
    }

    public TargetName target() {
        return TargetName.of(serverName);
    }

    public String trimmedName() {
        return validateName(name);
    }

    public CronSchedule cron() {
        return CronSchedule.parse(cronExpression);
    }

    public boolean enabledOrDefault() {
        return enabled == null || enabled;
    }

    static String validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }
}
