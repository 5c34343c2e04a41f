package mcsnap.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import mcsnap.engine.model.CronSchedule;
import mcsnap.engine.model.RetentionPolicy;

/**
 * Request DTO for a partial schedule update. Null fields are left unchanged.
 * Kind and server name cannot be changed.
 * <p>
 * A null retention bound keeps the current bound, so dropping one takes
 * {@code clearRetention}: the existing policy is reset to none and any bounds
 * given in the same request are then applied.
 */
public record UpdateScheduleRequest(
        @JsonProperty("name") String name,
        @JsonProperty("cronExpression") String cronExpression,
        @JsonProperty("retentionCount") Integer retentionCount,
        @JsonProperty("retentionMaxAgeDays") Integer retentionMaxAgeDays,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("clearRetention") Boolean clearRetention) {

    public static UpdateScheduleRequest cron(String cronExpression) {
        return new UpdateScheduleRequest(null, cronExpression, null, null, null, null);
    }

    public static UpdateScheduleRequest retention(Integer count, Integer maxAgeDays) {
        return new UpdateScheduleRequest(null, null, count, maxAgeDays, null, null);
    }

    /** Replace the retention policy outright; null bounds are dropped. */
    public static UpdateScheduleRequest replaceRetention(Integer count, Integer maxAgeDays) {
        return new UpdateScheduleRequest(null, null, count, maxAgeDays, null, true);
    }

    public boolean clearsRetention() {
        return Boolean.TRUE.equals(clearRetention);
    }

    /** Validate the fields that are present */
    public void validate() {
        if (name != null) {
            CreateScheduleRequest.validateName(name);
        }
        if (cronExpression != null) {
            CronSchedule.parse(cronExpression);
        }
        new RetentionPolicy(retentionCount, retentionMaxAgeDays);
    }

    public boolean isEmpty() {
        return name == null && cronExpression == null && retentionCount == null
                && retentionMaxAgeDays == null && enabled == null && !clearsRetention();
    }
}
