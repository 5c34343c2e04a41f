package mcsnap.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import mcsnap.engine.model.Schedule;

import java.time.Instant;

/**
 * Response DTO for a schedule.
 */
public record ScheduleResponse(
        @JsonProperty("id") String id,
        @JsonProperty("kind") String kind,
        @JsonProperty("serverName") String serverName,
        @JsonProperty("name") String name,
        @JsonProperty("cronExpression") String cronExpression,
        @JsonProperty("cronHumanReadable") String cronHumanReadable,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("retentionCount") Integer retentionCount,
        @JsonProperty("retentionMaxAgeDays") Integer retentionMaxAgeDays,
        @JsonProperty("lastRunAt") Instant lastRunAt,
        @JsonProperty("lastRunStatus") String lastRunStatus,
        @JsonProperty("lastRunMessage") String lastRunMessage,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    /** Create response from domain model */
    public static ScheduleResponse from(Schedule schedule) {
        return new ScheduleResponse(
                schedule.id(),
                ScheduleKinds.wire(schedule.kind()),
                schedule.target().value(),
                schedule.name(),
                schedule.cron().expression(),
                schedule.cron().toHumanReadable(),
                schedule.enabled(),
                schedule.retention().maxCount(),
                schedule.retention().maxAgeDays(),
                schedule.lastRunAt(),
                schedule.lastRunStatus() != null ? schedule.lastRunStatus().wire() : null,
                schedule.lastRunMessage(),
                schedule.createdAt(),
                schedule.updatedAt());
    }
}
