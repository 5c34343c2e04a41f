package mcsnap.engine.service;

import mcsnap.engine.api.dto.CreateScheduleRequest;
import mcsnap.engine.api.dto.ScheduleResponse;
import mcsnap.engine.api.dto.UpdateScheduleRequest;
import mcsnap.engine.config.EngineConfig;
import mcsnap.engine.error.NotFoundException;
import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.AuditAction;
import mcsnap.engine.model.AuditEvent;
import mcsnap.engine.model.CronSchedule;
import mcsnap.engine.model.RetentionPolicy;
import mcsnap.engine.model.Schedule;
import mcsnap.engine.model.TargetName;
import mcsnap.engine.repository.AuditSink;
import mcsnap.engine.repository.ScheduleRepository;
import mcsnap.engine.scheduler.ExecutionOutcome;
import mcsnap.engine.scheduler.SchedulerCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Business logic for schedule management. Every mutation is persisted first
 * and then pushed into the running scheduler.
 */
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository schedules;
    private final SchedulerCore scheduler;
    private final AuditSink audit;
    private final EngineConfig config;

    public ScheduleService(ScheduleRepository schedules, SchedulerCore scheduler, AuditSink audit,
            EngineConfig config) {
        this.schedules = schedules;
        this.scheduler = scheduler;
        this.audit = audit;
        this.config = config;
    }

    /**
     * Create a schedule and register it if enabled. A config snapshot schedule
     * without retention bounds keeps the last {@code defaultRetentionCount} snapshots.
     *
     * @throws mcsnap.engine.error.ValidationException on an invalid request
     */
    public ScheduleResponse create(CreateScheduleRequest request) {
        request.validate();

        ActionKind kind = request.actionKind();
        RetentionPolicy retention = new RetentionPolicy(request.retentionCount(), request.retentionMaxAgeDays());
        if (retention.isEmpty() && kind == ActionKind.CONFIG_SNAPSHOT) {
            retention = RetentionPolicy.ofCount(config.defaultRetentionCount());
        }

        Instant now = Instant.now();
        Schedule schedule = Schedule.builder()
                .id(schedules.generateId())
                .kind(kind)
                .target(request.target())
                .name(request.trimmedName())
                .cron(request.cron())
                .enabled(request.enabledOrDefault())
                .retention(retention)
                .createdAt(now)
                .updatedAt(now)
                .build();

        schedules.create(schedule);
        scheduler.updateSchedule(schedule);
        log.info("Created schedule {} '{}' for {} ({})", schedule.id(), schedule.name(), schedule.target(),
                schedule.cron());

        audit.record(AuditEvent.success(AuditAction.SCHEDULE_CREATE, AuditEvent.API_ACTOR, "server",
                schedule.target().value(), details(schedule)));
        return ScheduleResponse.from(schedule);
    }

    /**
     * Apply a partial update. Null request fields are left unchanged; retention
     * bounds are dropped only through {@link UpdateScheduleRequest#clearsRetention()}.
     *
     * @throws NotFoundException if the schedule does not exist
     */
    public ScheduleResponse update(String id, UpdateScheduleRequest request) {
        request.validate();
        Schedule existing = require(id);

        Schedule.Builder builder = existing.toBuilder().updatedAt(Instant.now());
        if (request.name() != null) {
            builder.name(request.name().trim());
        }
        if (request.cronExpression() != null) {
            builder.cron(CronSchedule.parse(request.cronExpression()));
        }
        if (request.enabled() != null) {
            builder.enabled(request.enabled());
        }
        if (request.clearsRetention() || request.retentionCount() != null
                || request.retentionMaxAgeDays() != null) {
            RetentionPolicy current = request.clearsRetention() ? RetentionPolicy.none() : existing.retention();
            builder.retention(new RetentionPolicy(
                    request.retentionCount() != null ? request.retentionCount() : current.maxCount(),
                    request.retentionMaxAgeDays() != null ? request.retentionMaxAgeDays() : current.maxAgeDays()));
        }
        Schedule updated = builder.build();

        schedules.update(updated);
        scheduler.updateSchedule(updated);
        log.info("Updated schedule {} '{}'", updated.id(), updated.name());

        audit.record(AuditEvent.success(AuditAction.SCHEDULE_UPDATE, AuditEvent.API_ACTOR, "server",
                updated.target().value(), details(updated)));
        return ScheduleResponse.from(updated);
    }

    /**
     * Enable or disable a schedule.
     */
    public ScheduleResponse toggle(String id, boolean enabled) {
        Schedule updated = require(id).withEnabled(enabled);

        schedules.update(updated);
        scheduler.updateSchedule(updated);
        log.info("Schedule {} {}", id, enabled ? "enabled" : "disabled");

        Map<String, Object> details = details(updated);
        details.put("enabled", enabled);
        audit.record(AuditEvent.success(AuditAction.SCHEDULE_TOGGLE, AuditEvent.API_ACTOR, "server",
                updated.target().value(), details));
        return ScheduleResponse.from(updated);
    }

    /**
     * Delete a schedule and stop its timer. Artifacts it produced are kept.
     */
    public void delete(String id) {
        Schedule existing = require(id);

        schedules.delete(id);
        scheduler.unregisterTask(id);
        log.info("Deleted schedule {} '{}'", id, existing.name());

        audit.record(AuditEvent.success(AuditAction.SCHEDULE_DELETE, AuditEvent.API_ACTOR, "server",
                existing.target().value(), details(existing)));
    }

    /**
     * List schedules, optionally restricted to one server.
     */
    public List<ScheduleResponse> list(String serverName) {
        List<Schedule> found = serverName == null || serverName.isBlank()
                ? schedules.findAll()
                : schedules.findByTarget(TargetName.of(serverName).value());
        return found.stream().map(ScheduleResponse::from).toList();
    }

    public ScheduleResponse findById(String id) {
        return ScheduleResponse.from(require(id));
    }

    /**
     * Run a schedule immediately, even if it is disabled. The outcome is
     * recorded exactly as for a timed firing.
     */
    public ExecutionOutcome runNow(String id) {
        Schedule schedule = require(id);
        log.info("Manual run of schedule {} '{}'", id, schedule.name());
        return scheduler.run(schedule);
    }

    private Schedule require(String id) {
        return schedules.findById(id).orElseThrow(() -> NotFoundException.schedule(id));
    }

    private static Map<String, Object> details(Schedule schedule) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("scheduleId", schedule.id());
        details.put("name", schedule.name());
        details.put("kind", schedule.kind().name());
        details.put("cronExpression", schedule.cron().expression());
        return details;
    }
}
