package mcsnap.engine.scheduler;

import mcsnap.engine.error.ActionFailedException;
import mcsnap.engine.execution.ActionExecutor;
import mcsnap.engine.execution.ActionResult;
import mcsnap.engine.model.ActionKind;
import mcsnap.engine.model.AuditAction;
import mcsnap.engine.model.AuditEvent;
import mcsnap.engine.model.RunStatus;
import mcsnap.engine.model.Schedule;
import mcsnap.engine.repository.AuditSink;
import mcsnap.engine.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns one cron timer per enabled schedule and runs the schedule's action
 * each time its timer fires.
 * <p>
 * The in-memory registry is a cache of the schedule store: it is rebuilt by
 * {@link #initialize()} / {@link #reload()} and kept in step by the schedule
 * service after every mutation. Firings are handed to a worker pool, so
 * different schedules run concurrently; a schedule that is still running when
 * it fires again is skipped.
 */
public class SchedulerCore {

    private static final Logger log = LoggerFactory.getLogger(SchedulerCore.class);

    private final ScheduleRepository schedules;
    private final ActionExecutor actionExecutor;
    private final RetentionEngine retention;
    private final AuditSink audit;
    private final Optional<CronTimers> cronTimers;
    private final ExecutorService workers;

    private final Map<String, Registration> registry = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private record Registration(Schedule schedule, CronTimer timer) {
    }

    public SchedulerCore(ScheduleRepository schedules, ActionExecutor actionExecutor, RetentionEngine retention,
            AuditSink audit, Optional<CronTimers> cronTimers, ExecutorService workers) {
        this.schedules = schedules;
        this.actionExecutor = actionExecutor;
        this.retention = retention;
        this.audit = audit;
        this.cronTimers = cronTimers;
        this.workers = workers;
    }

    /**
     * Load all enabled schedules from the store and register them.
     */
    public void initialize() {
        if (cronTimers.isEmpty()) {
            log.warn("Cron support not available. Scheduled snapshots are disabled; manual runs still work.");
            return;
        }
        loadEnabledSchedules();
    }

    private void loadEnabledSchedules() {
        try {
            List<Schedule> enabled = schedules.findAllEnabled();
            log.info("Loading {} enabled schedule(s)", enabled.size());
            for (Schedule schedule : enabled) {
                registerTask(schedule);
            }
        } catch (RuntimeException e) {
            log.error("Failed to load schedules", e);
        }
    }

    /**
     * Start a timer for the schedule, replacing any existing one for the same id.
     * The swap happens under the registry's per-key lock, so concurrent calls
     * for one id leave exactly one live timer.
     */
    public void registerTask(Schedule schedule) {
        if (cronTimers.isEmpty()) {
            return;
        }
        registry.compute(schedule.id(), (id, existing) -> {
            if (existing != null) {
                existing.timer().stop();
            }
            try {
                CronTimer timer = cronTimers.get().start(id, schedule.cron(), () -> dispatch(id));
                log.info("Registered schedule: {} ({}) [{}]", schedule.name(), schedule.cron(), id);
                return new Registration(schedule, timer);
            } catch (RuntimeException e) {
                log.error("Failed to register schedule: {} [{}]", schedule.name(), id, e);
                return null;
            }
        });
    }

    /**
     * Stop and forget the timer for a schedule. No-op when none is registered.
     */
    public void unregisterTask(String scheduleId) {
        Registration existing = registry.remove(scheduleId);
        if (existing != null) {
            existing.timer().stop();
            log.info("Unregistered schedule: {}", scheduleId);
        }
    }

    /**
     * Bring the registry in line with a changed schedule.
     */
    public void updateSchedule(Schedule schedule) {
        if (schedule.enabled()) {
            registerTask(schedule);
        } else {
            unregisterTask(schedule.id());
        }
    }

    /**
     * Drop every timer and rebuild the registry from the store.
     */
    public void reload() {
        stopAll();
        if (cronTimers.isPresent()) {
            loadEnabledSchedules();
        }
    }

    /**
     * Cancel all future firings. Executions already running finish and record.
     */
    public void shutdown() {
        stopAll();
        log.info("Snapshot scheduler stopped");
    }

    public int activeTaskCount() {
        return registry.size();
    }

    public boolean isRegistered(String scheduleId) {
        return registry.containsKey(scheduleId);
    }

    public List<JobInfo> runningJobs() {
        List<JobInfo> jobs = new ArrayList<>();
        for (Registration r : registry.values()) {
            Schedule s = r.schedule();
            jobs.add(new JobInfo(s.id(), s.name(), s.target().value(), s.kind(), s.cron().expression(),
                    r.timer().nextFireTime()));
        }
        jobs.sort(Comparator.comparing(JobInfo::name).thenComparing(JobInfo::scheduleId));
        return jobs;
    }

    public Optional<Instant> nextFireTime(String scheduleId) {
        Registration r = registry.get(scheduleId);
        return r == null ? Optional.empty() : Optional.ofNullable(r.timer().nextFireTime());
    }

    /**
     * Re-read the schedule and run it if it is still enabled. Never throws.
     */
    public ExecutionOutcome executeAction(String scheduleId) {
        Optional<Schedule> runnable = loadRunnable(scheduleId);
        if (runnable.isEmpty()) {
            return ExecutionOutcome.skipped("Schedule is disabled or missing");
        }
        return run(runnable.get());
    }

    /**
     * Run a schedule now, whether or not it is enabled. Skipped when the same
     * schedule is already running.
     */
    public ExecutionOutcome run(Schedule schedule) {
        if (!inFlight.add(schedule.id())) {
            log.warn("Schedule {} is still running, skipping this run", schedule.name());
            return ExecutionOutcome.skipped("Execution already in progress");
        }
        try {
            return execute(schedule);
        } finally {
            inFlight.remove(schedule.id());
        }
    }

    /**
     * Timer callback. The schedule is claimed before it is queued, so firings
     * that arrive while one is queued or running are dropped instead of piling
     * up behind it.
     */
    void dispatch(String scheduleId) {
        if (!inFlight.add(scheduleId)) {
            log.warn("Schedule {} is still queued or running, skipping this firing", scheduleId);
            return;
        }
        try {
            workers.execute(() -> {
                try {
                    loadRunnable(scheduleId).ifPresent(this::execute);
                } finally {
                    inFlight.remove(scheduleId);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(scheduleId);
            log.warn("Worker pool rejected firing of schedule {}: {}", scheduleId, e.getMessage());
        }
    }

    private Optional<Schedule> loadRunnable(String scheduleId) {
        Optional<Schedule> found;
        try {
            found = schedules.findById(scheduleId);
        } catch (RuntimeException e) {
            log.error("Failed to load schedule {} for execution", scheduleId, e);
            return Optional.empty();
        }
        if (found.isEmpty() || !found.get().enabled()) {
            log.warn("Skipping disabled/missing schedule: {}", scheduleId);
            return Optional.empty();
        }
        return found;
    }

    private ExecutionOutcome execute(Schedule schedule) {
        log.info("Executing scheduled {}: {}", describeKind(schedule.kind()), schedule.name());

        try {
            actionExecutor.checkPreconditions(schedule.kind(), schedule.target());
            ActionResult result = actionExecutor.run(schedule.kind(), schedule.target(),
                    describeRun(schedule), schedule.id());

            if (!result.changed()) {
                record(schedule, RunStatus.SUCCESS, result.message());
                return new ExecutionOutcome(ExecutionOutcome.Status.NO_CHANGES, result.message(), null, 0);
            }

            record(schedule, RunStatus.SUCCESS, result.message());
            log.info("Scheduled {} complete: {} - {}", describeKind(schedule.kind()), schedule.name(),
                    result.message());

            int pruned = 0;
            if (result.hasArtifact()) {
                pruned = applyRetention(schedule, result.artifact().id());
            }
            return new ExecutionOutcome(ExecutionOutcome.Status.SUCCESS, result.message(), result.artifact(),
                    pruned);
        } catch (ActionFailedException e) {
            return fail(schedule, e.getMessage());
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.debug("Unexpected failure in schedule {}", schedule.id(), e);
            return fail(schedule, message);
        }
    }

    private ExecutionOutcome fail(Schedule schedule, String message) {
        log.error("Scheduled {} failed: {} - {}", describeKind(schedule.kind()), schedule.name(), message);
        record(schedule, RunStatus.FAILURE, message);
        return ExecutionOutcome.failure(message);
    }

    private int applyRetention(Schedule schedule, String protectedArtifactId) {
        try {
            return retention.apply(schedule, protectedArtifactId);
        } catch (RuntimeException e) {
            log.error("Failed to apply retention policy for schedule: {}", schedule.id(), e);
            return 0;
        }
    }

    private void record(Schedule schedule, RunStatus status, String message) {
        try {
            schedules.recordRun(schedule.id(), status, message);
        } catch (RuntimeException e) {
            log.error("Failed to record run for schedule: {}", schedule.id(), e);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("scheduleId", schedule.id());
        details.put("scheduleName", schedule.name());
        details.put("kind", schedule.kind().name());
        if (message != null) {
            details.put("message", message);
        }
        try {
            audit.record(status == RunStatus.SUCCESS
                    ? AuditEvent.success(AuditAction.SCHEDULE_RUN, AuditEvent.SYSTEM_ACTOR, "server",
                            schedule.target().value(), details)
                    : AuditEvent.failure(AuditAction.SCHEDULE_RUN, AuditEvent.SYSTEM_ACTOR, "server",
                            schedule.target().value(), details, message));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit event for schedule {}: {}", schedule.id(), e.getMessage());
        }
    }

    private void stopAll() {
        for (String id : new ArrayList<>(registry.keySet())) {
            unregisterTask(id);
        }
    }

    private static String describeKind(ActionKind kind) {
        return kind == ActionKind.CONFIG_SNAPSHOT ? "config snapshot" : "backup";
    }

    static String describeRun(Schedule schedule) {
        String at = Instant.now().toString();
        return schedule.kind() == ActionKind.CONFIG_SNAPSHOT
                ? "Scheduled: " + schedule.name() + " [" + at + "]"
                : "Scheduled backup: " + schedule.name() + " [" + at + "]";
    }
}
