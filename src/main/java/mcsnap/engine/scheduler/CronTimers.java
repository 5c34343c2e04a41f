package mcsnap.engine.scheduler;

import mcsnap.engine.model.CronSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZoneId;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Factory for {@link CronTimer}s sharing one timer thread ({@code mcsnap-cron}).
 * Timer threads only wake up and hand off; actions run elsewhere.
 */
public final class CronTimers implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CronTimers.class);

    static final String CRON_CLASS = "org.springframework.scheduling.support.CronExpression";

    private final ScheduledExecutorService executor;
    private final ZoneId zone;
    private final Set<CronTimer> timers = ConcurrentHashMap.newKeySet();

    private CronTimers(ScheduledExecutorService executor, ZoneId zone) {
        this.executor = executor;
        this.zone = zone;
    }

    /**
     * Load the cron mechanism. Returns empty if cron support is not on the
     * class path, in which case scheduling is disabled but manual runs still work.
     */
    public static Optional<CronTimers> load() {
        return load(CronTimers.class.getClassLoader(), ZoneId.systemDefault());
    }

    static Optional<CronTimers> load(ClassLoader classLoader, ZoneId zone) {
        try {
            Class.forName(CRON_CLASS, false, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            log.warn("Cron support not available ({}). Scheduling disabled.", e.getMessage());
            return Optional.empty();
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mcsnap-cron");
            t.setDaemon(true);
            return t;
        });
        return Optional.of(new CronTimers(executor, zone));
    }

    /**
     * Start a timer that calls {@code onFire} at every cron match.
     */
    public CronTimer start(String scheduleId, CronSchedule cron, Runnable onFire) {
        CronExpression expression = CronExpression.parse(cron.toSecondsPrecision());
        CronTimer timer = new CronTimer(scheduleId, expression, zone, executor, onFire);
        timer.start();
        timers.removeIf(CronTimer::isStopped);
        timers.add(timer);
        return timer;
    }

    /** Timers started here and not yet stopped */
    int liveTimerCount() {
        timers.removeIf(CronTimer::isStopped);
        return timers.size();
    }

    @Override
    public void close() {
        timers.forEach(CronTimer::stop);
        timers.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Cron timer thread forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
