package mcsnap.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A self-rescheduling timer for one schedule. Each wake-up runs the callback
 * and arms the next one-shot delay computed from the cron expression.
 */
public final class CronTimer {

    private static final Logger log = LoggerFactory.getLogger(CronTimer.class);

    private final String scheduleId;
    private final CronExpression expression;
    private final ZoneId zone;
    private final ScheduledExecutorService executor;
    private final Runnable onFire;

    private volatile boolean stopped = false;
    private volatile ScheduledFuture<?> future;
    private volatile Instant nextFireTime;

    CronTimer(String scheduleId, CronExpression expression, ZoneId zone,
            ScheduledExecutorService executor, Runnable onFire) {
        this.scheduleId = scheduleId;
        this.expression = expression;
        this.zone = zone;
        this.executor = executor;
        this.onFire = onFire;
    }

    synchronized void start() {
        armNext();
    }

    /**
     * Cancel future firings. A firing already handed off is not interrupted.
     */
    public synchronized void stop() {
        stopped = true;
        if (future != null) {
            future.cancel(false);
            future = null;
        }
        nextFireTime = null;
    }

    public boolean isStopped() {
        return stopped;
    }

    /** Next planned wake-up, or null once stopped */
    public Instant nextFireTime() {
        return nextFireTime;
    }

    public String scheduleId() {
        return scheduleId;
    }

    private synchronized void armNext() {
        if (stopped) {
            return;
        }
        // A wake-up slightly ahead of the wall clock must not match the same minute twice
        ZonedDateTime base = ZonedDateTime.now(zone);
        if (nextFireTime != null && base.toInstant().isBefore(nextFireTime)) {
            base = nextFireTime.atZone(zone);
        }
        ZonedDateTime next = expression.next(base);
        if (next == null) {
            log.warn("Cron expression for schedule {} has no future firing", scheduleId);
            nextFireTime = null;
            return;
        }
        nextFireTime = next.toInstant();
        long delayMs = Math.max(0, next.toInstant().toEpochMilli() - System.currentTimeMillis());
        future = executor.schedule(this::fire, delayMs, TimeUnit.MILLISECONDS);
    }

    private void fire() {
        if (stopped) {
            return;
        }
        try {
            onFire.run();
        } catch (Exception e) {
            log.error("Cron callback for schedule {} failed", scheduleId, e);
        } finally {
            armNext();
        }
    }
}
