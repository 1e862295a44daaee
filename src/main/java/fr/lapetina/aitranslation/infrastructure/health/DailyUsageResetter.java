package fr.lapetina.aitranslation.infrastructure.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background job clearing daily usage counters at midnight.
 *
 * Each run schedules the next one, so the job follows DST changes in the configured zone.
 */
public final class DailyUsageResetter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DailyUsageResetter.class);

    private final Runnable resetAction;
    private final ZoneId zone;
    private final Clock clock;
    private final ScheduledThreadPoolExecutor scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> nextRun;

    public DailyUsageResetter(Runnable resetAction, ZoneId zone, Clock clock) {
        this.resetAction = resetAction;
        this.zone = zone;
        this.clock = clock;
        this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "daily-usage-reset");
            t.setDaemon(true);
            return t;
        });
        // The pending one-shot run must not keep the executor alive after shutdown.
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        scheduler.setRemoveOnCancelPolicy(true);
    }

    public DailyUsageResetter(Runnable resetAction, ZoneId zone) {
        this(resetAction, zone, Clock.systemUTC());
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduleNext();
            log.info("Daily usage reset scheduled: zone={}", zone);
        }
    }

    /**
     * Time left until the next midnight in the configured zone.
     */
    public Duration delayUntilNextMidnight() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        ZonedDateTime nextMidnight = now.toLocalDate().plusDays(1).atStartOfDay(zone);
        return Duration.between(now, nextMidnight);
    }

    /**
     * Runs the reset immediately.
     */
    public void runNow() {
        try {
            resetAction.run();
            log.info("Daily usage counters reset");
        } catch (Exception e) {
            log.error("Daily usage reset failed", e);
        }
    }

    private void scheduleNext() {
        if (!running.get()) {
            return;
        }
        Duration delay = delayUntilNextMidnight();
        nextRun = scheduler.schedule(() -> {
            runNow();
            scheduleNext();
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Next daily usage reset in {}", delay);
    }

    /**
     * Stops the job. Returns without waiting for the next midnight.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            ScheduledFuture<?> pending = nextRun;
            if (pending != null) {
                pending.cancel(false);
            }
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Daily usage resetter stopped");
        }
    }
}
