package com.flowrunner.scheduler;

import com.flowrunner.core.model.WorkflowSleep;
import com.flowrunner.core.repository.WorkflowSleepRepository;
import com.flowrunner.engine.service.ContinuationScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Time-based resume of suspended branches.
 * 
 * Responsibilities:
 * - Arm a one-shot timer for every continuation scheduled while running
 * - Periodically sweep persisted continuations that are due, which covers
 *   continuations created before a restart or scheduled before start
 * 
 * A continuation may fire from both paths; consumption is atomic, so it resumes once.
 * Consumed continuations are kept for {@link #CONSUMED_RETENTION} and then purged by the sweep.
 */
public class SleepScheduler implements ContinuationScheduler {

    private static final Logger log = LoggerFactory.getLogger(SleepScheduler.class);

    private static final int BATCH_SIZE = 100;

    static final Duration CONSUMED_RETENTION = Duration.ofDays(1);

    private final WorkflowSleepRepository sleepRepository;
    private final Duration sweepInterval;

    private final ScheduledExecutorService scheduler;
    private volatile WakeUpCallback callback;
    private volatile boolean running = false;

    public SleepScheduler(WorkflowSleepRepository sleepRepository, Duration sweepInterval) {
        this.sleepRepository = sleepRepository;
        this.sweepInterval = sweepInterval;
        this.scheduler = Executors.newScheduledThreadPool(2);
    }

    /**
     * Start the scheduler.
     * 
     * @param callback Resumes a due continuation
     */
    public void start(WakeUpCallback callback) {
        if (running) {
            log.warn("Sleep scheduler already running");
            return;
        }

        this.callback = callback;
        running = true;
        log.info("Starting sleep scheduler (sweep every {})", sweepInterval);

        scheduler.scheduleWithFixedDelay(
            this::sweep,
            0,
            sweepInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the scheduler.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Sleep scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void schedule(WorkflowSleep sleep) {
        if (!running) {
            log.debug("Sleep scheduler not running, continuation {} left for the sweep", sleep.id());
            return;
        }

        long delayMillis = Math.max(0, Duration.between(Instant.now(), sleep.sleepUntil()).toMillis());
        scheduler.schedule(() -> fire(sleep), delayMillis, TimeUnit.MILLISECONDS);
        log.debug("Armed continuation {} of run {} for {}", sleep.id(), sleep.runId(), sleep.sleepUntil());
    }

    /**
     * Resume every continuation whose wake instant has passed.
     */
    void sweep() {
        if (!running) return;

        try {
            List<WorkflowSleep> due = sleepRepository.findDue(Instant.now(), BATCH_SIZE);
            if (!due.isEmpty()) {
                log.debug("Sweep found {} due continuation(s)", due.size());
            }
            for (WorkflowSleep sleep : due) {
                fire(sleep);
            }
        } catch (Exception e) {
            log.error("Error sweeping continuations", e);
        }
        purgeConsumed();
    }

    void purgeConsumed() {
        try {
            int purged = sleepRepository.deleteConsumedBefore(Instant.now().minus(CONSUMED_RETENTION));
            if (purged > 0) {
                log.info("Purged {} consumed continuation(s)", purged);
            }
        } catch (Exception e) {
            log.error("Error purging consumed continuations", e);
        }
    }

    private void fire(WorkflowSleep sleep) {
        if (!running) return;

        log.info("Waking continuation {} of run {}", sleep.id(), sleep.runId());
        try {
            callback.wakeUp(sleep).whenComplete((v, error) -> {
                if (error != null) {
                    log.error("Resume of continuation {} failed", sleep.id(), error);
                }
            });
        } catch (Exception e) {
            log.error("Failed to wake continuation: {}", sleep.id(), e);
        }
    }

    /**
     * Callback resuming a due continuation.
     */
    @FunctionalInterface
    public interface WakeUpCallback {
        CompletableFuture<Void> wakeUp(WorkflowSleep sleep);
    }
}
