package com.flowrunner.scheduler;

import com.flowrunner.core.model.WorkflowRunStartedBy;
import com.flowrunner.core.model.WorkflowTrigger;
import com.flowrunner.core.repository.WorkflowTriggerRepository;
import com.flowrunner.engine.logging.LoggingContext;
import com.flowrunner.engine.service.RunnerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically checks every enabled trigger.
 * Overlapping checks of the same trigger are skipped by the trigger lease.
 */
public class TriggerPollScheduler {

    private static final Logger log = LoggerFactory.getLogger(TriggerPollScheduler.class);

    private static final int BATCH_SIZE = 500;

    private final WorkflowTriggerRepository triggerRepository;
    private final RunnerService runnerService;
    private final Duration pollInterval;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public TriggerPollScheduler(
            WorkflowTriggerRepository triggerRepository,
            RunnerService runnerService,
            Duration pollInterval) {
        this.triggerRepository = triggerRepository;
        this.runnerService = runnerService;
        this.pollInterval = pollInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Trigger poll scheduler already running");
            return;
        }

        running = true;
        log.info("Starting trigger poll scheduler (every {})", pollInterval);

        scheduler.scheduleWithFixedDelay(
            this::pollTriggers,
            pollInterval.toMillis(),
            pollInterval.toMillis(),
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
        log.info("Trigger poll scheduler stopped");
    }

    /**
     * Start a check of every enabled trigger. Checks run asynchronously.
     */
    void pollTriggers() {
        if (!running) return;

        try {
            List<WorkflowTrigger> triggers = triggerRepository.findEnabled(BATCH_SIZE);
            for (WorkflowTrigger trigger : triggers) {
                try {
                    runnerService.runWorkflowTriggerCheck(trigger, WorkflowRunStartedBy.TRIGGER)
                        .whenComplete((v, error) -> {
                            if (error != null) {
                                log.error("Check of trigger {} aborted", trigger.id(), error);
                            }
                        });
                } catch (Exception e) {
                    log.error("Failed to start check of trigger: {}", trigger.id(), e);
                }
            }
        } catch (Exception e) {
            log.error("Error polling triggers", e);
        } finally {
            LoggingContext.clearAll();
        }
    }
}
