package com.flowrunner.engine.metrics;

import com.flowrunner.core.model.WorkflowRunStartedBy;
import com.flowrunner.core.model.WorkflowRunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the workflow runner.
 * 
 * Metrics exposed:
 * - Run counts by status and start reason
 * - Action latency and failures per operation
 * - Trigger check outcomes
 * - Suspended branches and lost continuations
 * - Lease acquisition metrics
 */
public class WorkflowMetrics {

    // Metric names
    public static final String RUNS_ACTIVE = "flowrunner.runs.active";
    public static final String RUNS_STARTED = "flowrunner.runs.started";
    public static final String RUNS_FINISHED = "flowrunner.runs.finished";

    public static final String ACTION_DURATION = "flowrunner.action.duration";
    public static final String ACTION_FAILURES = "flowrunner.action.failures";

    public static final String TRIGGER_CHECKS = "flowrunner.trigger.checks";
    public static final String TRIGGER_ITEMS = "flowrunner.trigger.items";

    public static final String SLEEPS_SCHEDULED = "flowrunner.sleeps.scheduled";
    public static final String CONTINUATIONS_RESUMED = "flowrunner.continuations.resumed";
    public static final String CONTINUATIONS_LOST = "flowrunner.continuations.lost";

    public static final String LEASE_ACQUISITIONS = "flowrunner.lease.acquisitions";
    public static final String FAILURE_CASCADES = "flowrunner.failure.cascades";

    private final MeterRegistry registry;

    // Gauges for in-flight runs
    private final Map<WorkflowRunStatus, AtomicInteger> runStateGauges = new ConcurrentHashMap<>();

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;

        for (WorkflowRunStatus status : new WorkflowRunStatus[]{WorkflowRunStatus.RUNNING, WorkflowRunStatus.SLEEPING}) {
            AtomicInteger gauge = new AtomicInteger(0);
            runStateGauges.put(status, gauge);
            Gauge.builder(RUNS_ACTIVE, gauge, AtomicInteger::get)
                .tag("status", status.name())
                .description("Number of runs in " + status + " status")
                .register(registry);
        }
    }

    // ========== Run Metrics ==========

    public void runStarted(WorkflowRunStartedBy startedBy) {
        Counter.builder(RUNS_STARTED)
            .tag("started_by", startedBy.name())
            .description("Total workflow runs started")
            .register(registry)
            .increment();

        increment(WorkflowRunStatus.RUNNING);
    }

    public void runTransitioned(WorkflowRunStatus from, WorkflowRunStatus to) {
        decrement(from);
        if (to.isTerminal()) {
            Counter.builder(RUNS_FINISHED)
                .tag("status", to.name())
                .description("Total workflow runs finished")
                .register(registry)
                .increment();
        } else {
            increment(to);
        }
    }

    // ========== Action Metrics ==========

    public void actionCompleted(String integration, String operation, Duration duration) {
        Timer.builder(ACTION_DURATION)
            .tag("integration", tagValue(integration))
            .tag("operation", tagValue(operation))
            .tag("outcome", "success")
            .description("Action execution duration")
            .register(registry)
            .record(duration);
    }

    public void actionFailed(String integration, String operation, String errorType) {
        Counter.builder(ACTION_FAILURES)
            .tag("integration", tagValue(integration))
            .tag("operation", tagValue(operation))
            .tag("error_type", tagValue(errorType))
            .description("Total action failures")
            .register(registry)
            .increment();
    }

    // ========== Trigger Metrics ==========

    public void triggerChecked(String outcome) {
        Counter.builder(TRIGGER_CHECKS)
            .tag("outcome", outcome)
            .description("Trigger checks by outcome")
            .register(registry)
            .increment();
    }

    public void triggerItemsDispatched(int count) {
        Counter.builder(TRIGGER_ITEMS)
            .description("New trigger items dispatched to action trees")
            .register(registry)
            .increment(count);
    }

    // ========== Continuation Metrics ==========

    public void sleepScheduled() {
        Counter.builder(SLEEPS_SCHEDULED)
            .description("Branches suspended until a wake instant")
            .register(registry)
            .increment();
    }

    public void continuationResumed() {
        Counter.builder(CONTINUATIONS_RESUMED)
            .description("Suspended branches resumed")
            .register(registry)
            .increment();
    }

    public void continuationLost(String reason) {
        Counter.builder(CONTINUATIONS_LOST)
            .tag("reason", reason)
            .description("Continuations whose run or action no longer exists")
            .register(registry)
            .increment();
    }

    // ========== Lease / Failure Metrics ==========

    public void leaseAcquired(boolean success) {
        Counter.builder(LEASE_ACQUISITIONS)
            .tag("success", String.valueOf(success))
            .description("Trigger lease acquisition attempts")
            .register(registry)
            .increment();
    }

    public void failureCascaded() {
        Counter.builder(FAILURE_CASCADES)
            .description("Failure workflows started by a failed run")
            .register(registry)
            .increment();
    }

    // ========== Helper Methods ==========

    private void increment(WorkflowRunStatus status) {
        AtomicInteger gauge = runStateGauges.get(status);
        if (gauge != null) {
            gauge.incrementAndGet();
        }
    }

    private void decrement(WorkflowRunStatus status) {
        AtomicInteger gauge = runStateGauges.get(status);
        if (gauge != null) {
            gauge.updateAndGet(v -> Math.max(0, v - 1));
        }
    }

    private static String tagValue(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
