package com.flowrunner.engine.coordinator;

import com.flowrunner.core.exception.InvalidStateTransitionException;
import com.flowrunner.core.exception.NotFoundException;
import com.flowrunner.core.model.ActionRunStatus;
import com.flowrunner.core.model.TriggerRun;
import com.flowrunner.core.model.WorkflowRun;
import com.flowrunner.core.model.WorkflowRunAction;
import com.flowrunner.core.model.WorkflowRunStatus;
import com.flowrunner.core.model.WorkflowSleep;
import com.flowrunner.core.repository.WorkflowRunActionRepository;
import com.flowrunner.core.repository.WorkflowRunRepository;
import com.flowrunner.core.repository.WorkflowSleepRepository;
import com.flowrunner.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every write to run and run-action records.
 * 
 * A run may be executed by several invocations at once (the starting call plus resumed
 * continuations). The run is finalized when the last active invocation exits:
 * SLEEPING if continuations are pending, FAILED if any action failed, COMPLETED otherwise.
 */
public class WorkflowRunRecorder {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunRecorder.class);

    private final WorkflowRunRepository runRepository;
    private final WorkflowRunActionRepository runActionRepository;
    private final WorkflowSleepRepository sleepRepository;
    private final WorkflowMetrics metrics;

    private final Object lock = new Object();
    private final Map<String, Integer> activeInvocations = new ConcurrentHashMap<>();

    public WorkflowRunRecorder(
            WorkflowRunRepository runRepository,
            WorkflowRunActionRepository runActionRepository,
            WorkflowSleepRepository sleepRepository,
            WorkflowMetrics metrics) {
        this.runRepository = runRepository;
        this.runActionRepository = runActionRepository;
        this.sleepRepository = sleepRepository;
        this.metrics = metrics;
    }

    // ========== Runs ==========

    public WorkflowRun startRun(WorkflowRun run) {
        runRepository.save(run);
        metrics.runStarted(run.startedBy());
        log.info("Created run {} of workflow {} (startedBy={})", run.id(), run.workflowId(), run.startedBy());
        return run;
    }

    /**
     * Register an invocation executing branches of the run.
     */
    public void enter(String runId) {
        synchronized (lock) {
            activeInvocations.merge(runId, 1, Integer::sum);
        }
    }

    /**
     * Unregister an invocation; the last one out finalizes the run.
     */
    public void exit(String runId) {
        synchronized (lock) {
            Integer remaining = activeInvocations.computeIfPresent(runId, (id, n) -> n > 1 ? n - 1 : null);
            if (remaining == null) {
                finishRun(runId);
            }
        }
    }

    /**
     * Consume a continuation and reopen its run for the resumed branches.
     * 
     * @return The awake run, or empty if the continuation was already consumed or its run is gone
     */
    public Optional<WorkflowRun> resume(WorkflowSleep sleep) {
        synchronized (lock) {
            if (!sleepRepository.tryConsume(sleep.id(), Instant.now())) {
                log.debug("Continuation {} already consumed", sleep.id());
                return Optional.empty();
            }

            WorkflowRun run = runRepository.findById(sleep.runId()).orElse(null);
            if (run == null) {
                log.warn("Lost continuation {}: run {} no longer exists", sleep.id(), sleep.runId());
                metrics.continuationLost("run_missing");
                return Optional.empty();
            }
            if (run.isTerminal()) {
                log.warn("Lost continuation {}: run {} already {}", sleep.id(), run.id(), run.status());
                metrics.continuationLost("run_finished");
                return Optional.empty();
            }

            if (run.status() == WorkflowRunStatus.SLEEPING) {
                run = transition(run, WorkflowRunStatus.RUNNING);
                log.info("Run {} is awake", run.id());
            }
            activeInvocations.merge(run.id(), 1, Integer::sum);
            return Optional.of(run);
        }
    }

    /**
     * Fail a run outright, e.g. on a configuration error.
     */
    public WorkflowRun failRun(String runId, String errorMessage) {
        synchronized (lock) {
            WorkflowRun run = findRun(runId);
            if (run.isTerminal()) {
                return run;
            }
            WorkflowRun failed = run.withFailed(errorMessage);
            runRepository.update(failed);
            metrics.runTransitioned(run.status(), WorkflowRunStatus.FAILED);
            log.warn("Run {} failed: {}", runId, errorMessage);
            return failed;
        }
    }

    // ========== Trigger runs ==========

    public WorkflowRun completeTrigger(String runId, boolean satisfied, List<String> triggerIds) {
        synchronized (lock) {
            WorkflowRun run = findRun(runId);
            WorkflowRun updated = run.withTriggerRun(run.triggerRun().withCompleted(satisfied, triggerIds));
            runRepository.update(updated);
            return updated;
        }
    }

    public WorkflowRun failTrigger(String runId, String errorMessage, String errorResponse) {
        synchronized (lock) {
            WorkflowRun run = findRun(runId);
            TriggerRun triggerRun = run.triggerRun().withFailed(errorMessage, errorResponse);
            runRepository.update(run.withTriggerRun(triggerRun));
        }
        return failRun(runId, errorMessage);
    }

    // ========== Run actions ==========

    public WorkflowRunAction startAction(String runId, String workflowActionId,
                                         String integrationName, String operationName) {
        WorkflowRunAction runAction = WorkflowRunAction.running(runId, workflowActionId, integrationName, operationName);
        runActionRepository.save(runAction);
        return runAction;
    }

    public WorkflowRunAction completeAction(WorkflowRunAction runAction) {
        WorkflowRunAction completed = runAction.withCompleted();
        runActionRepository.update(completed);
        return completed;
    }

    public WorkflowRunAction failAction(WorkflowRunAction runAction, String errorMessage, String errorResponse) {
        WorkflowRunAction failed = runAction.withFailed(errorMessage, errorResponse);
        runActionRepository.update(failed);
        return failed;
    }

    // ========== Internals ==========

    private void finishRun(String runId) {
        WorkflowRun run = runRepository.findById(runId).orElse(null);
        if (run == null || run.isTerminal()) {
            return;
        }

        WorkflowRunStatus target;
        if (sleepRepository.countPendingByRun(runId) > 0) {
            target = WorkflowRunStatus.SLEEPING;
        } else if (runActionRepository.existsByRunAndStatus(runId, ActionRunStatus.FAILED)) {
            target = WorkflowRunStatus.FAILED;
        } else {
            target = WorkflowRunStatus.COMPLETED;
        }

        if (run.status() != target) {
            transition(run, target);
        }
        log.info("Run {} finished invocation with status {}", runId, target);
    }

    private WorkflowRun transition(WorkflowRun run, WorkflowRunStatus target) {
        if (!run.status().canTransitionTo(target)) {
            throw new InvalidStateTransitionException(run.status(), target);
        }
        WorkflowRun updated = run.withStatus(target);
        runRepository.update(updated);
        metrics.runTransitioned(run.status(), target);
        return updated;
    }

    private WorkflowRun findRun(String runId) {
        return runRepository.findById(runId)
            .orElseThrow(() -> new NotFoundException("WorkflowRun", runId));
    }
}
