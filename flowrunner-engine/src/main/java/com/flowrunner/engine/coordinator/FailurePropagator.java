package com.flowrunner.engine.coordinator;

import com.flowrunner.core.model.Workflow;
import com.flowrunner.core.model.WorkflowRun;
import com.flowrunner.core.model.WorkflowRunStartedBy;
import com.flowrunner.core.repository.WorkflowRepository;
import com.flowrunner.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Creates the run of a workflow's onFailure target.
 * The failure workflow starts with an empty output bag; it only learns that it was invoked.
 */
public class FailurePropagator {

    private static final Logger log = LoggerFactory.getLogger(FailurePropagator.class);

    private final WorkflowRepository workflowRepository;
    private final WorkflowRunRecorder recorder;
    private final WorkflowMetrics metrics;

    public FailurePropagator(
            WorkflowRepository workflowRepository,
            WorkflowRunRecorder recorder,
            WorkflowMetrics metrics) {
        this.workflowRepository = workflowRepository;
        this.recorder = recorder;
        this.metrics = metrics;
    }

    /**
     * Create the failure run for a failed workflow, if it declares one.
     * 
     * @param failedWorkflowId The workflow whose trigger or action failed
     * @return The persisted failure run, or empty when no onFailure workflow applies
     */
    public Optional<WorkflowRun> createFailureRun(String failedWorkflowId) {
        Workflow workflow = workflowRepository.findById(failedWorkflowId).orElse(null);
        if (workflow == null || !workflow.hasOnFailureWorkflow()) {
            return Optional.empty();
        }

        Workflow target = workflowRepository.findById(workflow.onFailureWorkflowId()).orElse(null);
        if (target == null) {
            log.warn("onFailure workflow {} of workflow {} not found",
                workflow.onFailureWorkflowId(), failedWorkflowId);
            return Optional.empty();
        }

        WorkflowRun run = recorder.startRun(
            WorkflowRun.create(workflow.owner(), target.id(), WorkflowRunStartedBy.WORKFLOW_FAILURE));
        metrics.failureCascaded();
        log.info("Workflow {} failed, started failure workflow {} as run {}",
            failedWorkflowId, target.id(), run.id());
        return Optional.of(run);
    }
}
