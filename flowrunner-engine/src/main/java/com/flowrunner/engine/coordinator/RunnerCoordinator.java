package com.flowrunner.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowrunner.core.model.Workflow;
import com.flowrunner.core.model.WorkflowRun;
import com.flowrunner.core.model.WorkflowRunStartedBy;
import com.flowrunner.core.model.WorkflowSleep;
import com.flowrunner.core.model.WorkflowTrigger;
import com.flowrunner.engine.service.RunnerService;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Default {@link RunnerService}: trigger checks go through the {@link TriggerCoordinator},
 * runs and resumes through the {@link ActionTreeExecutor}.
 */
public class RunnerCoordinator implements RunnerService {

    private final TriggerCoordinator triggerCoordinator;
    private final ActionTreeExecutor actionTreeExecutor;
    private final WorkflowRunRecorder recorder;

    public RunnerCoordinator(
            TriggerCoordinator triggerCoordinator,
            ActionTreeExecutor actionTreeExecutor,
            WorkflowRunRecorder recorder) {
        this.triggerCoordinator = triggerCoordinator;
        this.actionTreeExecutor = actionTreeExecutor;
        this.recorder = recorder;
    }

    @Override
    public CompletableFuture<Void> runWorkflowTriggerCheck(WorkflowTrigger trigger, WorkflowRunStartedBy startedBy) {
        return triggerCoordinator.runWorkflowTriggerCheck(trigger, startedBy);
    }

    @Override
    public CompletableFuture<Void> startWorkflowRun(String workflowId, Map<String, JsonNode> seedOutputs, WorkflowRun run) {
        return actionTreeExecutor.runWorkflowActions(run, workflowId, List.of(seedOutputs));
    }

    @Override
    public CompletableFuture<Void> wakeUpWorkflowRun(WorkflowSleep sleep) {
        return actionTreeExecutor.wakeUpWorkflowRun(sleep);
    }

    @Override
    public WorkflowRun createRun(Workflow workflow, WorkflowRunStartedBy startedBy) {
        return recorder.startRun(WorkflowRun.create(workflow.owner(), workflow.id(), startedBy));
    }
}
