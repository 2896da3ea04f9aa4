package com.flowrunner.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowrunner.core.model.Workflow;
import com.flowrunner.core.model.WorkflowRun;
import com.flowrunner.core.model.WorkflowRunStartedBy;
import com.flowrunner.core.model.WorkflowSleep;
import com.flowrunner.core.model.WorkflowTrigger;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry points of the workflow runner.
 * 
 * All operations are asynchronous. Results are observable only through persisted
 * run and run-action state. Returned futures complete exceptionally only for
 * configuration errors.
 */
public interface RunnerService {

    /**
     * Poll a trigger and run the workflow once per new item.
     * 
     * @param trigger The trigger to check
     * @param startedBy Why the check runs
     * @return Completes once every dispatched branch has finished or suspended
     */
    CompletableFuture<Void> runWorkflowTriggerCheck(WorkflowTrigger trigger, WorkflowRunStartedBy startedBy);

    /**
     * Execute a workflow's action graph for an existing run.
     * 
     * @param workflowId The workflow to execute
     * @param seedOutputs Initial output bag
     * @param run The run record, as returned by {@link #createRun}
     * @return Completes once every branch has finished or suspended
     */
    CompletableFuture<Void> startWorkflowRun(String workflowId, Map<String, JsonNode> seedOutputs, WorkflowRun run);

    /**
     * Resume a suspended branch.
     * 
     * @param sleep The persisted continuation
     * @return Completes once every resumed branch has finished or suspended
     */
    CompletableFuture<Void> wakeUpWorkflowRun(WorkflowSleep sleep);

    /**
     * Create and persist a run record in RUNNING status.
     * 
     * @param workflow The workflow to run
     * @param startedBy Why the run starts
     * @return The persisted run
     */
    WorkflowRun createRun(Workflow workflow, WorkflowRunStartedBy startedBy);
}
