package com.flowrunner.engine.service;

import com.flowrunner.core.model.WorkflowSleep;

/**
 * Resume capability for suspended branches.
 * Implementations must eventually call {@link RunnerService#wakeUpWorkflowRun} for each
 * scheduled continuation once its wake instant has passed.
 */
public interface ContinuationScheduler {

    /**
     * Arrange for a persisted continuation to be resumed at its wake instant.
     */
    void schedule(WorkflowSleep sleep);
}
