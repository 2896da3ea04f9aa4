package com.flowrunner.core.repository;

import com.flowrunner.core.model.WorkflowRun;
import com.flowrunner.core.model.WorkflowRunStatus;
import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowRun persistence.
 */
public interface WorkflowRunRepository {

    void save(WorkflowRun run);

    void update(WorkflowRun run);

    Optional<WorkflowRun> findById(String runId);

    List<WorkflowRun> findByWorkflow(String workflowId);

    List<WorkflowRun> findByStatus(WorkflowRunStatus status, int limit);
}
