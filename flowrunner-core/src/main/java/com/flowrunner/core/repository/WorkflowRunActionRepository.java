package com.flowrunner.core.repository;

import com.flowrunner.core.model.ActionRunStatus;
import com.flowrunner.core.model.WorkflowRunAction;
import java.util.List;
import java.util.Optional;

/**
 * Repository for per-node run records.
 * Each record is written by exactly one branch, so concurrent writes never collide.
 */
public interface WorkflowRunActionRepository {

    void save(WorkflowRunAction runAction);

    void update(WorkflowRunAction runAction);

    Optional<WorkflowRunAction> findById(String runActionId);

    List<WorkflowRunAction> findByRun(String runId);

    /**
     * Check whether any node of a run ended in the given status.
     */
    boolean existsByRunAndStatus(String runId, ActionRunStatus status);
}
