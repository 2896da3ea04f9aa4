package com.flowrunner.engine.persistence;

import com.flowrunner.core.model.ActionRunStatus;
import com.flowrunner.core.model.WorkflowRunAction;
import com.flowrunner.core.repository.WorkflowRunActionRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowRunActionRepository.
 */
@Repository
public class InMemoryWorkflowRunActionRepository implements WorkflowRunActionRepository {

    private final Map<String, WorkflowRunAction> runActions = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowRunAction runAction) {
        runActions.put(runAction.id(), runAction);
    }

    @Override
    public void update(WorkflowRunAction runAction) {
        runActions.put(runAction.id(), runAction);
    }

    @Override
    public Optional<WorkflowRunAction> findById(String runActionId) {
        return Optional.ofNullable(runActions.get(runActionId));
    }

    @Override
    public List<WorkflowRunAction> findByRun(String runId) {
        return runActions.values().stream()
            .filter(a -> a.runId().equals(runId))
            .sorted(Comparator.comparing(WorkflowRunAction::startedAt))
            .collect(Collectors.toList());
    }

    @Override
    public boolean existsByRunAndStatus(String runId, ActionRunStatus status) {
        return runActions.values().stream()
            .anyMatch(a -> a.runId().equals(runId) && a.status() == status);
    }
}
