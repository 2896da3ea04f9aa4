package com.flowrunner.engine.persistence;

import com.flowrunner.core.model.WorkflowAction;
import com.flowrunner.core.repository.WorkflowActionRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowActionRepository.
 */
@Repository
public class InMemoryWorkflowActionRepository implements WorkflowActionRepository {

    private final Map<String, WorkflowAction> actions = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowAction action) {
        actions.put(action.id(), action);
    }

    @Override
    public Optional<WorkflowAction> findById(String actionId) {
        return Optional.ofNullable(actions.get(actionId));
    }

    @Override
    public List<WorkflowAction> findByIds(Collection<String> actionIds) {
        return actionIds.stream()
            .map(actions::get)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowAction> findByWorkflow(String workflowId) {
        return actions.values().stream()
            .filter(a -> a.workflowId().equals(workflowId))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowAction> findRootActions(String workflowId) {
        return actions.values().stream()
            .filter(a -> a.workflowId().equals(workflowId) && a.rootAction())
            .collect(Collectors.toList());
    }
}
