package com.flowrunner.engine.persistence;

import com.flowrunner.core.model.WorkflowRun;
import com.flowrunner.core.model.WorkflowRunStatus;
import com.flowrunner.core.repository.WorkflowRunRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowRunRepository.
 */
@Repository
public class InMemoryWorkflowRunRepository implements WorkflowRunRepository {

    private final Map<String, WorkflowRun> runs = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowRun run) {
        runs.put(run.id(), run);
    }

    @Override
    public void update(WorkflowRun run) {
        runs.put(run.id(), run);
    }

    @Override
    public Optional<WorkflowRun> findById(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<WorkflowRun> findByWorkflow(String workflowId) {
        return runs.values().stream()
            .filter(r -> r.workflowId().equals(workflowId))
            .sorted(Comparator.comparing(WorkflowRun::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowRun> findByStatus(WorkflowRunStatus status, int limit) {
        return runs.values().stream()
            .filter(r -> r.status() == status)
            .limit(limit)
            .collect(Collectors.toList());
    }
}
