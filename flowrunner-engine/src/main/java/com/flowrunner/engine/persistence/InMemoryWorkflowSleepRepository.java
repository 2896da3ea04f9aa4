package com.flowrunner.engine.persistence;

import com.flowrunner.core.model.WorkflowSleep;
import com.flowrunner.core.repository.WorkflowSleepRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowSleepRepository.
 */
@Repository
public class InMemoryWorkflowSleepRepository implements WorkflowSleepRepository {

    private final Map<String, WorkflowSleep> sleeps = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowSleep sleep) {
        sleeps.put(sleep.id(), sleep);
    }

    @Override
    public Optional<WorkflowSleep> findById(String sleepId) {
        return Optional.ofNullable(sleeps.get(sleepId));
    }

    @Override
    public List<WorkflowSleep> findDue(Instant now, int limit) {
        return sleeps.values().stream()
            .filter(s -> !s.isConsumed() && s.isDue(now))
            .sorted(Comparator.comparing(WorkflowSleep::sleepUntil))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public boolean tryConsume(String sleepId, Instant consumedAt) {
        synchronized (sleeps) {
            WorkflowSleep existing = sleeps.get(sleepId);
            if (existing == null || existing.isConsumed()) {
                return false;
            }
            sleeps.put(sleepId, existing.withConsumed(consumedAt));
            return true;
        }
    }

    @Override
    public int countPendingByRun(String runId) {
        return (int) sleeps.values().stream()
            .filter(s -> s.runId().equals(runId) && !s.isConsumed())
            .count();
    }

    @Override
    public int deleteConsumedBefore(Instant cutoff) {
        synchronized (sleeps) {
            int before = sleeps.size();
            sleeps.values().removeIf(s -> s.isConsumed() && s.consumedAt().isBefore(cutoff));
            return before - sleeps.size();
        }
    }
}
