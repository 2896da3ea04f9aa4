package com.flowrunner.core.repository;

import com.flowrunner.core.model.WorkflowSleep;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for persisted continuations of suspended branches.
 */
public interface WorkflowSleepRepository {

    void save(WorkflowSleep sleep);

    Optional<WorkflowSleep> findById(String sleepId);

    /**
     * Find unconsumed continuations whose wake instant has passed.
     * 
     * @param now Current time
     * @param limit Maximum number of results
     * @return Due continuations, earliest first
     */
    List<WorkflowSleep> findDue(Instant now, int limit);

    /**
     * Atomically mark a continuation as consumed.
     * 
     * @param sleepId The continuation ID
     * @param consumedAt Consumption time
     * @return true if this call consumed it, false if it was already consumed or is unknown
     */
    boolean tryConsume(String sleepId, Instant consumedAt);

    /**
     * Count unconsumed continuations of a run.
     */
    int countPendingByRun(String runId);

    /**
     * Delete continuations consumed before the cutoff. Pending ones are never touched.
     *
     * @return Number of continuations deleted
     */
    int deleteConsumedBefore(Instant cutoff);
}
