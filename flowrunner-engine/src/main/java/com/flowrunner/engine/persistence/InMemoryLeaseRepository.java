package com.flowrunner.engine.persistence;

import com.flowrunner.core.model.ExecutionLease;
import com.flowrunner.core.repository.LeaseRepository;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of LeaseRepository.
 * Serializes trigger checks within a single process.
 */
@Repository
public class InMemoryLeaseRepository implements LeaseRepository {

    private final Map<String, ExecutionLease> leases = new ConcurrentHashMap<>();

    @Override
    public Optional<ExecutionLease> acquire(String triggerId, UUID holderId, String holderName, Duration duration) {
        Instant now = Instant.now();
        AtomicReference<ExecutionLease> acquired = new AtomicReference<>();
        // compute runs atomically per key
        leases.compute(triggerId, (id, current) -> {
            if (current != null && current.isHeldAt(now)) {
                return current;
            }
            ExecutionLease next = ExecutionLease.next(current, triggerId, holderId, holderName, now, duration);
            acquired.set(next);
            return next;
        });
        return Optional.ofNullable(acquired.get());
    }

    @Override
    public boolean release(ExecutionLease lease) {
        AtomicBoolean released = new AtomicBoolean();
        leases.computeIfPresent(lease.triggerId(), (id, current) -> {
            if (!current.isHeldBy(lease.holderId(), lease.fenceToken())) {
                return current;
            }
            released.set(true);
            return current.released(Instant.now());
        });
        return released.get();
    }

    @Override
    public Optional<ExecutionLease> findByTrigger(String triggerId) {
        return Optional.ofNullable(leases.get(triggerId));
    }
}
