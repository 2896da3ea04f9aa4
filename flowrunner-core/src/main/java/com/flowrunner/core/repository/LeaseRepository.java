package com.flowrunner.core.repository;

import com.flowrunner.core.model.ExecutionLease;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Trigger leases. Keeps checks of the same trigger mutually exclusive,
 * across runner processes when backed by a shared store.
 */
public interface LeaseRepository {

    /**
     * Claim a trigger if it is unclaimed, released or expired.
     *
     * @param triggerId  The trigger to claim
     * @param holderId   The claiming check
     * @param holderName Human-readable runner name, stored for diagnostics
     * @param duration   How long the claim holds without a release
     * @return The new lease with its fence token, or empty while someone else holds it
     */
    Optional<ExecutionLease> acquire(String triggerId, UUID holderId, String holderName, Duration duration);

    /**
     * Give a lease back. A stale lease (taken over after expiry) is not released.
     *
     * @return true if this exact lease was still held and is now released
     */
    boolean release(ExecutionLease lease);

    Optional<ExecutionLease> findByTrigger(String triggerId);
}
