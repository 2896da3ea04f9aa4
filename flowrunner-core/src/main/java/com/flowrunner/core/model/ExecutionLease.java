package com.flowrunner.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Exclusive claim on checking one trigger.
 * Serializes reads and writes of the trigger's dedup cursor ({@code lastId}).
 *
 * Invariants:
 * - At most one holder per trigger at any instant
 * - fenceToken grows by one on every successful acquisition and is assigned by the repository
 * - A released lease keeps its row (holderId null) so the token survives
 */
public record ExecutionLease(
    String triggerId,
    UUID holderId,
    String holderName,
    Instant acquiredAt,
    Instant expiresAt,
    long fenceToken
) {
    public static final Duration DEFAULT_DURATION = Duration.ofMinutes(5);

    /**
     * Key used in logs and lease tables.
     */
    public String leaseKey() {
        return "trigger:" + triggerId;
    }

    public boolean isReleased() {
        return holderId == null;
    }

    /**
     * Held means claimed by someone and not yet past its expiry.
     */
    public boolean isHeldAt(Instant now) {
        return !isReleased() && expiresAt.isAfter(now);
    }

    public boolean isHeldBy(UUID holder, long token) {
        return !isReleased() && holderId.equals(holder) && fenceToken == token;
    }

    /**
     * The next acquisition of this trigger by {@code holder}, or of a trigger never leased
     * when {@code previous} is null.
     */
    public static ExecutionLease next(
            ExecutionLease previous, String triggerId, UUID holder, String holderName,
            Instant now, Duration duration) {
        long token = previous == null ? 1 : previous.fenceToken + 1;
        return new ExecutionLease(triggerId, holder, holderName, now, now.plus(duration), token);
    }

    public ExecutionLease released(Instant now) {
        return new ExecutionLease(triggerId, null, holderName, acquiredAt, now, fenceToken);
    }
}
