package com.flowrunner.engine.persistence.jdbc;

import com.flowrunner.core.model.ExecutionLease;
import com.flowrunner.core.repository.LeaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of LeaseRepository.
 * Keeps trigger checks mutually exclusive across runner processes.
 */
@Repository("jdbcLeaseRepository")
public class JdbcLeaseRepository implements LeaseRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcLeaseRepository.class);

    private static final String COLUMNS =
        "trigger_id, holder_id, holder_name, acquired_at, expires_at, fence_token";

    private final JdbcTemplate jdbcTemplate;
    private final TriggerLeaseRowMapper rowMapper = new TriggerLeaseRowMapper();

    public JdbcLeaseRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public Optional<ExecutionLease> acquire(String triggerId, UUID holderId, String holderName, Duration duration) {
        Instant now = Instant.now();
        // The conflict branch only fires for a released or expired row; otherwise nothing is returned
        String sql = """
            INSERT INTO trigger_leases (%s)
            VALUES (?, ?, ?, ?, ?, 1)
            ON CONFLICT (trigger_id) DO UPDATE SET
                holder_id = EXCLUDED.holder_id,
                holder_name = EXCLUDED.holder_name,
                acquired_at = EXCLUDED.acquired_at,
                expires_at = EXCLUDED.expires_at,
                fence_token = trigger_leases.fence_token + 1
            WHERE trigger_leases.holder_id IS NULL OR trigger_leases.expires_at < EXCLUDED.acquired_at
            RETURNING %s
            """.formatted(COLUMNS, COLUMNS);

        List<ExecutionLease> rows = jdbcTemplate.query(sql, rowMapper,
            triggerId,
            holderId,
            holderName,
            Timestamp.from(now),
            Timestamp.from(now.plus(duration)));

        if (rows.isEmpty()) {
            log.debug("Trigger {} is leased by another runner", triggerId);
            return Optional.empty();
        }
        ExecutionLease lease = rows.get(0);
        log.debug("Leased trigger {} with fence token {}", triggerId, lease.fenceToken());
        return Optional.of(lease);
    }

    @Override
    @Transactional
    public boolean release(ExecutionLease lease) {
        String sql = """
            UPDATE trigger_leases SET
                holder_id = NULL,
                expires_at = ?
            WHERE trigger_id = ? AND holder_id = ? AND fence_token = ?
            """;

        int rows = jdbcTemplate.update(sql,
            Timestamp.from(Instant.now()), lease.triggerId(), lease.holderId(), lease.fenceToken());
        if (rows == 0) {
            log.warn("Lease {} (token {}) was taken over before release", lease.leaseKey(), lease.fenceToken());
            return false;
        }
        return true;
    }

    @Override
    public Optional<ExecutionLease> findByTrigger(String triggerId) {
        String sql = "SELECT " + COLUMNS + " FROM trigger_leases WHERE trigger_id = ?";
        List<ExecutionLease> results = jdbcTemplate.query(sql, rowMapper, triggerId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private static class TriggerLeaseRowMapper implements RowMapper<ExecutionLease> {
        @Override
        public ExecutionLease mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ExecutionLease(
                rs.getString("trigger_id"),
                rs.getObject("holder_id", UUID.class),
                rs.getString("holder_name"),
                rs.getTimestamp("acquired_at").toInstant(),
                rs.getTimestamp("expires_at").toInstant(),
                rs.getLong("fence_token")
            );
        }
    }
}
