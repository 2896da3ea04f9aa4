package com.flowrunner.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowrunner.core.model.WorkflowSleep;
import com.flowrunner.core.repository.WorkflowSleepRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of WorkflowSleepRepository.
 * The output bag snapshot is stored as JSONB; consumption is a conditional update.
 */
@Repository("jdbcWorkflowSleepRepository")
public class JdbcWorkflowSleepRepository implements WorkflowSleepRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowSleepRepository.class);

    private static final TypeReference<Map<String, JsonNode>> BAG_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final WorkflowSleepRowMapper rowMapper = new WorkflowSleepRowMapper();

    public JdbcWorkflowSleepRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(WorkflowSleep sleep) {
        String sql = """
            INSERT INTO workflow_sleeps (
                sleep_id, run_id, workflow_action_id, next_action_inputs,
                sleep_until, created_at, consumed_at
            ) VALUES (?, ?, ?, ?::jsonb, ?, ?, ?)
            ON CONFLICT (sleep_id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            sleep.id(),
            sleep.runId(),
            sleep.workflowActionId(),
            toJson(sleep.nextActionInputs()),
            Timestamp.from(sleep.sleepUntil()),
            Timestamp.from(sleep.createdAt()),
            toTimestamp(sleep.consumedAt())
        );

        if (rows == 0) {
            log.debug("Workflow sleep already exists: {}", sleep.id());
        }
    }

    @Override
    public Optional<WorkflowSleep> findById(String sleepId) {
        String sql = "SELECT * FROM workflow_sleeps WHERE sleep_id = ?";
        List<WorkflowSleep> results = jdbcTemplate.query(sql, rowMapper, sleepId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowSleep> findDue(Instant now, int limit) {
        String sql = """
            SELECT * FROM workflow_sleeps
            WHERE consumed_at IS NULL AND sleep_until <= ?
            ORDER BY sleep_until
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(now), limit);
    }

    @Override
    @Transactional
    public boolean tryConsume(String sleepId, Instant consumedAt) {
        String sql = """
            UPDATE workflow_sleeps SET consumed_at = ?
            WHERE sleep_id = ? AND consumed_at IS NULL
            """;

        int rows = jdbcTemplate.update(sql, Timestamp.from(consumedAt), sleepId);
        if (rows == 0) {
            log.debug("Workflow sleep {} already consumed or unknown", sleepId);
        }
        return rows > 0;
    }

    @Override
    public int countPendingByRun(String runId) {
        String sql = "SELECT COUNT(*) FROM workflow_sleeps WHERE run_id = ? AND consumed_at IS NULL";
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, runId);
        return count != null ? count : 0;
    }

    @Override
    @Transactional
    public int deleteConsumedBefore(Instant cutoff) {
        String sql = "DELETE FROM workflow_sleeps WHERE consumed_at IS NOT NULL AND consumed_at < ?";
        int rows = jdbcTemplate.update(sql, Timestamp.from(cutoff));
        if (rows > 0) {
            log.debug("Purged {} consumed workflow sleep(s)", rows);
        }
        return rows;
    }

    private String toJson(Map<String, JsonNode> bag) {
        try {
            return objectMapper.writeValueAsString(bag);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize output bag", e);
        }
    }

    private Map<String, JsonNode> fromJson(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, BAG_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse output bag", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private class WorkflowSleepRowMapper implements RowMapper<WorkflowSleep> {
        @Override
        public WorkflowSleep mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new WorkflowSleep(
                rs.getString("sleep_id"),
                rs.getString("run_id"),
                rs.getString("workflow_action_id"),
                fromJson(rs.getString("next_action_inputs")),
                toInstant(rs.getTimestamp("sleep_until")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("consumed_at"))
            );
        }
    }
}
