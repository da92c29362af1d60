package com.delta.jobharvester.harvest.persistence;

import com.delta.jobharvester.harvest.model.ExternalTask;
import com.delta.jobharvester.harvest.model.SearchParams;
import com.delta.jobharvester.harvest.model.TaskKind;
import com.delta.jobharvester.harvest.model.TaskState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Task rows are the source of truth for orchestration. Every state change is a conditional UPDATE
 * whose row count says whether the transition happened.
 */
@Repository
public class ExternalTaskRepository {
    private static final Logger log = LoggerFactory.getLogger(ExternalTaskRepository.class);
    private static final List<String> NON_TERMINAL = List.of(
        TaskState.PENDING.name(),
        TaskState.SUBMITTED.name(),
        TaskState.PROCESSING.name(),
        TaskState.RETRIEVED.name()
    );
    private static final int MAX_ERROR_LENGTH = 2000;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public ExternalTaskRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long insertPending(String owner, TaskKind kind, SearchParams params, Instant now) {
        MapSqlParameterSource source = new MapSqlParameterSource()
            .addValue("owner", owner)
            .addValue("kind", kind.name())
            .addValue("state", TaskState.PENDING.name())
            .addValue("params", writeParams(params))
            .addValue("now", Timestamp.from(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO external_tasks (owner_name, task_kind, state, search_params, created_at, updated_at)
                VALUES (:owner, :kind, :state, :params, :now, :now)
                """,
            source,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to create external task row");
        }
        return key.longValue();
    }

    public boolean markSubmitted(long taskId, String requestId, Instant submittedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", taskId)
            .addValue("requestId", requestId)
            .addValue("submittedAt", Timestamp.from(submittedAt));
        int updated = jdbc.update(
            """
                UPDATE external_tasks
                SET state = 'SUBMITTED',
                    request_id = :requestId,
                    submitted_at = :submittedAt,
                    updated_at = :submittedAt
                WHERE id = :id
                  AND state = 'PENDING'
                  AND request_id IS NULL
                """,
            params
        );
        return updated == 1;
    }

    /**
     * Takes the processing lease. SUBMITTED advances to PROCESSING; PROCESSING and RETRIEVED keep
     * their state so an expired lease can be picked up again after a restart.
     */
    public boolean claimForProcessing(long taskId, String lockOwner, Instant now, Instant lockedUntil) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", taskId)
            .addValue("lockOwner", lockOwner)
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(lockedUntil));
        int updated = jdbc.update(
            """
                UPDATE external_tasks
                SET state = CASE WHEN state = 'SUBMITTED' THEN 'PROCESSING' ELSE state END,
                    locked_until = :lockedUntil,
                    lock_owner = :lockOwner,
                    updated_at = :now
                WHERE id = :id
                  AND state IN ('SUBMITTED', 'PROCESSING', 'RETRIEVED')
                  AND (locked_until IS NULL OR locked_until < :now)
                """,
            params
        );
        return updated == 1;
    }

    /**
     * Extends the lease, but only for its current holder on a task still being processed.
     */
    public boolean renewLease(long taskId, String lockOwner, Instant now, Instant lockedUntil) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", taskId)
            .addValue("lockOwner", lockOwner)
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(lockedUntil));
        int updated = jdbc.update(
            """
                UPDATE external_tasks
                SET locked_until = :lockedUntil,
                    updated_at = :now
                WHERE id = :id
                  AND lock_owner = :lockOwner
                  AND state IN ('PROCESSING', 'RETRIEVED')
                """,
            params
        );
        return updated == 1;
    }

    public boolean markRetrieved(long taskId, String lockOwner, int resultCount, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", taskId)
            .addValue("lockOwner", lockOwner)
            .addValue("resultCount", resultCount)
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE external_tasks
                SET state = 'RETRIEVED',
                    result_count = :resultCount,
                    updated_at = :now
                WHERE id = :id
                  AND lock_owner = :lockOwner
                  AND state IN ('PROCESSING', 'RETRIEVED')
                """,
            params
        );
        return updated == 1;
    }

    public boolean markProcessed(long taskId, String lockOwner, int resultCount, int qualityJobCount, Instant completedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", taskId)
            .addValue("lockOwner", lockOwner)
            .addValue("resultCount", resultCount)
            .addValue("qualityJobCount", qualityJobCount)
            .addValue("completedAt", Timestamp.from(completedAt));
        int updated = jdbc.update(
            """
                UPDATE external_tasks
                SET state = 'PROCESSED',
                    result_count = :resultCount,
                    quality_job_count = :qualityJobCount,
                    completed_at = :completedAt,
                    locked_until = NULL,
                    lock_owner = NULL,
                    updated_at = :completedAt
                WHERE id = :id
                  AND lock_owner = :lockOwner
                  AND state IN ('PROCESSING', 'RETRIEVED')
                """,
            params
        );
        return updated == 1;
    }

    public boolean markFailed(long taskId, String errorMessage, Instant completedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", taskId)
            .addValue("error", truncate(errorMessage))
            .addValue("completedAt", Timestamp.from(completedAt))
            .addValue("nonTerminal", NON_TERMINAL);
        int updated = jdbc.update(
            """
                UPDATE external_tasks
                SET state = 'FAILED',
                    error_message = :error,
                    completed_at = :completedAt,
                    locked_until = NULL,
                    lock_owner = NULL,
                    updated_at = :completedAt
                WHERE id = :id
                  AND state IN (:nonTerminal)
                """,
            params
        );
        return updated == 1;
    }

    public Optional<ExternalTask> findById(long taskId) {
        List<ExternalTask> rows = jdbc.query(
            """
                SELECT *
                FROM external_tasks
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", taskId),
            taskRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<ExternalTask> findNonTerminalByRequestId(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            return Optional.empty();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("requestId", requestId.trim())
            .addValue("nonTerminal", NON_TERMINAL);
        List<ExternalTask> rows = jdbc.query(
            """
                SELECT *
                FROM external_tasks
                WHERE request_id = :requestId
                  AND state IN (:nonTerminal)
                """,
            params,
            taskRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Non-terminal tasks the provider knows about, most advanced first.
     */
    public List<ExternalTask> findPollable(int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("nonTerminal", NON_TERMINAL)
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT *
                FROM external_tasks
                WHERE state IN (:nonTerminal)
                  AND request_id IS NOT NULL
                ORDER BY CASE state
                             WHEN 'PROCESSING' THEN 0
                             WHEN 'RETRIEVED' THEN 1
                             WHEN 'SUBMITTED' THEN 2
                             ELSE 3
                         END,
                         COALESCE(submitted_at, created_at) ASC,
                         id ASC
                LIMIT :limit
                """,
            params,
            taskRowMapper()
        );
    }

    public List<ExternalTask> findStaleNonTerminal(Instant cutoff) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("nonTerminal", NON_TERMINAL)
            .addValue("cutoff", Timestamp.from(cutoff));
        return jdbc.query(
            """
                SELECT *
                FROM external_tasks
                WHERE state IN (:nonTerminal)
                  AND COALESCE(submitted_at, created_at) < :cutoff
                ORDER BY id ASC
                """,
            params,
            taskRowMapper()
        );
    }

    public List<ExternalTask> findTasks(String owner, Collection<TaskState> states, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("owner", owner == null || owner.isBlank() ? null : owner.trim())
            .addValue("limit", Math.max(1, limit));
        StringBuilder sql = new StringBuilder("SELECT * FROM external_tasks WHERE 1 = 1");
        if (owner != null && !owner.isBlank()) {
            sql.append(" AND owner_name = :owner");
        }
        if (states != null && !states.isEmpty()) {
            params.addValue("states", states.stream().map(TaskState::name).toList());
            sql.append(" AND state IN (:states)");
        }
        sql.append(" ORDER BY created_at DESC, id DESC LIMIT :limit");
        return jdbc.query(sql.toString(), params, taskRowMapper());
    }

    public long countNonTerminal() {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM external_tasks WHERE state IN (:nonTerminal)",
            new MapSqlParameterSource("nonTerminal", NON_TERMINAL),
            Long.class
        );
        return count == null ? 0 : count;
    }

    private RowMapper<ExternalTask> taskRowMapper() {
        return (rs, rowNum) -> new ExternalTask(
            rs.getLong("id"),
            rs.getString("request_id"),
            rs.getString("owner_name"),
            TaskKind.parse(rs.getString("task_kind")),
            TaskState.parse(rs.getString("state")),
            readParams(rs),
            toInstant(rs.getTimestamp("submitted_at")),
            toInstant(rs.getTimestamp("completed_at")),
            rs.getInt("result_count"),
            rs.getInt("quality_job_count"),
            rs.getString("error_message"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private String writeParams(SearchParams params) {
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Search parameters are not serializable", e);
        }
    }

    private SearchParams readParams(ResultSet rs) throws SQLException {
        String raw = rs.getString("search_params");
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(raw, SearchParams.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable search_params on task {}", rs.getLong("id"));
            return null;
        }
    }

    private String truncate(String value) {
        if (value == null) {
            return null;
        }
        return value.length() > MAX_ERROR_LENGTH ? value.substring(0, MAX_ERROR_LENGTH) : value;
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
