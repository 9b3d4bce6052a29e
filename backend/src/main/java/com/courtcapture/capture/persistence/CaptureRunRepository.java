package com.courtcapture.capture.persistence;

import com.courtcapture.capture.model.CaptureRun;
import com.courtcapture.capture.model.JobType;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Job-run records: one row per execution, opened IN_PROGRESS before any external call.
 */
@Repository
public class CaptureRunRepository {
    public static final String STATUS_IN_PROGRESS = "IN_PROGRESS";

    private static final String SELECT_COLUMNS = """
        SELECT id,
               job_type,
               tenant_id,
               credential_ids,
               schedule_id,
               status,
               started_at,
               finished_at,
               error,
               summary
        FROM capture_runs
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;

    public CaptureRunRepository(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public long insertRun(JobType jobType, long tenantId, List<Long> credentialIds, Long scheduleId, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobType", jobType.code())
            .addValue("tenantId", tenantId)
            .addValue("credentialIds", json.write(credentialIds))
            .addValue("scheduleId", scheduleId, Types.BIGINT)
            .addValue("status", STATUS_IN_PROGRESS)
            .addValue("startedAt", Timestamp.from(startedAt));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO capture_runs (
                    job_type,
                    tenant_id,
                    credential_ids,
                    schedule_id,
                    status,
                    started_at
                )
                VALUES (
                    :jobType,
                    :tenantId,
                    :credentialIds,
                    :scheduleId,
                    :status,
                    :startedAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert capture run");
        }
        return key.longValue();
    }

    public void completeRun(long runId, Instant finishedAt, String status, String error, Object summary) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("finishedAt", Timestamp.from(finishedAt))
            .addValue("status", status)
            .addValue("error", error, Types.VARCHAR)
            .addValue("summary", json.write(summary), Types.VARCHAR);
        jdbc.update(
            """
                UPDATE capture_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    error = :error,
                    summary = :summary
                WHERE id = :runId
                """,
            params
        );
    }

    public Optional<CaptureRun> findRun(long runId) {
        List<CaptureRun> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :runId",
            new MapSqlParameterSource().addValue("runId", runId),
            runMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<CaptureRun> findRunsInProgressStartedBefore(Instant cutoff) {
        return jdbc.query(
            SELECT_COLUMNS + " WHERE status = :status AND started_at < :cutoff ORDER BY started_at ASC",
            new MapSqlParameterSource()
                .addValue("status", STATUS_IN_PROGRESS)
                .addValue("cutoff", Timestamp.from(cutoff)),
            runMapper()
        );
    }

    public List<CaptureRun> findRecentRuns(Long scheduleId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("scheduleId", scheduleId, Types.BIGINT)
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            SELECT_COLUMNS
                + """
                 WHERE (:scheduleId IS NULL OR schedule_id = :scheduleId)
                 ORDER BY started_at DESC, id DESC
                 LIMIT :limit
                """,
            params,
            runMapper()
        );
    }

    private RowMapper<CaptureRun> runMapper() {
        return (rs, rowNum) -> {
            long scheduleId = rs.getLong("schedule_id");
            Long schedule = rs.wasNull() ? null : scheduleId;
            Timestamp finishedAt = rs.getTimestamp("finished_at");
            return new CaptureRun(
                rs.getLong("id"),
                rs.getString("job_type"),
                rs.getLong("tenant_id"),
                json.read(rs.getString("credential_ids"), JsonColumns.LONG_LIST, List.of()),
                schedule,
                rs.getString("status"),
                rs.getTimestamp("started_at").toInstant(),
                finishedAt == null ? null : finishedAt.toInstant(),
                rs.getString("error"),
                json.readTree(rs.getString("summary"))
            );
        };
    }
}
