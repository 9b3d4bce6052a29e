package com.courtcapture.capture.persistence;

import com.courtcapture.capture.model.JobType;
import com.courtcapture.capture.model.Periodicity;
import com.courtcapture.capture.model.Recurrence;
import com.courtcapture.capture.model.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Repository
public class JdbcScheduleStore implements ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcScheduleStore.class);
    private static final String SELECT_COLUMNS = """
        SELECT id,
               job_type,
               tenant_id,
               credential_ids,
               periodicity,
               interval_days,
               time_of_day,
               last_execution,
               next_execution,
               extra_params,
               active
        FROM capture_schedules
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;

    public JdbcScheduleStore(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
    }

    @Override
    public Optional<Schedule> read(long scheduleId) {
        List<Schedule> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :scheduleId",
            new MapSqlParameterSource().addValue("scheduleId", scheduleId),
            scheduleMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public void update(long scheduleId, Instant lastExecution, Instant nextExecution) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("scheduleId", scheduleId)
            .addValue("lastExecution", toTimestamp(lastExecution), Types.TIMESTAMP)
            .addValue("nextExecution", toTimestamp(nextExecution), Types.TIMESTAMP)
            .addValue("updatedAt", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE capture_schedules
                SET last_execution = COALESCE(:lastExecution, last_execution),
                    next_execution = COALESCE(:nextExecution, next_execution),
                    updated_at = :updatedAt
                WHERE id = :scheduleId
                """,
            params
        );
    }

    @Override
    public List<Schedule> findDue(Instant now, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now))
            .addValue("limit", Math.max(1, limit));
        List<Schedule> rows = jdbc.query(
            SELECT_COLUMNS
                + """
                 WHERE active = TRUE
                   AND next_execution IS NOT NULL
                   AND next_execution <= :now
                 ORDER BY next_execution ASC, id ASC
                 LIMIT :limit
                """,
            params,
            lenientScheduleMapper()
        );
        return rows.stream().filter(Objects::nonNull).toList();
    }

    // A malformed row maps to null so the other due schedules still run.
    private RowMapper<Schedule> lenientScheduleMapper() {
        RowMapper<Schedule> strict = scheduleMapper();
        return (rs, rowNum) -> {
            try {
                return strict.mapRow(rs, rowNum);
            } catch (RuntimeException e) {
                log.warn("Skipping malformed schedule {}: {}", rs.getLong("id"), e.getMessage());
                return null;
            }
        };
    }

    private RowMapper<Schedule> scheduleMapper() {
        return (rs, rowNum) -> {
            int intervalDays = rs.getInt("interval_days");
            Integer interval = rs.wasNull() ? null : intervalDays;
            Recurrence recurrence = new Recurrence(
                Periodicity.fromCode(rs.getString("periodicity")),
                interval,
                LocalTime.parse(rs.getString("time_of_day"))
            );
            return new Schedule(
                rs.getLong("id"),
                JobType.fromCode(rs.getString("job_type")),
                rs.getLong("tenant_id"),
                json.read(rs.getString("credential_ids"), JsonColumns.LONG_LIST, List.of()),
                recurrence,
                toInstant(rs.getTimestamp("last_execution")),
                toInstant(rs.getTimestamp("next_execution")),
                json.read(rs.getString("extra_params"), JsonColumns.OBJECT_MAP, Map.of()),
                rs.getBoolean("active")
            );
        };
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
