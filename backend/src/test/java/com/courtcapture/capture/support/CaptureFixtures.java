package com.courtcapture.capture.support;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Objects;

/**
 * Seeds rows that other systems own (tenants, credentials, court configs, schedules).
 */
public final class CaptureFixtures {
    private final NamedParameterJdbcTemplate jdbc;

    public CaptureFixtures(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long tenant(String name, String documentNumber) {
        return insert(
            "INSERT INTO tenants (name, document_number) VALUES (:name, :documentNumber)",
            new MapSqlParameterSource()
                .addValue("name", name)
                .addValue("documentNumber", documentNumber)
        );
    }

    public long credential(long tenantId, String court, String degree, String secretCiphertext, boolean active) {
        return insert(
            """
                INSERT INTO credentials (tenant_id, court, degree, secret_ciphertext, active, active_slot)
                VALUES (:tenantId, :court, :degree, :secret, :active, :activeSlot)
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("court", court)
                .addValue("degree", degree)
                .addValue("secret", secretCiphertext)
                .addValue("active", active)
                .addValue("activeSlot", active ? 1 : null, Types.SMALLINT)
        );
    }

    public long courtConfig(String court, String degree, String baseUrl, String customTimeoutsJson) {
        return insert(
            """
                INSERT INTO court_configs (court, degree, display_name, base_url, login_url, api_url, custom_timeouts)
                VALUES (:court, :degree, :displayName, :baseUrl, :loginUrl, :apiUrl, :customTimeouts)
                """,
            new MapSqlParameterSource()
                .addValue("court", court)
                .addValue("degree", degree)
                .addValue("displayName", court + " " + degree)
                .addValue("baseUrl", baseUrl)
                .addValue("loginUrl", baseUrl + "/login")
                .addValue("apiUrl", baseUrl + "/api")
                .addValue("customTimeouts", customTimeoutsJson, Types.VARCHAR)
        );
    }

    public long schedule(
        long tenantId,
        String jobType,
        String credentialIdsJson,
        String periodicity,
        Integer intervalDays,
        String timeOfDay,
        Instant nextExecution,
        String extraParamsJson,
        boolean active
    ) {
        return insert(
            """
                INSERT INTO capture_schedules (
                    job_type, tenant_id, credential_ids, periodicity, interval_days, time_of_day,
                    next_execution, extra_params, active
                )
                VALUES (
                    :jobType, :tenantId, :credentialIds, :periodicity, :intervalDays, :timeOfDay,
                    :nextExecution, :extraParams, :active
                )
                """,
            new MapSqlParameterSource()
                .addValue("jobType", jobType)
                .addValue("tenantId", tenantId)
                .addValue("credentialIds", credentialIdsJson)
                .addValue("periodicity", periodicity)
                .addValue("intervalDays", intervalDays, Types.INTEGER)
                .addValue("timeOfDay", timeOfDay)
                .addValue("nextExecution", nextExecution == null ? null : Timestamp.from(nextExecution), Types.TIMESTAMP)
                .addValue("extraParams", extraParamsJson, Types.VARCHAR)
                .addValue("active", active)
        );
    }

    private long insert(String sql, MapSqlParameterSource params) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(sql, params, keyHolder, new String[] {"id"});
        return Objects.requireNonNull(keyHolder.getKey()).longValue();
    }
}
