package com.courtcapture.capture.persistence;

import com.courtcapture.capture.model.AttemptStatus;
import com.courtcapture.capture.model.CaptureErrorType;
import com.courtcapture.capture.model.Degree;
import com.courtcapture.capture.model.EvidenceEntry;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Repository
public class JdbcEvidenceStore implements EvidenceStore {
    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumns json;

    public JdbcEvidenceStore(NamedParameterJdbcTemplate jdbc, JsonColumns json) {
        this.jdbc = jdbc;
        this.json = json;
    }

    @Override
    public void append(EvidenceEntry entry) {
        Objects.requireNonNull(entry.captureType(), "captureType");
        Objects.requireNonNull(entry.court(), "court");
        Objects.requireNonNull(entry.degree(), "degree");
        Objects.requireNonNull(entry.status(), "status");
        Instant createdAt = entry.createdAt() == null ? Instant.now() : entry.createdAt();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("captureRunId", entry.jobRunId())
            .addValue("captureType", entry.captureType())
            .addValue("tenantId", entry.tenantId())
            .addValue("credentialId", entry.credentialId())
            .addValue("credentialIds", json.write(entry.credentialIds()))
            .addValue("court", entry.court())
            .addValue("degree", entry.degree().code())
            .addValue("status", entry.status().code())
            .addValue("request", json.write(entry.request()))
            .addValue("rawPayload", json.write(entry.rawPayload()), Types.VARCHAR)
            .addValue("processedSummary", json.write(entry.processedSummary()), Types.VARCHAR)
            .addValue("logs", json.write(entry.logs()), Types.VARCHAR)
            .addValue("errorMessage", entry.errorMessage(), Types.VARCHAR)
            .addValue("errorType", entry.errorType() == null ? null : entry.errorType().name(), Types.VARCHAR)
            .addValue("createdAt", Timestamp.from(createdAt));
        jdbc.update(
            """
                INSERT INTO capture_raw_logs (
                    capture_run_id,
                    capture_type,
                    tenant_id,
                    credential_id,
                    credential_ids,
                    court,
                    degree,
                    status,
                    request,
                    raw_payload,
                    processed_summary,
                    logs,
                    error_message,
                    error_type,
                    created_at
                )
                VALUES (
                    :captureRunId,
                    :captureType,
                    :tenantId,
                    :credentialId,
                    :credentialIds,
                    :court,
                    :degree,
                    :status,
                    :request,
                    :rawPayload,
                    :processedSummary,
                    :logs,
                    :errorMessage,
                    :errorType,
                    :createdAt
                )
                """,
            params
        );
    }

    @Override
    public List<EvidenceEntry> findByRun(long jobRunId) {
        return jdbc.query(
            """
                SELECT id,
                       capture_run_id,
                       capture_type,
                       tenant_id,
                       credential_id,
                       credential_ids,
                       court,
                       degree,
                       status,
                       request,
                       raw_payload,
                       processed_summary,
                       logs,
                       error_message,
                       error_type,
                       created_at
                FROM capture_raw_logs
                WHERE capture_run_id = :captureRunId
                ORDER BY id ASC
                """,
            new MapSqlParameterSource().addValue("captureRunId", jobRunId),
            (rs, rowNum) -> {
                String errorType = rs.getString("error_type");
                Timestamp createdAt = rs.getTimestamp("created_at");
                return new EvidenceEntry(
                    rs.getLong("id"),
                    rs.getLong("capture_run_id"),
                    rs.getString("capture_type"),
                    rs.getLong("tenant_id"),
                    rs.getLong("credential_id"),
                    json.read(rs.getString("credential_ids"), JsonColumns.LONG_LIST, List.of()),
                    rs.getString("court"),
                    Degree.fromCode(rs.getString("degree")),
                    AttemptStatus.fromCode(rs.getString("status")),
                    json.read(rs.getString("request"), JsonColumns.OBJECT_MAP, Map.of()),
                    json.readTree(rs.getString("raw_payload")),
                    json.readTree(rs.getString("processed_summary")),
                    json.read(rs.getString("logs"), JsonColumns.STRING_LIST, null),
                    rs.getString("error_message"),
                    errorType == null ? null : CaptureErrorType.valueOf(errorType),
                    createdAt == null ? null : createdAt.toInstant()
                );
            }
        );
    }
}
