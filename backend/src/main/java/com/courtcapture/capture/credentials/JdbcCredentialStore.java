package com.courtcapture.capture.credentials;

import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.Degree;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Repository
public class JdbcCredentialStore implements CredentialStore {
    private final NamedParameterJdbcTemplate jdbc;
    private final SecretCipher cipher;

    public JdbcCredentialStore(NamedParameterJdbcTemplate jdbc, SecretCipher cipher) {
        this.jdbc = jdbc;
        this.cipher = cipher;
    }

    @Override
    public Optional<CredentialContext> findById(long credentialId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("credentialId", credentialId);
        List<CredentialContext> rows = jdbc.query(
            """
                SELECT c.id,
                       c.tenant_id,
                       c.court,
                       c.degree,
                       c.secret_ciphertext,
                       t.document_number
                FROM credentials c
                JOIN tenants t ON t.id = c.tenant_id
                WHERE c.id = :credentialId
                  AND c.active = TRUE
                """,
            params,
            credentialMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<CredentialContext> findActiveBatch(long tenantId, Collection<String> courts, Collection<Degree> degrees) {
        if (courts == null || courts.isEmpty() || degrees == null || degrees.isEmpty()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("courts", courts.stream().map(c -> c.trim().toUpperCase(Locale.ROOT)).toList())
            .addValue("degrees", degrees.stream().map(Degree::code).toList());
        return jdbc.query(
            """
                SELECT c.id,
                       c.tenant_id,
                       c.court,
                       c.degree,
                       c.secret_ciphertext,
                       t.document_number
                FROM credentials c
                JOIN tenants t ON t.id = c.tenant_id
                WHERE c.tenant_id = :tenantId
                  AND c.court IN (:courts)
                  AND c.degree IN (:degrees)
                  AND c.active = TRUE
                ORDER BY c.court, c.degree
                """,
            params,
            credentialMapper()
        );
    }

    private RowMapper<CredentialContext> credentialMapper() {
        return (rs, rowNum) -> new CredentialContext(
            rs.getLong("id"),
            rs.getLong("tenant_id"),
            rs.getString("court"),
            Degree.fromCode(rs.getString("degree")),
            rs.getString("document_number"),
            cipher.decrypt(rs.getString("secret_ciphertext"))
        );
    }
}
