package com.courtcapture.capture.credentials;

import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.Degree;
import com.courtcapture.capture.support.CaptureFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcCredentialStoreTest {

    @Autowired
    private CredentialStore credentialStore;

    @Autowired
    private SecretCipher cipher;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private CaptureFixtures fixtures;
    private long tenantId;

    @BeforeEach
    void setUp() {
        fixtures = new CaptureFixtures(jdbc);
        tenantId = fixtures.tenant("Tenant " + UUID.randomUUID(), "98765432100");
    }

    @Test
    void findByIdDecryptsTheSecretAndUsesTheTenantDocumentAsLogin() {
        long id = fixtures.credential(tenantId, "TRT15", "second", cipher.encrypt("portal-pass"), true);

        CredentialContext credential = credentialStore.findById(id).orElseThrow();

        assertThat(credential.tenantId()).isEqualTo(tenantId);
        assertThat(credential.court()).isEqualTo("TRT15");
        assertThat(credential.degree()).isEqualTo(Degree.SECOND);
        assertThat(credential.login()).isEqualTo("98765432100");
        assertThat(credential.secret()).isEqualTo("portal-pass");
        assertThat(credential.toString()).doesNotContain("portal-pass");
    }

    @Test
    void inactiveCredentialsAreInvisible() {
        long inactive = fixtures.credential(tenantId, "TRT15", "first", cipher.encrypt("old"), false);

        assertThat(credentialStore.findById(inactive)).isEmpty();
        assertThat(credentialStore.findActiveBatch(tenantId, List.of("TRT15"), List.of(Degree.FIRST))).isEmpty();
    }

    @Test
    void batchReturnsOnlyActiveRowsOfTheTenantForTheRequestedCourtsAndDegrees() {
        long otherTenant = fixtures.tenant("Other " + UUID.randomUUID(), "11111111111");
        fixtures.credential(tenantId, "TRT1", "first", cipher.encrypt("a"), true);
        fixtures.credential(tenantId, "TRT1", "second", cipher.encrypt("b"), true);
        fixtures.credential(tenantId, "TRT2", "first", cipher.encrypt("c"), true);
        fixtures.credential(tenantId, "TRT3", "first", cipher.encrypt("d"), true);
        fixtures.credential(otherTenant, "TRT1", "first", cipher.encrypt("e"), true);

        List<CredentialContext> found = credentialStore.findActiveBatch(
            tenantId,
            List.of("trt1", "TRT2"),
            List.of(Degree.FIRST, Degree.SECOND)
        );

        assertThat(found).extracting(CredentialContext::court).containsExactly("TRT1", "TRT1", "TRT2");
        assertThat(found).allMatch(credential -> credential.tenantId() == tenantId);
    }

    @Test
    void secondActiveCredentialForTheSameCombinationIsRejected() {
        fixtures.credential(tenantId, "TRT8", "first", cipher.encrypt("a"), true);
        fixtures.credential(tenantId, "TRT8", "first", cipher.encrypt("old"), false);

        assertThrows(
            DataIntegrityViolationException.class,
            () -> fixtures.credential(tenantId, "TRT8", "first", cipher.encrypt("b"), true)
        );
    }
}
