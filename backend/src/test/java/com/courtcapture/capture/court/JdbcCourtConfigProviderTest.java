package com.courtcapture.capture.court;

import com.courtcapture.capture.model.CourtConfig;
import com.courtcapture.capture.model.Degree;
import com.courtcapture.capture.support.CaptureFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcCourtConfigProviderTest {

    @Autowired
    private CourtConfigProvider provider;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void loadsConfigWithCustomTimeoutsAndCachesIt() {
        String court = uniqueCourt();
        new CaptureFixtures(jdbc).courtConfig(court, "first", "https://pje.example.jus.br", "{\"login\": 45, \"capture\": 600}");

        CourtConfig config = provider.lookup(court, Degree.FIRST).orElseThrow();

        assertThat(config.baseUrl()).isEqualTo("https://pje.example.jus.br");
        assertThat(config.loginUrl()).isEqualTo("https://pje.example.jus.br/login");
        assertThat(config.customTimeouts()).containsEntry("login", 45).containsEntry("capture", 600);

        jdbc.update(
            "UPDATE court_configs SET base_url = 'https://changed.example' WHERE court = :court",
            new MapSqlParameterSource().addValue("court", court)
        );
        assertThat(provider.lookup(court, Degree.FIRST).orElseThrow().baseUrl()).isEqualTo("https://pje.example.jus.br");

        provider.clearCache();
        assertThat(provider.lookup(court, Degree.FIRST).orElseThrow().baseUrl()).isEqualTo("https://changed.example");
    }

    @Test
    void missingConfigIsEmptyAndNotCached() {
        String court = uniqueCourt();

        assertThat(provider.lookup(court, Degree.SECOND)).isEmpty();

        new CaptureFixtures(jdbc).courtConfig(court, "second", "https://pje.late.jus.br", null);
        assertThat(provider.lookup(court, Degree.SECOND)).map(CourtConfig::baseUrl).contains("https://pje.late.jus.br");
    }

    private static String uniqueCourt() {
        return "T" + UUID.randomUUID().toString().substring(0, 6).toUpperCase();
    }
}
