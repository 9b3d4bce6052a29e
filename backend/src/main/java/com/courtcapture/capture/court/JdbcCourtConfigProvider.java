package com.courtcapture.capture.court;

import com.courtcapture.capture.model.CourtCombination;
import com.courtcapture.capture.model.CourtConfig;
import com.courtcapture.capture.model.Degree;
import com.courtcapture.config.CaptureProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Court endpoint metadata from {@code court_configs}, cached per (court, degree). Misses are not cached.
 */
@Repository
public class JdbcCourtConfigProvider implements CourtConfigProvider {
    private static final Logger log = LoggerFactory.getLogger(JdbcCourtConfigProvider.class);
    private static final TypeReference<Map<String, Integer>> MAP_INT = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;
    private final Map<CourtCombination, Cached> cache = new ConcurrentHashMap<>();

    public JdbcCourtConfigProvider(
        NamedParameterJdbcTemplate jdbc,
        ObjectMapper objectMapper,
        Clock clock,
        CaptureProperties properties
    ) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = Duration.ofSeconds(properties.getCourts().getCacheTtlSeconds());
    }

    @Override
    public Optional<CourtConfig> lookup(String court, Degree degree) {
        CourtCombination key = new CourtCombination(court, degree);
        Instant now = clock.instant();
        Cached cached = cache.get(key);
        if (cached != null && Duration.between(cached.loadedAt(), now).compareTo(ttl) < 0) {
            return Optional.of(cached.config());
        }
        Optional<CourtConfig> loaded = load(key);
        if (loaded.isPresent()) {
            cache.put(key, new Cached(loaded.get(), now));
        } else {
            cache.remove(key);
        }
        return loaded;
    }

    @Override
    public void clearCache() {
        cache.clear();
    }

    private Optional<CourtConfig> load(CourtCombination key) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("court", key.court())
            .addValue("degree", key.degree().code());
        List<CourtConfig> rows = jdbc.query(
            """
                SELECT court,
                       degree,
                       display_name,
                       base_url,
                       login_url,
                       api_url,
                       custom_timeouts
                FROM court_configs
                WHERE court = :court
                  AND degree = :degree
                """,
            params,
            (rs, rowNum) -> new CourtConfig(
                rs.getString("court"),
                Degree.fromCode(rs.getString("degree")),
                rs.getString("display_name"),
                rs.getString("base_url"),
                rs.getString("login_url"),
                rs.getString("api_url"),
                parseTimeouts(rs.getString("custom_timeouts"))
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private Map<String, Integer> parseTimeouts(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_INT);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed custom_timeouts: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private record Cached(CourtConfig config, Instant loadedAt) {}
}
