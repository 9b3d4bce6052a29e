package com.courtcapture.capture.credentials;

import com.courtcapture.capture.model.CacheStats;
import com.courtcapture.capture.model.CourtCombination;
import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.CredentialKey;
import com.courtcapture.capture.model.Degree;
import com.courtcapture.config.CaptureProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local TTL cache of decrypted credentials keyed by (tenant, court, degree).
 *
 * <p>The credential store stays the source of truth; this cache holds nothing that cannot be rebuilt
 * after a restart or {@link #clear()}. Stale entries are never returned: {@link #lookup} evicts them on
 * read, and {@link #evictExpired()} sweeps the rest in the background.
 */
@Component
public class CredentialCache {
    private static final Logger log = LoggerFactory.getLogger(CredentialCache.class);

    private final Map<CredentialKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final CredentialStore store;
    private final Clock clock;
    private final Duration ttl;

    public CredentialCache(CredentialStore store, Clock clock, CaptureProperties properties) {
        this.store = store;
        this.clock = clock;
        this.ttl = properties.getCredentials().cacheTtl();
    }

    public Optional<CredentialContext> lookup(long tenantId, String court, Degree degree) {
        CredentialKey key = new CredentialKey(tenantId, court, degree);
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.credential());
    }

    public void store(long tenantId, String court, Degree degree, CredentialContext credential) {
        entries.put(new CredentialKey(tenantId, court, degree), new CacheEntry(credential, clock.instant()));
    }

    public void store(CredentialContext credential) {
        store(credential.tenantId(), credential.court(), credential.degree(), credential);
    }

    /**
     * Loads every requested combination with a single store query and caches what it finds.
     * Every requested combination is present in the result; a failed query yields empty for all of them.
     */
    public Map<CourtCombination, Optional<CredentialContext>> hydrateBatch(
        long tenantId,
        Collection<CourtCombination> combinations
    ) {
        Set<CourtCombination> requested = new LinkedHashSet<>(combinations);
        Map<CourtCombination, Optional<CredentialContext>> result = new LinkedHashMap<>();
        for (CourtCombination combination : requested) {
            result.put(combination, Optional.empty());
        }
        if (requested.isEmpty()) {
            return result;
        }

        Set<String> courts = new LinkedHashSet<>();
        Set<Degree> degrees = new LinkedHashSet<>();
        for (CourtCombination combination : requested) {
            courts.add(combination.court());
            degrees.add(combination.degree());
        }

        List<CredentialContext> found;
        try {
            found = store.findActiveBatch(tenantId, courts, degrees);
        } catch (RuntimeException e) {
            log.warn(
                "Batch credential fetch failed for tenant {} ({} combinations); treating all as missing",
                tenantId,
                requested.size(),
                e
            );
            return result;
        }

        for (CredentialContext credential : found) {
            if (credential.tenantId() != tenantId) {
                continue;
            }
            CourtCombination combination = credential.combination();
            if (requested.contains(combination)) {
                store(credential);
                result.put(combination, Optional.of(credential));
            }
        }
        return result;
    }

    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<CredentialKey, CacheEntry> entry : entries.entrySet()) {
            if (isExpired(entry.getValue(), now) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public CacheStats stats() {
        Instant now = clock.instant();
        int valid = 0;
        int expired = 0;
        for (CacheEntry entry : entries.values()) {
            if (isExpired(entry, now)) {
                expired++;
            } else {
                valid++;
            }
        }
        return new CacheStats(valid + expired, valid, expired);
    }

    public void clear() {
        entries.clear();
    }

    int size() {
        return entries.size();
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return Duration.between(entry.storedAt(), now).compareTo(ttl) >= 0;
    }

    private record CacheEntry(CredentialContext credential, Instant storedAt) {}
}
