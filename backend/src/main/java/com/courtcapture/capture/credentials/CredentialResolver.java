package com.courtcapture.capture.credentials;

import com.courtcapture.capture.model.CourtCombination;
import com.courtcapture.capture.model.CredentialContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

@Service
public class CredentialResolver {
    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private final CredentialStore store;
    private final CredentialCache cache;
    private final ExecutorService credentialExecutor;

    public CredentialResolver(
        CredentialStore store,
        CredentialCache cache,
        @Qualifier("credentialExecutor") ExecutorService credentialExecutor
    ) {
        this.store = store;
        this.cache = cache;
        this.credentialExecutor = credentialExecutor;
    }

    /**
     * Loads every id in parallel. The result keeps the input order, one entry per id.
     */
    public List<CredentialResolution> resolveMany(List<Long> credentialIds) {
        List<CompletableFuture<CredentialResolution>> futures = new ArrayList<>();
        for (Long id : credentialIds) {
            futures.add(CompletableFuture.supplyAsync(() -> resolveOne(id), credentialExecutor));
        }
        List<CredentialResolution> resolutions = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Long id = credentialIds.get(i);
            try {
                resolutions.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                resolutions.add(CredentialResolution.failed(id, describe(cause)));
            }
        }
        return resolutions;
    }

    /**
     * Resolves all ids for a job owned by {@code tenantId}, or fails naming every id that could not be used.
     */
    public List<CredentialContext> resolveAll(long tenantId, List<Long> credentialIds) {
        List<CredentialResolution> resolutions = resolveMany(credentialIds);
        List<CredentialContext> contexts = new ArrayList<>();
        List<CredentialResolution> failures = new ArrayList<>();
        for (CredentialResolution resolution : resolutions) {
            if (!resolution.resolved()) {
                failures.add(resolution);
            } else if (resolution.context().tenantId() != tenantId) {
                failures.add(CredentialResolution.failed(
                    resolution.credentialId(),
                    "belongs to tenant " + resolution.context().tenantId()
                ));
            } else {
                contexts.add(resolution.context());
            }
        }
        if (!failures.isEmpty()) {
            String detail = failures.stream()
                .map(f -> f.credentialId() + " (" + f.error() + ")")
                .collect(Collectors.joining(", "));
            throw new CredentialResolutionException(
                "Credentials not resolved: " + detail,
                failures.stream().map(CredentialResolution::credentialId).toList()
            );
        }
        return contexts;
    }

    /**
     * Cache-first lookup of a tenant's court/degree combinations; all misses go to the store in one batch.
     */
    public Map<CourtCombination, Optional<CredentialContext>> resolveForCourts(
        long tenantId,
        Collection<CourtCombination> combinations
    ) {
        Map<CourtCombination, Optional<CredentialContext>> result = new LinkedHashMap<>();
        List<CourtCombination> misses = new ArrayList<>();
        for (CourtCombination combination : combinations) {
            Optional<CredentialContext> cached = cache.lookup(tenantId, combination.court(), combination.degree());
            result.put(combination, cached);
            if (cached.isEmpty()) {
                misses.add(combination);
            }
        }
        if (!misses.isEmpty()) {
            log.debug("Credential cache misses for tenant {}: {}", tenantId, misses);
            result.putAll(cache.hydrateBatch(tenantId, misses));
        }
        return result;
    }

    private CredentialResolution resolveOne(Long credentialId) {
        if (credentialId == null) {
            return CredentialResolution.failed(null, "null credential id");
        }
        try {
            Optional<CredentialContext> found = store.findById(credentialId);
            if (found.isEmpty()) {
                return CredentialResolution.failed(credentialId, "not found or inactive");
            }
            cache.store(found.get());
            return CredentialResolution.resolved(credentialId, found.get());
        } catch (RuntimeException e) {
            log.warn("Failed to load credential {}", credentialId, e);
            return CredentialResolution.failed(credentialId, describe(e));
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    public record CredentialResolution(Long credentialId, CredentialContext context, String error) {

        static CredentialResolution resolved(Long credentialId, CredentialContext context) {
            return new CredentialResolution(credentialId, context, null);
        }

        static CredentialResolution failed(Long credentialId, String error) {
            return new CredentialResolution(credentialId, null, error);
        }

        public boolean resolved() {
            return context != null;
        }
    }
}
