package com.courtcapture.capture.credentials;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class CredentialCacheMaintenance {
    private static final Logger log = LoggerFactory.getLogger(CredentialCacheMaintenance.class);

    private final CredentialCache cache;

    public CredentialCacheMaintenance(CredentialCache cache) {
        this.cache = cache;
    }

    @Scheduled(
        fixedDelayString = "${capture.credentials.sweep-interval-ms:60000}",
        initialDelayString = "${capture.credentials.sweep-interval-ms:60000}"
    )
    public void sweep() {
        int removed = cache.evictExpired();
        if (removed > 0) {
            log.debug("Evicted {} expired credential cache entries", removed);
        }
    }
}
