package com.courtcapture.capture.model;

import java.util.Locale;
import java.util.Objects;

public record CredentialKey(long tenantId, String court, Degree degree) {
    public CredentialKey {
        Objects.requireNonNull(court, "court");
        Objects.requireNonNull(degree, "degree");
        court = court.trim().toUpperCase(Locale.ROOT);
    }
}
