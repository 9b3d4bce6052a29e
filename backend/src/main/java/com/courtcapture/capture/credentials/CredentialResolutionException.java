package com.courtcapture.capture.credentials;

import java.util.List;

public class CredentialResolutionException extends RuntimeException {
    private final List<Long> failedCredentialIds;

    public CredentialResolutionException(String message, List<Long> failedCredentialIds) {
        super(message);
        this.failedCredentialIds = failedCredentialIds == null ? List.of() : List.copyOf(failedCredentialIds);
    }

    public List<Long> getFailedCredentialIds() {
        return failedCredentialIds;
    }
}
