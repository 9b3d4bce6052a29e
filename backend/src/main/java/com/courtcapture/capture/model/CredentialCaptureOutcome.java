package com.courtcapture.capture.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one credential produced in a run: a setup error (court config), or one or more capture outcomes.
 */
public record CredentialCaptureOutcome(
    long credentialId,
    String court,
    Degree degree,
    String error,
    List<SubCaptureOutcome> captures
) {
    public CredentialCaptureOutcome {
        captures = captures == null ? List.of() : List.copyOf(captures);
    }

    public int succeededCount() {
        return (int) captures.stream().filter(SubCaptureOutcome::succeeded).count();
    }

    public int failedCount() {
        int failed = (int) captures.stream().filter(c -> !c.succeeded()).count();
        return error == null ? failed : failed + 1;
    }

    public List<String> errorMessages() {
        String prefix = court + " " + degree.code() + " (ID " + credentialId + ")";
        List<String> messages = new ArrayList<>();
        if (error != null) {
            messages.add(prefix + ": " + error);
        }
        for (SubCaptureOutcome capture : captures) {
            if (capture.succeeded()) {
                continue;
            }
            if (capture.filter() == null) {
                messages.add(prefix + ": " + capture.error());
            } else {
                messages.add(prefix + " - " + capture.filter().code() + ": " + capture.error());
            }
        }
        return messages;
    }
}
