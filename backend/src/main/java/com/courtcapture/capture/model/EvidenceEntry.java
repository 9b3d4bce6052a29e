package com.courtcapture.capture.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One append-only evidence row. {@code captureType} is the job type code, or {@code parts} for secondary payloads.
 */
public record EvidenceEntry(
    Long id,
    long jobRunId,
    String captureType,
    long tenantId,
    long credentialId,
    List<Long> credentialIds,
    String court,
    Degree degree,
    AttemptStatus status,
    Map<String, Object> request,
    JsonNode rawPayload,
    JsonNode processedSummary,
    List<String> logs,
    String errorMessage,
    CaptureErrorType errorType,
    Instant createdAt
) {
    public EvidenceEntry {
        credentialIds = credentialIds == null ? List.of() : List.copyOf(credentialIds);
        request = request == null ? Map.of() : request;
    }
}
