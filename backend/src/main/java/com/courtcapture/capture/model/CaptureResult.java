package com.courtcapture.capture.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record CaptureResult(
    JsonNode structuredResult,
    JsonNode rawPayload,
    JsonNode processedSummary,
    List<String> executionLogs,
    List<PartsPayload> partsPayloads
) {
    public CaptureResult {
        executionLogs = executionLogs == null ? List.of() : List.copyOf(executionLogs);
        partsPayloads = partsPayloads == null ? List.of() : List.copyOf(partsPayloads);
    }

    /**
     * Payload preserved as evidence: the raw capture when present, else the structured result.
     */
    public JsonNode evidencePayload() {
        return rawPayload != null && !rawPayload.isNull() ? rawPayload : structuredResult;
    }
}
