package com.courtcapture.capture.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

public record CaptureRun(
    long id,
    String jobType,
    long tenantId,
    List<Long> credentialIds,
    Long scheduleId,
    String status,
    Instant startedAt,
    Instant finishedAt,
    String error,
    JsonNode summary
) {}
