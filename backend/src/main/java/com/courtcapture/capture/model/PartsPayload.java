package com.courtcapture.capture.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw parties payload for one case, captured as a by-product of a docket capture.
 */
public record PartsPayload(Long caseId, String caseNumber, JsonNode payload) {}
