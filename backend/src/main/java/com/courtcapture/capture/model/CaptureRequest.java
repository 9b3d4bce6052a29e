package com.courtcapture.capture.model;

import java.util.Map;

public record CaptureRequest(
    JobType jobType,
    CredentialContext credential,
    CourtConfig courtConfig,
    Map<String, Object> params
) {
    public CaptureRequest {
        params = params == null ? Map.of() : params;
    }
}
