package com.courtcapture.capture.model;

import java.util.Map;

public record CourtConfig(
    String court,
    Degree degree,
    String displayName,
    String baseUrl,
    String loginUrl,
    String apiUrl,
    Map<String, Integer> customTimeouts
) {}
