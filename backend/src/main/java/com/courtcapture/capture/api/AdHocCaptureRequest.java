package com.courtcapture.capture.api;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/captures}. {@code degrees} defaults to both instances.
 */
public record AdHocCaptureRequest(
    Long tenantId,
    String jobType,
    List<String> courts,
    List<String> degrees,
    Map<String, Object> extraParams
) {}
