package com.courtcapture.capture.model;

import java.util.List;
import java.util.Map;

/**
 * One logical capture job: a schedule's payload, or an ad-hoc request when {@code scheduleId} is null.
 */
public record CaptureJob(
    Long scheduleId,
    JobType jobType,
    long tenantId,
    List<Long> credentialIds,
    Map<String, Object> extraParams
) {
    public CaptureJob {
        credentialIds = credentialIds == null ? List.of() : List.copyOf(credentialIds);
        extraParams = extraParams == null ? Map.of() : extraParams;
    }
}
