package com.courtcapture.capture.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record Schedule(
    long id,
    JobType jobType,
    long tenantId,
    List<Long> credentialIds,
    Recurrence recurrence,
    Instant lastExecution,
    Instant nextExecution,
    Map<String, Object> extraParams,
    boolean active
) {
    public Schedule {
        credentialIds = credentialIds == null ? List.of() : List.copyOf(credentialIds);
        extraParams = extraParams == null ? Map.of() : extraParams;
    }

    public CaptureJob toJob() {
        return new CaptureJob(id, jobType, tenantId, credentialIds, extraParams);
    }
}
