package com.courtcapture.capture.dispatch;

import com.courtcapture.capture.model.CourtConfig;
import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.JobType;
import com.courtcapture.capture.model.SubCaptureOutcome;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Strategy table from job type to capture strategy. Every job type must have an executor at startup.
 */
@Component
public class CaptureDispatcher {
    private final Map<JobType, CaptureStrategy> strategies = new EnumMap<>(JobType.class);

    public CaptureDispatcher(List<CaptureExecutor> executors) {
        for (JobType jobType : JobType.values()) {
            CaptureExecutor executor = executors.stream()
                .filter(candidate -> candidate.supports(jobType))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No capture executor registered for " + jobType.code()));
            strategies.put(jobType, strategyFor(jobType, executor));
        }
    }

    public List<SubCaptureOutcome> dispatch(
        JobType jobType,
        CredentialContext credential,
        CourtConfig courtConfig,
        Map<String, Object> extraParams
    ) {
        return strategies.get(jobType).run(credential, courtConfig, extraParams == null ? Map.of() : extraParams);
    }

    private static CaptureStrategy strategyFor(JobType jobType, CaptureExecutor executor) {
        if (jobType == JobType.PENDING_FILINGS) {
            return new PendingFilingsCaptureStrategy(executor);
        }
        return new SingleCaptureStrategy(jobType, executor);
    }
}
