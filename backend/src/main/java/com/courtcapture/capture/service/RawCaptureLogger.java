package com.courtcapture.capture.service;

import com.courtcapture.capture.model.AttemptStatus;
import com.courtcapture.capture.model.CaptureErrorType;
import com.courtcapture.capture.model.CaptureJob;
import com.courtcapture.capture.model.CaptureResult;
import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.EvidenceEntry;
import com.courtcapture.capture.model.PartsPayload;
import com.courtcapture.capture.persistence.EvidenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Best-effort evidence writer. A failed append is logged with its context and reported as {@code false};
 * it never reaches the caller as an exception.
 */
@Component
public class RawCaptureLogger {
    private static final Logger log = LoggerFactory.getLogger(RawCaptureLogger.class);

    static final String PARTS_CAPTURE_TYPE = "parts";

    private final EvidenceStore evidenceStore;
    private final Clock clock;

    public RawCaptureLogger(EvidenceStore evidenceStore, Clock clock) {
        this.evidenceStore = evidenceStore;
        this.clock = clock;
    }

    public boolean logSuccess(
        long jobRunId,
        CaptureJob job,
        List<Long> credentialIds,
        CredentialContext credential,
        Map<String, Object> request,
        CaptureResult result
    ) {
        return append(new EvidenceEntry(
            null,
            jobRunId,
            job.jobType().code(),
            job.tenantId(),
            credential.credentialId(),
            credentialIds,
            credential.court(),
            credential.degree(),
            AttemptStatus.SUCCESS,
            request,
            result.evidencePayload(),
            result.processedSummary(),
            result.executionLogs(),
            null,
            null,
            clock.instant()
        ));
    }

    public boolean logFailure(
        long jobRunId,
        CaptureJob job,
        List<Long> credentialIds,
        CredentialContext credential,
        Map<String, Object> request,
        String errorMessage,
        CaptureErrorType errorType
    ) {
        return append(new EvidenceEntry(
            null,
            jobRunId,
            job.jobType().code(),
            job.tenantId(),
            credential.credentialId(),
            credentialIds,
            credential.court(),
            credential.degree(),
            AttemptStatus.ERROR,
            request,
            null,
            null,
            null,
            errorMessage,
            errorType,
            clock.instant()
        ));
    }

    /**
     * Secondary parties payload of one case. The request references the capture that produced it.
     */
    public boolean logParts(
        long jobRunId,
        CaptureJob job,
        List<Long> credentialIds,
        CredentialContext credential,
        PartsPayload parts
    ) {
        if (parts == null || parts.payload() == null || parts.payload().isNull()) {
            return false;
        }
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("caseId", parts.caseId());
        request.put("caseNumber", parts.caseNumber());
        request.put("parentCaptureType", job.jobType().code());
        return append(new EvidenceEntry(
            null,
            jobRunId,
            PARTS_CAPTURE_TYPE,
            job.tenantId(),
            credential.credentialId(),
            credentialIds,
            credential.court(),
            credential.degree(),
            AttemptStatus.SUCCESS,
            request,
            parts.payload(),
            null,
            null,
            null,
            null,
            clock.instant()
        ));
    }

    private boolean append(EvidenceEntry entry) {
        try {
            evidenceStore.append(entry);
            return true;
        } catch (RuntimeException e) {
            log.error(
                "Failed to record capture evidence run={} tenant={} court={} degree={} type={} status={}",
                entry.jobRunId(),
                entry.tenantId(),
                entry.court(),
                entry.degree().code(),
                entry.captureType(),
                entry.status().code(),
                e
            );
            return false;
        }
    }
}
