package com.courtcapture.capture.dispatch;

import com.courtcapture.capture.model.CaptureRequest;
import com.courtcapture.capture.model.CaptureResult;
import com.courtcapture.capture.model.CourtConfig;
import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.JobType;
import com.courtcapture.capture.model.PendingFilter;
import com.courtcapture.capture.model.SubCaptureOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs each requested pending-filing sub-filter as its own capture, in canonical order.
 * A failing sub-filter is recorded and the next one still runs.
 */
public class PendingFilingsCaptureStrategy implements CaptureStrategy {
    private static final Logger log = LoggerFactory.getLogger(PendingFilingsCaptureStrategy.class);

    public static final String FILTERS_PARAM = "pendingFilters";
    public static final String FILTER_PARAM = "pendingFilter";

    private final CaptureExecutor executor;

    public PendingFilingsCaptureStrategy(CaptureExecutor executor) {
        this.executor = executor;
    }

    @Override
    public List<SubCaptureOutcome> run(CredentialContext credential, CourtConfig courtConfig, Map<String, Object> extraParams) {
        List<PendingFilter> filters = resolveFilters(extraParams);
        List<SubCaptureOutcome> outcomes = new ArrayList<>();
        for (PendingFilter filter : filters) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put(FILTER_PARAM, filter.code());
            params.put("captureDocuments", true);
            try {
                CaptureResult result = executor.capture(
                    new CaptureRequest(JobType.PENDING_FILINGS, credential, courtConfig, params)
                );
                if (result == null) {
                    throw new CaptureExecutionException("pending-filings capture returned no result");
                }
                outcomes.add(SubCaptureOutcome.success(filter, result));
            } catch (RuntimeException e) {
                log.warn(
                    "Pending filings capture failed for {} {} (credential {}) filter {}: {}",
                    credential.court(),
                    credential.degree().code(),
                    credential.credentialId(),
                    filter.code(),
                    e.getMessage()
                );
                outcomes.add(SubCaptureOutcome.failure(filter, messageOf(e)));
            }
        }
        return outcomes;
    }

    /**
     * Reads {@code pendingFilters} (list) or else {@code pendingFilter} (single) and returns them de-duplicated
     * in canonical order, defaulting to no-deadline.
     *
     * @throws CaptureExecutionException on an unknown filter code
     */
    public static List<PendingFilter> resolveFilters(Map<String, Object> extraParams) {
        List<PendingFilter> requested = new ArrayList<>();
        Object many = extraParams == null ? null : extraParams.get(FILTERS_PARAM);
        Object single = extraParams == null ? null : extraParams.get(FILTER_PARAM);
        try {
            if (many instanceof Collection<?> values && !values.isEmpty()) {
                for (Object value : values) {
                    requested.add(PendingFilter.fromCode(String.valueOf(value)));
                }
            } else if (single != null && !String.valueOf(single).isBlank()) {
                requested.add(PendingFilter.fromCode(String.valueOf(single)));
            }
        } catch (IllegalArgumentException e) {
            throw new CaptureExecutionException(e.getMessage(), e);
        }
        return PendingFilter.canonical(requested);
    }

    private static String messageOf(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
