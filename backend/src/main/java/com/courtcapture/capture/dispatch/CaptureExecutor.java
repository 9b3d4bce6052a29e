package com.courtcapture.capture.dispatch;

import com.courtcapture.capture.model.CaptureRequest;
import com.courtcapture.capture.model.CaptureResult;
import com.courtcapture.capture.model.JobType;

/**
 * Performs one capture against a court portal. Implementations own login, scraping and per-call timeouts.
 */
public interface CaptureExecutor {

    boolean supports(JobType jobType);

    /**
     * @throws CaptureExecutionException when the portal call fails
     */
    CaptureResult capture(CaptureRequest request);
}
