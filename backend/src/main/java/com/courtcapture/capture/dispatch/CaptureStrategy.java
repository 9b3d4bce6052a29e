package com.courtcapture.capture.dispatch;

import com.courtcapture.capture.model.CourtConfig;
import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.SubCaptureOutcome;

import java.util.List;
import java.util.Map;

public interface CaptureStrategy {

    /**
     * Runs the capture(s) for one credential. Outcomes come back in execution order.
     */
    List<SubCaptureOutcome> run(CredentialContext credential, CourtConfig courtConfig, Map<String, Object> extraParams);
}
