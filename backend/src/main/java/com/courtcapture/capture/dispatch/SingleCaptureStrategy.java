package com.courtcapture.capture.dispatch;

import com.courtcapture.capture.model.CaptureRequest;
import com.courtcapture.capture.model.CaptureResult;
import com.courtcapture.capture.model.CourtConfig;
import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.JobType;
import com.courtcapture.capture.model.SubCaptureOutcome;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One executor call per credential. Failures propagate to the caller.
 */
public class SingleCaptureStrategy implements CaptureStrategy {
    static final List<String> HEARING_PARAMS = List.of("dateFrom", "dateTo");

    private final JobType jobType;
    private final CaptureExecutor executor;

    public SingleCaptureStrategy(JobType jobType, CaptureExecutor executor) {
        this.jobType = jobType;
        this.executor = executor;
    }

    @Override
    public List<SubCaptureOutcome> run(CredentialContext credential, CourtConfig courtConfig, Map<String, Object> extraParams) {
        CaptureResult result = executor.capture(new CaptureRequest(jobType, credential, courtConfig, paramsFor(extraParams)));
        if (result == null) {
            throw new CaptureExecutionException(jobType.code() + " capture returned no result");
        }
        return List.of(SubCaptureOutcome.success(null, result));
    }

    private Map<String, Object> paramsFor(Map<String, Object> extraParams) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (jobType == JobType.HEARINGS) {
            for (String name : HEARING_PARAMS) {
                Object value = extraParams.get(name);
                if (value != null) {
                    params.put(name, value);
                }
            }
        }
        return params;
    }
}
