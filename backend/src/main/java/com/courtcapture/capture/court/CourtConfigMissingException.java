package com.courtcapture.capture.court;

import com.courtcapture.capture.model.Degree;

public class CourtConfigMissingException extends RuntimeException {

    public CourtConfigMissingException(String court, Degree degree) {
        super("Court configuration not found for " + court + " " + degree.code());
    }

    public CourtConfigMissingException(String court, Degree degree, Throwable cause) {
        super("Court configuration not found for " + court + " " + degree.code() + ": " + cause.getMessage(), cause);
    }
}
