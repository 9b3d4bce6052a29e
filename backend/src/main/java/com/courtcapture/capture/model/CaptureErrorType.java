package com.courtcapture.capture.model;

public enum CaptureErrorType {
    COURT_CONFIG_MISSING,
    CAPTURE_EXECUTION
}
