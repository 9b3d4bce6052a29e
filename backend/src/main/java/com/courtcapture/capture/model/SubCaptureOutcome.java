package com.courtcapture.capture.model;

/**
 * Result of one capture call; {@code filter} is set only for pending filings.
 */
public record SubCaptureOutcome(PendingFilter filter, CaptureResult result, String error) {

    public static SubCaptureOutcome success(PendingFilter filter, CaptureResult result) {
        return new SubCaptureOutcome(filter, result, null);
    }

    public static SubCaptureOutcome failure(PendingFilter filter, String error) {
        return new SubCaptureOutcome(filter, null, error == null ? "unknown error" : error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
