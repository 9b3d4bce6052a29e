package com.courtcapture.capture.dispatch;

public class CaptureExecutionException extends RuntimeException {

    public CaptureExecutionException(String message) {
        super(message);
    }

    public CaptureExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
