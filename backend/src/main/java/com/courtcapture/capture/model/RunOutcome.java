package com.courtcapture.capture.model;

public enum RunOutcome {
    SUCCESS("COMPLETED"),
    PARTIAL_FAILURE("PARTIAL_FAILURE"),
    TOTAL_FAILURE("FAILED");

    private final String runStatus;

    RunOutcome(String runStatus) {
        this.runStatus = runStatus;
    }

    public String runStatus() {
        return runStatus;
    }

    public static RunOutcome aggregate(int succeeded, int failed) {
        if (failed == 0) {
            return SUCCESS;
        }
        return succeeded > 0 ? PARTIAL_FAILURE : TOTAL_FAILURE;
    }
}
