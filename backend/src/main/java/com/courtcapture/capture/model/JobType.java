package com.courtcapture.capture.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobType {
    FULL_DOCKET("full-docket"),
    ARCHIVED_CASES("archived-cases"),
    HEARINGS("hearings"),
    PENDING_FILINGS("pending-filings"),
    COMBINED("combined");

    private final String code;

    JobType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static JobType fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (JobType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported job type: " + value);
    }
}
