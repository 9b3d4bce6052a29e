package com.courtcapture.capture.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Periodicity {
    DAILY("daily"),
    WEEKLY("weekly"),
    CUSTOM("custom");

    private final String code;

    Periodicity(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static Periodicity fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Periodicity is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Periodicity periodicity : values()) {
            if (periodicity.code.equals(normalized)) {
                return periodicity;
            }
        }
        throw new IllegalArgumentException("Unsupported periodicity: " + value);
    }
}
