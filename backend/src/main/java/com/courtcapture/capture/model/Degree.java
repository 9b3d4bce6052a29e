package com.courtcapture.capture.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Judicial instance level a credential is scoped to.
 */
public enum Degree {
    FIRST("first"),
    SECOND("second");

    private final String code;

    Degree(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static Degree fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Degree is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Degree degree : values()) {
            if (degree.code.equals(normalized) || degree.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return degree;
            }
        }
        if ("1".equals(normalized)) {
            return FIRST;
        }
        if ("2".equals(normalized)) {
            return SECOND;
        }
        throw new IllegalArgumentException("Unsupported degree: " + value);
    }
}
