package com.courtcapture.capture.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AttemptStatus {
    SUCCESS,
    ERROR;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AttemptStatus fromCode(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
