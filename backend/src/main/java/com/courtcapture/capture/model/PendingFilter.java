package com.courtcapture.capture.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Pending-filing sub-filters. Declaration order is the canonical execution order.
 */
public enum PendingFilter {
    NO_DEADLINE("no-deadline"),
    WITHIN_DEADLINE("within-deadline");

    private final String code;

    PendingFilter(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static PendingFilter fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Pending filter is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (PendingFilter filter : values()) {
            if (filter.code.equals(normalized)) {
                return filter;
            }
        }
        throw new IllegalArgumentException("Unsupported pending filter: " + value);
    }

    /**
     * De-duplicates and sorts into canonical order; an empty request means {@link #NO_DEADLINE} alone.
     */
    public static List<PendingFilter> canonical(Collection<PendingFilter> requested) {
        if (requested == null || requested.isEmpty()) {
            return List.of(NO_DEADLINE);
        }
        return new ArrayList<>(EnumSet.copyOf(requested));
    }
}
