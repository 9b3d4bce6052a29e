package com.courtcapture.capture.model;

import java.util.Locale;
import java.util.Objects;

public record CourtCombination(String court, Degree degree) {
    public CourtCombination {
        Objects.requireNonNull(court, "court");
        Objects.requireNonNull(degree, "degree");
        court = court.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return court + "/" + degree.code();
    }
}
