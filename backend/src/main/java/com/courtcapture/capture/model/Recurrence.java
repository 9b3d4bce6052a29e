package com.courtcapture.capture.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * When a schedule repeats: every day, every week, or every {@code intervalDays} days, at {@code timeOfDay}.
 */
public record Recurrence(
    Periodicity periodicity,
    Integer intervalDays,
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm") LocalTime timeOfDay
) {
    public Recurrence {
        Objects.requireNonNull(periodicity, "periodicity");
        Objects.requireNonNull(timeOfDay, "timeOfDay");
        if (periodicity == Periodicity.CUSTOM && (intervalDays == null || intervalDays < 1)) {
            throw new IllegalArgumentException("Custom periodicity requires intervalDays >= 1");
        }
    }

    public int stepDays() {
        return switch (periodicity) {
            case DAILY -> 1;
            case WEEKLY -> 7;
            case CUSTOM -> intervalDays;
        };
    }

    /**
     * First slot at {@code timeOfDay} strictly after {@code now}, stepping from today's slot.
     */
    public ZonedDateTime nextExecutionAfter(ZonedDateTime now) {
        ZonedDateTime candidate = now.toLocalDate().atTime(timeOfDay).atZone(now.getZone());
        while (!candidate.isAfter(now)) {
            candidate = candidate.plusDays(stepDays());
        }
        return candidate;
    }
}
