package com.example.schoolops.enums;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Optional;

/**
 * The five teaching days of the school week, in display order.
 */
public enum SchoolDay {
    SUNDAY(DayOfWeek.SUNDAY),
    MONDAY(DayOfWeek.MONDAY),
    TUESDAY(DayOfWeek.TUESDAY),
    WEDNESDAY(DayOfWeek.WEDNESDAY),
    THURSDAY(DayOfWeek.THURSDAY);

    private final DayOfWeek dayOfWeek;

    SchoolDay(DayOfWeek dayOfWeek) {
        this.dayOfWeek = dayOfWeek;
    }

    /**
     * School day a calendar date falls on; empty for Friday and Saturday.
     */
    public static Optional<SchoolDay> of(LocalDate date) {
        if (date == null) return Optional.empty();
        for (SchoolDay d : values()) {
            if (d.dayOfWeek == date.getDayOfWeek()) return Optional.of(d);
        }
        return Optional.empty();
    }

    public static Optional<SchoolDay> fromCode(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(code.trim().toUpperCase()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
