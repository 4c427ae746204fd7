package com.example.schoolops.enums;

import java.util.Optional;

/**
 * Absence report presets.
 *
 * TODAY, THREE_DAYS, WEEK and REPEATED imply their own date range;
 * EXCUSED, UNEXCUSED and CUSTOM use the range supplied by the caller.
 */
public enum AbsenceFilter {
    TODAY("today"),
    THREE_DAYS("three-days"),
    WEEK("week"),
    REPEATED("repeated"),
    EXCUSED("excused"),
    UNEXCUSED("unexcused"),
    CUSTOM("custom");

    private final String code;

    AbsenceFilter(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<AbsenceFilter> fromCode(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim();
        for (AbsenceFilter f : values()) {
            if (f.code.equalsIgnoreCase(c)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
