package com.example.schoolops.enums;

import java.util.Optional;

/**
 * Attendance of a student on a school day.
 *
 * EXCUSED and ABSENT both clear the evaluation axes of the day's record.
 */
public enum AttendanceStatus {
    PRESENT("present"),
    EXCUSED("excused"),
    ABSENT("absent");

    private final String code;

    AttendanceStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isAbsence() {
        return this != PRESENT;
    }

    public static Optional<AttendanceStatus> fromCode(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim();
        for (AttendanceStatus s : values()) {
            if (s.code.equalsIgnoreCase(c)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
