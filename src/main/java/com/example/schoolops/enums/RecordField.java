package com.example.schoolops.enums;

import java.util.Optional;

/**
 * Editable fields of a daily attendance record.
 */
public enum RecordField {
    ATTENDANCE("attendance"),
    PARTICIPATION("participation"),
    HOMEWORK("homework"),
    BEHAVIOR("behavior"),
    NOTES("notes");

    private final String code;

    RecordField(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<RecordField> fromCode(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim();
        for (RecordField f : values()) {
            if (f.code.equalsIgnoreCase(c)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
