package com.example.schoolops.enums;

import java.util.Optional;

/**
 * Rating used by every evaluation axis (participation, homework, behavior).
 * NONE means "not rated", which is the only legal value while a student is not present.
 */
public enum EvaluationLevel {
    EXCELLENT("excellent"),
    GOOD("good"),
    AVERAGE("average"),
    POOR("poor"),
    NONE("none");

    private final String code;

    EvaluationLevel(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<EvaluationLevel> fromCode(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim();
        for (EvaluationLevel l : values()) {
            if (l.code.equalsIgnoreCase(c)) return Optional.of(l);
        }
        return Optional.empty();
    }
}
