package com.example.schoolops.engine.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a double-booking check. {@code kind} and {@code conflictingSlot} are null when there is no conflict.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConflictResult {

    private static final ConflictResult NONE = new ConflictResult(null, null);

    ConflictKind kind;
    ScheduleSlot conflictingSlot;

    public static ConflictResult none() {
        return NONE;
    }

    public static ConflictResult teacher(ScheduleSlot slot) {
        return new ConflictResult(ConflictKind.TEACHER, slot);
    }

    public static ConflictResult classRoom(ScheduleSlot slot) {
        return new ConflictResult(ConflictKind.CLASS, slot);
    }

    public boolean isConflict() {
        return kind != null;
    }
}
