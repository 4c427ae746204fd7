package com.example.schoolops.engine.model;

import lombok.Value;

/**
 * A teacher offered as substitute; {@code conflictingSlot} is the teacher's own booking at the same time, if any.
 */
@Value
public class SubstituteCandidate {

    String teacher;
    ScheduleSlot conflictingSlot;

    public boolean isAvailable() {
        return conflictingSlot == null;
    }
}
