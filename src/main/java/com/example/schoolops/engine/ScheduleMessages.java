package com.example.schoolops.engine;

import com.example.schoolops.engine.model.ConflictKind;
import com.example.schoolops.engine.model.ConflictResult;
import com.example.schoolops.engine.model.ScheduleSlot;

final class ScheduleMessages {

    private ScheduleMessages() {
    }

    static String conflict(ConflictResult result, String teacher, String classRoom) {
        ScheduleSlot s = result.getConflictingSlot();
        if (result.getKind() == ConflictKind.TEACHER) {
            return String.format("Teacher \"%s\" already teaches on %s period %d (%s - %s)",
                    teacher, s.getDay(), s.getPeriod(), s.getSubject(), s.getClassRoom());
        }
        return String.format("Class \"%s\" already has a session on %s period %d (%s - teacher: %s)",
                classRoom, s.getDay(), s.getPeriod(), s.getSubject(), s.getTeacher());
    }

    static String slotNotFound(String slotId) {
        return "Schedule slot not found: " + slotId;
    }
}
