package com.example.schoolops.engine;

import com.example.schoolops.engine.model.ConflictResult;
import com.example.schoolops.engine.model.EngineError;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.engine.model.ScheduleSlot;
import com.example.schoolops.engine.model.SlotCandidate;
import com.example.schoolops.engine.model.SlotDraft;

import java.util.ArrayList;
import java.util.List;

/**
 * Adds, edits and removes slots of the weekly schedule.
 * Every operation returns the complete new collection, ready for a whole-schedule replace.
 */
public class ScheduleEditor {

    public static final int PERIODS_PER_DAY = 7;

    private final ConflictChecker conflictChecker;

    public ScheduleEditor(ConflictChecker conflictChecker) {
        this.conflictChecker = conflictChecker;
    }

    public Outcome<List<ScheduleSlot>> addSlot(List<ScheduleSlot> schedule, SlotDraft draft, String newId) {
        if (newId == null || newId.isBlank()) {
            return Outcome.failure(EngineError.invalidArgument("slot id is required"));
        }
        List<ScheduleSlot> current = schedule == null ? List.of() : schedule;
        if (current.stream().anyMatch(s -> newId.equals(s.getId()))) {
            return Outcome.failure(EngineError.invalidArgument("Duplicate slot id: " + newId));
        }
        EngineError invalid = validate(draft);
        if (invalid != null) {
            return Outcome.failure(invalid);
        }

        ScheduleSlot slot = ScheduleSlot.builder()
                .id(newId)
                .day(draft.getDay())
                .period(draft.getPeriod())
                .subject(draft.getSubject().trim())
                .classRoom(draft.getClassRoom().trim())
                .teacher(normalizeTeacher(draft.getTeacher()))
                .academicYear(draft.getAcademicYear().trim())
                .build();

        ConflictResult conflict = conflictChecker.checkConflict(SlotCandidate.of(slot), current, null);
        if (conflict.isConflict()) {
            return Outcome.failure(EngineError.conflict(conflict,
                    ScheduleMessages.conflict(conflict, slot.getTeacher(), slot.getClassRoom())));
        }

        List<ScheduleSlot> updated = new ArrayList<>(current);
        updated.add(slot);
        return Outcome.success(List.copyOf(updated));
    }

    /**
     * Replaces day, period, subject, classroom, teacher and year of an existing slot.
     * The slot keeps its id, creation time and any active substitution's original teacher.
     */
    public Outcome<List<ScheduleSlot>> updateSlot(List<ScheduleSlot> schedule, String slotId, SlotDraft draft) {
        List<ScheduleSlot> current = schedule == null ? List.of() : schedule;
        ScheduleSlot existing = find(current, slotId);
        if (existing == null) {
            return Outcome.failure(EngineError.notFound(ScheduleMessages.slotNotFound(slotId)));
        }
        EngineError invalid = validate(draft);
        if (invalid != null) {
            return Outcome.failure(invalid);
        }

        ScheduleSlot edited = existing.toBuilder()
                .day(draft.getDay())
                .period(draft.getPeriod())
                .subject(draft.getSubject().trim())
                .classRoom(draft.getClassRoom().trim())
                .teacher(normalizeTeacher(draft.getTeacher()))
                .academicYear(draft.getAcademicYear().trim())
                .build();

        ConflictResult conflict = conflictChecker.checkConflict(SlotCandidate.of(edited), current, slotId);
        if (conflict.isConflict()) {
            return Outcome.failure(EngineError.conflict(conflict,
                    ScheduleMessages.conflict(conflict, edited.getTeacher(), edited.getClassRoom())));
        }
        // a substituted slot still books its regular teacher at the new time
        String regular = edited.getOriginalTeacher();
        if (regular != null && !regular.equals(edited.getTeacher())) {
            SlotCandidate regularCandidate = SlotCandidate.of(edited).toBuilder().teacher(regular).build();
            ConflictResult regularConflict = conflictChecker.checkTeacherConflict(regularCandidate, current, slotId);
            if (regularConflict.isConflict()) {
                return Outcome.failure(EngineError.conflict(regularConflict,
                        ScheduleMessages.conflict(regularConflict, regular, edited.getClassRoom())));
            }
        }

        List<ScheduleSlot> updated = new ArrayList<>(current.size());
        for (ScheduleSlot s : current) {
            updated.add(slotId.equals(s.getId()) ? edited : s);
        }
        return Outcome.success(List.copyOf(updated));
    }

    public Outcome<List<ScheduleSlot>> deleteSlot(List<ScheduleSlot> schedule, String slotId) {
        List<ScheduleSlot> current = schedule == null ? List.of() : schedule;
        if (find(current, slotId) == null) {
            return Outcome.failure(EngineError.notFound(ScheduleMessages.slotNotFound(slotId)));
        }
        List<ScheduleSlot> updated = new ArrayList<>(current);
        updated.removeIf(s -> slotId.equals(s.getId()));
        return Outcome.success(List.copyOf(updated));
    }

    /**
     * Trims a teacher name and collapses inner whitespace runs to a single space.
     */
    public static String normalizeTeacher(String teacher) {
        if (teacher == null) return null;
        return teacher.trim().replaceAll("\\s+", " ");
    }

    static ScheduleSlot find(List<ScheduleSlot> schedule, String slotId) {
        if (slotId == null) return null;
        for (ScheduleSlot s : schedule) {
            if (slotId.equals(s.getId())) return s;
        }
        return null;
    }

    private EngineError validate(SlotDraft draft) {
        if (draft == null) {
            return EngineError.invalidArgument("slot data is required");
        }
        if (draft.getDay() == null) {
            return EngineError.invalidArgument("day is required");
        }
        if (draft.getPeriod() == null || draft.getPeriod() < 1 || draft.getPeriod() > PERIODS_PER_DAY) {
            return EngineError.invalidArgument("period must be between 1 and " + PERIODS_PER_DAY);
        }
        if (isBlank(draft.getSubject()) || isBlank(draft.getClassRoom()) || isBlank(draft.getTeacher())) {
            return EngineError.invalidArgument("subject, classRoom and teacher are required");
        }
        if (isBlank(draft.getAcademicYear())) {
            return EngineError.invalidArgument("academic year is required");
        }
        return null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
