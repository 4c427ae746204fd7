package com.example.schoolops.engine;

import com.example.schoolops.engine.model.ConflictResult;
import com.example.schoolops.engine.model.ScheduleSlot;
import com.example.schoolops.engine.model.SlotCandidate;

import java.util.List;

/**
 * Double-booking rules for the weekly schedule.
 *
 * A teacher conflict is another slot at the same day/period whose current or original teacher
 * is the candidate's teacher. A class conflict is another slot at the same day/period for the
 * same classroom (exact string match). Both only apply within one academic year, where a slot
 * or candidate without a year matches every year.
 */
public class ConflictChecker {

    /**
     * Teacher conflicts are reported before class conflicts.
     *
     * @param excludeId id of the slot being edited in place, or null
     */
    public ConflictResult checkConflict(SlotCandidate candidate, List<ScheduleSlot> existing, String excludeId) {
        ConflictResult teacherConflict = checkTeacherConflict(candidate, existing, excludeId);
        if (teacherConflict.isConflict()) {
            return teacherConflict;
        }
        return checkClassConflict(candidate, existing, excludeId);
    }

    public ConflictResult checkTeacherConflict(SlotCandidate candidate, List<ScheduleSlot> existing, String excludeId) {
        if (candidate == null || existing == null || candidate.getTeacher() == null) {
            return ConflictResult.none();
        }
        for (ScheduleSlot slot : existing) {
            if (isComparable(slot, candidate, excludeId) && slot.isTaughtBy(candidate.getTeacher())) {
                return ConflictResult.teacher(slot);
            }
        }
        return ConflictResult.none();
    }

    public ConflictResult checkClassConflict(SlotCandidate candidate, List<ScheduleSlot> existing, String excludeId) {
        if (candidate == null || existing == null || candidate.getClassRoom() == null) {
            return ConflictResult.none();
        }
        for (ScheduleSlot slot : existing) {
            if (isComparable(slot, candidate, excludeId) && candidate.getClassRoom().equals(slot.getClassRoom())) {
                return ConflictResult.classRoom(slot);
            }
        }
        return ConflictResult.none();
    }

    private boolean isComparable(ScheduleSlot slot, SlotCandidate candidate, String excludeId) {
        if (slot == null) return false;
        if (excludeId != null && excludeId.equals(slot.getId())) return false;
        return slot.getDay() == candidate.getDay()
                && slot.getPeriod() == candidate.getPeriod()
                && sameAcademicYear(slot.getAcademicYear(), candidate.getAcademicYear());
    }

    // unset year is a wildcard, not a value of its own
    static boolean sameAcademicYear(String a, String b) {
        if (a == null || a.isBlank() || b == null || b.isBlank()) return true;
        return a.trim().equals(b.trim());
    }
}
