package com.example.schoolops.engine;

import com.example.schoolops.engine.model.ConflictKind;
import com.example.schoolops.engine.model.ConflictResult;
import com.example.schoolops.engine.model.ScheduleSlot;
import com.example.schoolops.engine.model.SlotCandidate;
import com.example.schoolops.enums.SchoolDay;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConflictCheckerTest {

    private final ConflictChecker checker = new ConflictChecker();

    private static ScheduleSlot slot(String id, SchoolDay day, int period, String classRoom, String teacher, String year) {
        return ScheduleSlot.builder().id(id).day(day).period(period).subject("Math")
                .classRoom(classRoom).teacher(teacher).academicYear(year).build();
    }

    private static SlotCandidate candidate(SchoolDay day, int period, String classRoom, String teacher, String year) {
        return SlotCandidate.builder().day(day).period(period).classRoom(classRoom).teacher(teacher).academicYear(year).build();
    }

    @Test
    void teacherConflictIsReportedBeforeClassConflict() {
        ScheduleSlot existing = slot("1", SchoolDay.SUNDAY, 1, "4/A", "A", "2024");

        ConflictResult result = checker.checkConflict(candidate(SchoolDay.SUNDAY, 1, "4/A", "A", "2024"), List.of(existing), null);

        assertEquals(ConflictKind.TEACHER, result.getKind());
        assertSame(existing, result.getConflictingSlot());
    }

    @Test
    void classConflictWhenSameRoomDifferentTeacher() {
        ScheduleSlot existing = slot("1", SchoolDay.SUNDAY, 1, "4/A", "A", "2024");

        ConflictResult result = checker.checkConflict(candidate(SchoolDay.SUNDAY, 1, "4/A", "B", "2024"), List.of(existing), null);

        assertEquals(ConflictKind.CLASS, result.getKind());
    }

    @Test
    void differentPeriodOrDayIsNotAConflict() {
        List<ScheduleSlot> existing = List.of(slot("1", SchoolDay.SUNDAY, 1, "4/A", "A", "2024"));

        assertFalse(checker.checkConflict(candidate(SchoolDay.SUNDAY, 2, "4/A", "A", "2024"), existing, null).isConflict());
        assertFalse(checker.checkConflict(candidate(SchoolDay.MONDAY, 1, "4/A", "A", "2024"), existing, null).isConflict());
    }

    @Test
    void originalTeacherOfSubstitutedSlotStillCountsAsBusy() {
        ScheduleSlot substituted = slot("1", SchoolDay.SUNDAY, 3, "4/A", "C", "2024").toBuilder().originalTeacher("A").build();

        ConflictResult result = checker.checkTeacherConflict(candidate(SchoolDay.SUNDAY, 3, "5/B", "A", "2024"), List.of(substituted), null);

        assertTrue(result.isConflict());
        assertEquals(ConflictKind.TEACHER, result.getKind());
    }

    @Test
    void excludedSlotIsIgnored() {
        List<ScheduleSlot> existing = List.of(slot("1", SchoolDay.SUNDAY, 1, "4/A", "A", "2024"));

        assertFalse(checker.checkConflict(candidate(SchoolDay.SUNDAY, 1, "4/A", "A", "2024"), existing, "1").isConflict());
    }

    @Test
    void differentAcademicYearsDoNotConflict() {
        List<ScheduleSlot> existing = List.of(slot("1", SchoolDay.SUNDAY, 1, "4/A", "A", "2023"));

        assertFalse(checker.checkConflict(candidate(SchoolDay.SUNDAY, 1, "4/A", "A", "2024"), existing, null).isConflict());
    }

    @Test
    void missingAcademicYearMatchesAnyYear() {
        List<ScheduleSlot> existing = List.of(slot("1", SchoolDay.SUNDAY, 1, "4/A", "A", null));

        assertTrue(checker.checkConflict(candidate(SchoolDay.SUNDAY, 1, "5/B", "A", "2024"), existing, null).isConflict());
        assertTrue(ConflictChecker.sameAcademicYear(" 2024 ", "2024"));
        assertTrue(ConflictChecker.sameAcademicYear("", "2024"));
    }

    @Test
    void classRoomComparisonIsExact() {
        List<ScheduleSlot> existing = List.of(slot("1", SchoolDay.SUNDAY, 1, "4/A", "A", "2024"));

        assertFalse(checker.checkClassConflict(candidate(SchoolDay.SUNDAY, 1, "4", "B", "2024"), existing, null).isConflict());
    }

    @Test
    void nullInputsAreNoConflict() {
        ConflictResult result = checker.checkConflict(null, null, null);

        assertFalse(result.isConflict());
        assertNull(result.getConflictingSlot());
        assertFalse(checker.checkConflict(candidate(SchoolDay.SUNDAY, 1, "4/A", "A", "2024"), null, null).isConflict());
    }
}
