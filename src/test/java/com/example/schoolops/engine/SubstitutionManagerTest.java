package com.example.schoolops.engine;

import com.example.schoolops.engine.model.ConflictKind;
import com.example.schoolops.engine.model.ErrorType;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.engine.model.ScheduleSlot;
import com.example.schoolops.engine.model.SubstituteCandidate;
import com.example.schoolops.enums.SchoolDay;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubstitutionManagerTest {

    private final SubstitutionManager manager = new SubstitutionManager(new ConflictChecker());

    private List<ScheduleSlot> schedule;

    private static ScheduleSlot slot(String id, SchoolDay day, int period, String classRoom, String teacher) {
        return ScheduleSlot.builder().id(id).day(day).period(period).subject("Math")
                .classRoom(classRoom).teacher(teacher).academicYear("1446-1447").build();
    }

    // Sunday period 3: A teaches 4/A, B teaches 5/B; C is free
    @BeforeEach
    void setUp() {
        schedule = List.of(
                slot("a3", SchoolDay.SUNDAY, 3, "4/A", "A"),
                slot("b3", SchoolDay.SUNDAY, 3, "5/B", "B"),
                slot("c4", SchoolDay.SUNDAY, 4, "6/C", "C"));
    }

    private static ScheduleSlot find(List<ScheduleSlot> slots, String id) {
        return slots.stream().filter(s -> s.getId().equals(id)).findFirst().orElseThrow();
    }

    @Test
    void assignFreeTeacherMovesRegularTeacherToOriginal() {
        Outcome<List<ScheduleSlot>> outcome = manager.assignSubstitute(schedule, "a3", "C");

        assertTrue(outcome.isSuccess());
        ScheduleSlot updated = find(outcome.getValue(), "a3");
        assertEquals("C", updated.getTeacher());
        assertEquals("A", updated.getOriginalTeacher());
        assertTrue(updated.isSubstituted());
    }

    @Test
    void assignBusyTeacherIsTeacherConflict() {
        Outcome<List<ScheduleSlot>> outcome = manager.assignSubstitute(schedule, "a3", "B");

        assertFalse(outcome.isSuccess());
        assertEquals(ErrorType.CONFLICT, outcome.getError().getType());
        assertEquals(ConflictKind.TEACHER, outcome.getError().getConflictKind());
        assertEquals("b3", outcome.getError().getConflictingSlot().getId());
    }

    @Test
    void chainedSubstitutionKeepsFirstOriginalTeacher() {
        List<ScheduleSlot> once = manager.assignSubstitute(schedule, "a3", "C").getValue();

        List<ScheduleSlot> twice = manager.assignSubstitute(once, "a3", "D").getValue();

        ScheduleSlot updated = find(twice, "a3");
        assertEquals("D", updated.getTeacher());
        assertEquals("A", updated.getOriginalTeacher());
    }

    @Test
    void regularTeacherOrCurrentSubstituteIsRejected() {
        assertEquals(ErrorType.INVALID_ARGUMENT, manager.assignSubstitute(schedule, "a3", " A ").getError().getType());

        List<ScheduleSlot> substituted = manager.assignSubstitute(schedule, "a3", "C").getValue();
        assertEquals(ErrorType.INVALID_ARGUMENT, manager.assignSubstitute(substituted, "a3", "C").getError().getType());
        assertEquals(ErrorType.INVALID_ARGUMENT, manager.assignSubstitute(substituted, "a3", "A").getError().getType());
    }

    @Test
    void blankTeacherOrUnknownSlotIsRejected() {
        assertEquals(ErrorType.INVALID_ARGUMENT, manager.assignSubstitute(schedule, "a3", "  ").getError().getType());
        assertEquals(ErrorType.NOT_FOUND, manager.assignSubstitute(schedule, "zz", "C").getError().getType());
    }

    @Test
    void removeRestoresRegularTeacher() {
        List<ScheduleSlot> substituted = manager.assignSubstitute(schedule, "a3", "C").getValue();

        List<ScheduleSlot> restored = manager.removeSubstitute(substituted, "a3").getValue();

        assertEquals(schedule, restored);
        ScheduleSlot slot = find(restored, "a3");
        assertEquals("A", slot.getTeacher());
        assertNull(slot.getOriginalTeacher());
    }

    @Test
    void removeWithoutSubstitutionIsInvalidState() {
        Outcome<List<ScheduleSlot>> outcome = manager.removeSubstitute(schedule, "a3");

        assertEquals(ErrorType.INVALID_STATE, outcome.getError().getType());
    }

    @Test
    void rankCandidatesListsFreeTeachersFirst() {
        List<SubstituteCandidate> ranked = manager.rankCandidates(schedule, "a3", List.of("B", "A", "C", " C ", "D")).getValue();

        assertEquals(List.of("C", "D", "B"), ranked.stream().map(SubstituteCandidate::getTeacher).toList());
        assertTrue(ranked.get(0).isAvailable());
        assertFalse(ranked.get(2).isAvailable());
        assertEquals("b3", ranked.get(2).getConflictingSlot().getId());
    }

    @Test
    void rankCandidatesSkipsCurrentSubstitute() {
        List<ScheduleSlot> substituted = manager.assignSubstitute(schedule, "a3", "C").getValue();

        List<SubstituteCandidate> ranked = manager.rankCandidates(substituted, "a3", List.of("A", "C", "D")).getValue();

        assertEquals(List.of("D"), ranked.stream().map(SubstituteCandidate::getTeacher).toList());
    }
}
