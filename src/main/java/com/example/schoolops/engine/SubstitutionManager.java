package com.example.schoolops.engine;

import com.example.schoolops.engine.model.ConflictResult;
import com.example.schoolops.engine.model.EngineError;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.engine.model.ScheduleSlot;
import com.example.schoolops.engine.model.SlotCandidate;
import com.example.schoolops.engine.model.SubstituteCandidate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Substitute-teacher assignment for schedule slots.
 *
 * A slot is either regular ({@code originalTeacher == null}) or substituted. The first
 * substitution moves the regular teacher into {@code originalTeacher}; later substitutions
 * only replace {@code teacher}, so removal always restores the regular teacher.
 */
public class SubstitutionManager {

    private final ConflictChecker conflictChecker;

    public SubstitutionManager(ConflictChecker conflictChecker) {
        this.conflictChecker = conflictChecker;
    }

    public Outcome<List<ScheduleSlot>> assignSubstitute(List<ScheduleSlot> schedule, String slotId, String candidateTeacher) {
        List<ScheduleSlot> current = schedule == null ? List.of() : schedule;
        ScheduleSlot slot = ScheduleEditor.find(current, slotId);
        if (slot == null) {
            return Outcome.failure(EngineError.notFound(ScheduleMessages.slotNotFound(slotId)));
        }
        String candidate = ScheduleEditor.normalizeTeacher(candidateTeacher);
        if (candidate == null || candidate.isEmpty()) {
            return Outcome.failure(EngineError.invalidArgument("substitute teacher is required"));
        }
        if (candidate.equals(slot.getRegularTeacher())) {
            return Outcome.failure(EngineError.invalidArgument(
                    "\"" + candidate + "\" is the regular teacher of this slot"));
        }
        if (slot.isSubstituted() && candidate.equals(slot.getTeacher())) {
            return Outcome.failure(EngineError.invalidArgument(
                    "\"" + candidate + "\" is already substituting on this slot"));
        }

        ConflictResult conflict = conflictChecker.checkTeacherConflict(candidateFor(slot, candidate), current, slotId);
        if (conflict.isConflict()) {
            return Outcome.failure(EngineError.conflict(conflict,
                    ScheduleMessages.conflict(conflict, candidate, slot.getClassRoom())));
        }

        ScheduleSlot substituted = slot.toBuilder()
                .originalTeacher(slot.getRegularTeacher())
                .teacher(candidate)
                .build();
        return Outcome.success(replace(current, substituted));
    }

    public Outcome<List<ScheduleSlot>> removeSubstitute(List<ScheduleSlot> schedule, String slotId) {
        List<ScheduleSlot> current = schedule == null ? List.of() : schedule;
        ScheduleSlot slot = ScheduleEditor.find(current, slotId);
        if (slot == null) {
            return Outcome.failure(EngineError.notFound(ScheduleMessages.slotNotFound(slotId)));
        }
        if (slot.getOriginalTeacher() == null) {
            return Outcome.failure(EngineError.invalidState("Slot " + slotId + " has no active substitution"));
        }
        ScheduleSlot restored = slot.toBuilder()
                .teacher(slot.getOriginalTeacher())
                .originalTeacher(null)
                .build();
        return Outcome.success(replace(current, restored));
    }

    /**
     * Orders possible substitutes for a slot: teachers free at the slot's day/period first,
     * then busy ones with the slot that keeps them busy. Input order is kept inside each group.
     * The slot's regular teacher and current substitute are never offered.
     */
    public Outcome<List<SubstituteCandidate>> rankCandidates(List<ScheduleSlot> schedule, String slotId, List<String> teachers) {
        List<ScheduleSlot> current = schedule == null ? List.of() : schedule;
        ScheduleSlot slot = ScheduleEditor.find(current, slotId);
        if (slot == null) {
            return Outcome.failure(EngineError.notFound(ScheduleMessages.slotNotFound(slotId)));
        }

        Set<String> names = new LinkedHashSet<>();
        if (teachers != null) {
            for (String t : teachers) {
                String n = ScheduleEditor.normalizeTeacher(t);
                if (n == null || n.isEmpty()) continue;
                if (n.equals(slot.getRegularTeacher())) continue;
                if (slot.isSubstituted() && n.equals(slot.getTeacher())) continue;
                names.add(n);
            }
        }

        List<SubstituteCandidate> free = new ArrayList<>();
        List<SubstituteCandidate> busy = new ArrayList<>();
        for (String name : names) {
            ConflictResult conflict = conflictChecker.checkTeacherConflict(candidateFor(slot, name), current, slotId);
            if (conflict.isConflict()) {
                busy.add(new SubstituteCandidate(name, conflict.getConflictingSlot()));
            } else {
                free.add(new SubstituteCandidate(name, null));
            }
        }
        free.addAll(busy);
        return Outcome.success(List.copyOf(free));
    }

    private SlotCandidate candidateFor(ScheduleSlot slot, String teacher) {
        return SlotCandidate.of(slot).toBuilder().teacher(teacher).build();
    }

    private List<ScheduleSlot> replace(List<ScheduleSlot> schedule, ScheduleSlot replacement) {
        List<ScheduleSlot> updated = new ArrayList<>(schedule.size());
        for (ScheduleSlot s : schedule) {
            updated.add(replacement.getId().equals(s.getId()) ? replacement : s);
        }
        return List.copyOf(updated);
    }
}
