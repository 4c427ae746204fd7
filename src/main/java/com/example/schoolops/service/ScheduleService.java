package com.example.schoolops.service;

import com.example.schoolops.config.SchoolOpsProperties;
import com.example.schoolops.engine.ScheduleEditor;
import com.example.schoolops.engine.SubstitutionManager;
import com.example.schoolops.engine.model.EngineError;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.engine.model.ScheduleSlot;
import com.example.schoolops.engine.model.SlotDraft;
import com.example.schoolops.engine.model.SubstituteCandidate;
import com.example.schoolops.store.ScheduleStore;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Schedule administration: slot edits and substitutions.
 *
 * Each write loads the full schedule, lets the engine compute the next version and stores it
 * with a whole-collection replace. Conflict checks always run against every academic year;
 * the checker itself decides which years overlap.
 */
@Service
@RequiredArgsConstructor
public class ScheduleService {

    private final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleStore scheduleStore;
    private final ScheduleEditor scheduleEditor;
    private final SubstitutionManager substitutionManager;
    private final SchoolOpsProperties properties;

    public List<ScheduleSlot> listSchedule(String academicYear) {
        return scheduleStore.listSchedule(academicYear);
    }

    /**
     * Slots a teacher currently holds or regularly holds (while substituted away).
     */
    public List<ScheduleSlot> scheduleForTeacher(String teacher, String academicYear) {
        String name = ScheduleEditor.normalizeTeacher(teacher);
        if (name == null || name.isEmpty()) return List.of();
        return scheduleStore.listSchedule(academicYear).stream()
                .filter(s -> s.isTaughtBy(name))
                .toList();
    }

    public Optional<ScheduleSlot> findSlot(String slotId) {
        if (slotId == null) return Optional.empty();
        return scheduleStore.listSchedule(null).stream()
                .filter(s -> slotId.equals(s.getId()))
                .findFirst();
    }

    /**
     * Configured teachers plus everyone appearing on the schedule, sorted by name.
     */
    public List<String> knownTeachers() {
        TreeSet<String> names = new TreeSet<>();
        for (String t : properties.getTeachers()) {
            String n = ScheduleEditor.normalizeTeacher(t);
            if (n != null && !n.isEmpty()) names.add(n);
        }
        for (ScheduleSlot s : scheduleStore.listSchedule(null)) {
            if (s.getTeacher() != null && !s.getTeacher().isBlank()) names.add(s.getTeacher());
            if (s.getOriginalTeacher() != null && !s.getOriginalTeacher().isBlank()) names.add(s.getOriginalTeacher());
        }
        return new ArrayList<>(names);
    }

    @Transactional
    public Outcome<ScheduleSlot> addSlot(SlotDraft draft) {
        SlotDraft effective = withDefaultYear(draft);
        String id = UUID.randomUUID().toString();
        Outcome<List<ScheduleSlot>> outcome = scheduleEditor.addSlot(scheduleStore.listSchedule(null), effective, id);
        if (!outcome.isSuccess()) {
            logRejected("addSlot", null, outcome.getError());
            return Outcome.failure(outcome.getError());
        }
        scheduleStore.replaceSchedule(outcome.getValue());
        ScheduleSlot added = slotById(outcome.getValue(), id);
        log.info("Added slot id={} {} period {} {} / {} teacher={}", id, added.getDay(), added.getPeriod(),
                added.getSubject(), added.getClassRoom(), added.getTeacher());
        return Outcome.success(added);
    }

    @Transactional
    public Outcome<ScheduleSlot> updateSlot(String slotId, SlotDraft draft) {
        Outcome<List<ScheduleSlot>> outcome = scheduleEditor.updateSlot(scheduleStore.listSchedule(null), slotId, withDefaultYear(draft));
        if (!outcome.isSuccess()) {
            logRejected("updateSlot", slotId, outcome.getError());
            return Outcome.failure(outcome.getError());
        }
        scheduleStore.replaceSchedule(outcome.getValue());
        log.info("Updated slot id={}", slotId);
        return Outcome.success(slotById(outcome.getValue(), slotId));
    }

    @Transactional
    public Outcome<List<ScheduleSlot>> deleteSlot(String slotId) {
        Outcome<List<ScheduleSlot>> outcome = scheduleEditor.deleteSlot(scheduleStore.listSchedule(null), slotId);
        if (!outcome.isSuccess()) {
            logRejected("deleteSlot", slotId, outcome.getError());
            return outcome;
        }
        scheduleStore.replaceSchedule(outcome.getValue());
        log.info("Deleted slot id={}", slotId);
        return outcome;
    }

    public Outcome<List<SubstituteCandidate>> substituteCandidates(String slotId) {
        return substitutionManager.rankCandidates(scheduleStore.listSchedule(null), slotId, knownTeachers());
    }

    @Transactional
    public Outcome<ScheduleSlot> assignSubstitute(String slotId, String teacher) {
        Outcome<List<ScheduleSlot>> outcome = substitutionManager.assignSubstitute(scheduleStore.listSchedule(null), slotId, teacher);
        if (!outcome.isSuccess()) {
            logRejected("assignSubstitute", slotId, outcome.getError());
            return Outcome.failure(outcome.getError());
        }
        scheduleStore.replaceSchedule(outcome.getValue());
        ScheduleSlot slot = slotById(outcome.getValue(), slotId);
        log.info("Assigned substitute {} to slot id={} (regular teacher {})", slot.getTeacher(), slotId, slot.getOriginalTeacher());
        return Outcome.success(slot);
    }

    @Transactional
    public Outcome<ScheduleSlot> removeSubstitute(String slotId) {
        Outcome<List<ScheduleSlot>> outcome = substitutionManager.removeSubstitute(scheduleStore.listSchedule(null), slotId);
        if (!outcome.isSuccess()) {
            logRejected("removeSubstitute", slotId, outcome.getError());
            return Outcome.failure(outcome.getError());
        }
        scheduleStore.replaceSchedule(outcome.getValue());
        ScheduleSlot slot = slotById(outcome.getValue(), slotId);
        log.info("Removed substitution from slot id={}, teacher restored to {}", slotId, slot.getTeacher());
        return Outcome.success(slot);
    }

    private SlotDraft withDefaultYear(SlotDraft draft) {
        if (draft == null || (draft.getAcademicYear() != null && !draft.getAcademicYear().isBlank())) {
            return draft;
        }
        return SlotDraft.builder()
                .day(draft.getDay())
                .period(draft.getPeriod())
                .subject(draft.getSubject())
                .classRoom(draft.getClassRoom())
                .teacher(draft.getTeacher())
                .academicYear(properties.getAcademicYear())
                .build();
    }

    private ScheduleSlot slotById(List<ScheduleSlot> schedule, String slotId) {
        return schedule.stream()
                .filter(s -> slotId.equals(s.getId()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Slot vanished from computed schedule: " + slotId));
    }

    private void logRejected(String operation, String slotId, EngineError error) {
        log.warn("{} rejected for slot id={}: {} {}", operation, slotId, error.getType(), error.getMessage());
    }
}
