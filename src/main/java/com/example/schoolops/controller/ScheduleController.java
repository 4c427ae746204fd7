package com.example.schoolops.controller;

import com.example.schoolops.config.SchoolOpsProperties;
import com.example.schoolops.engine.ScheduleEditor;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.engine.model.ScheduleSlot;
import com.example.schoolops.engine.model.SlotDraft;
import com.example.schoolops.engine.model.SubstituteCandidate;
import com.example.schoolops.enums.SchoolDay;
import com.example.schoolops.service.ScheduleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Weekly schedule and substitute assignment.
 *
 * Slot body: {"day":"SUNDAY","period":3,"subject":"Math","classRoom":"4/A","teacher":"A","academicYear":"1446-1447"}
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/schedule")
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final SchoolOpsProperties properties;

    @GetMapping
    public ResponseEntity<?> list(@RequestParam(required = false) String academicYear,
                                  @RequestParam(required = false) String teacher) {
        List<ScheduleSlot> slots = (teacher == null || teacher.isBlank())
                ? scheduleService.listSchedule(academicYear)
                : scheduleService.scheduleForTeacher(teacher, academicYear);
        return ResponseEntity.ok(slots.stream().map(ApiResponses::slot).toList());
    }

    /**
     * Values the schedule editor offers: days, periods, class grades and known teachers.
     */
    @GetMapping("/options")
    public ResponseEntity<?> options() {
        Map<String, Object> m = new HashMap<>();
        m.put("academicYear", properties.getAcademicYear());
        m.put("days", Arrays.stream(SchoolDay.values()).map(Enum::name).toList());
        m.put("periods", ScheduleEditor.PERIODS_PER_DAY);
        m.put("classGrades", properties.getClassGrades());
        m.put("teachers", scheduleService.knownTeachers());
        return ResponseEntity.ok(m);
    }

    @PostMapping
    public ResponseEntity<?> add(@RequestBody Map<String, Object> payload) {
        Optional<SlotDraft> draft = parseDraft(payload);
        if (draft.isEmpty()) return ApiResponses.badRequest("invalid_slot");
        Outcome<ScheduleSlot> outcome = scheduleService.addSlot(draft.get());
        if (!outcome.isSuccess()) return ApiResponses.error(outcome.getError());
        return ResponseEntity.ok(Map.of("success", true, "slot", ApiResponses.slot(outcome.getValue())));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable String id, @RequestBody Map<String, Object> payload) {
        Optional<SlotDraft> draft = parseDraft(payload);
        if (draft.isEmpty()) return ApiResponses.badRequest("invalid_slot");
        Outcome<ScheduleSlot> outcome = scheduleService.updateSlot(id, draft.get());
        if (!outcome.isSuccess()) return ApiResponses.error(outcome.getError());
        return ResponseEntity.ok(Map.of("success", true, "slot", ApiResponses.slot(outcome.getValue())));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable String id) {
        Outcome<List<ScheduleSlot>> outcome = scheduleService.deleteSlot(id);
        if (!outcome.isSuccess()) return ApiResponses.error(outcome.getError());
        return ResponseEntity.ok(Map.of("success", true, "remaining", outcome.getValue().size()));
    }

    @GetMapping("/{id}/substitutes")
    public ResponseEntity<?> substitutes(@PathVariable String id) {
        Outcome<List<SubstituteCandidate>> outcome = scheduleService.substituteCandidates(id);
        if (!outcome.isSuccess()) return ApiResponses.error(outcome.getError());
        return ResponseEntity.ok(outcome.getValue().stream().map(ApiResponses::candidate).toList());
    }

    /**
     * Body: {"teacher": "C"}
     */
    @PostMapping("/{id}/substitute")
    public ResponseEntity<?> assignSubstitute(@PathVariable String id, @RequestBody Map<String, Object> payload) {
        Object teacher = payload.get("teacher");
        if (!(teacher instanceof String)) return ApiResponses.badRequest("invalid_teacher");
        Outcome<ScheduleSlot> outcome = scheduleService.assignSubstitute(id, (String) teacher);
        if (!outcome.isSuccess()) return ApiResponses.error(outcome.getError());
        return ResponseEntity.ok(Map.of("success", true, "slot", ApiResponses.slot(outcome.getValue())));
    }

    @DeleteMapping("/{id}/substitute")
    public ResponseEntity<?> removeSubstitute(@PathVariable String id) {
        Outcome<ScheduleSlot> outcome = scheduleService.removeSubstitute(id);
        if (!outcome.isSuccess()) return ApiResponses.error(outcome.getError());
        return ResponseEntity.ok(Map.of("success", true, "slot", ApiResponses.slot(outcome.getValue())));
    }

    // empty when day or period cannot be read; field presence is checked by the editor
    private Optional<SlotDraft> parseDraft(Map<String, Object> payload) {
        if (payload == null) return Optional.empty();
        Optional<SchoolDay> day = SchoolDay.fromCode(asString(payload.get("day")));
        if (day.isEmpty()) return Optional.empty();
        Object periodRaw = payload.get("period");
        Integer period;
        if (periodRaw instanceof Integer || periodRaw instanceof Long || periodRaw instanceof Short) {
            long whole = ((Number) periodRaw).longValue();
            if (whole < Integer.MIN_VALUE || whole > Integer.MAX_VALUE) return Optional.empty();
            period = (int) whole;
        } else if (periodRaw instanceof Number) {
            // fractional periods are not truncated
            double d = ((Number) periodRaw).doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d) || Math.abs(d) > Integer.MAX_VALUE) return Optional.empty();
            period = (int) d;
        } else if (periodRaw instanceof String) {
            try {
                period = Integer.parseInt(((String) periodRaw).trim());
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Optional.of(SlotDraft.builder()
                .day(day.get())
                .period(period)
                .subject(asString(payload.get("subject")))
                .classRoom(asString(payload.get("classRoom")))
                .teacher(asString(payload.get("teacher")))
                .academicYear(asString(payload.get("academicYear")))
                .build());
    }

    private String asString(Object o) {
        return o == null ? null : o.toString();
    }
}
