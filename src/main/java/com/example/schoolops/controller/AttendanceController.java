package com.example.schoolops.controller;

import com.example.schoolops.engine.model.AttendanceRecord;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.enums.RecordField;
import com.example.schoolops.service.AttendanceService;
import com.example.schoolops.service.RecordEdit;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Daily records: one record per student per date with attendance and three evaluation axes.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/records")
public class AttendanceController {

    private final AttendanceService attendanceService;

    @Value("${schoolops.attendance.min-date:2024-09-01}")
    private String minDateStr;

    @GetMapping
    public ResponseEntity<?> records(@RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        if (date == null) date = LocalDate.now();
        return ResponseEntity.ok(attendanceService.recordsForDate(date).stream().map(ApiResponses::record).toList());
    }

    /**
     * Body: {"studentId":"s1", "date":"YYYY-MM-DD", "field":"attendance", "value":"absent"}
     */
    @PostMapping("/edit")
    public ResponseEntity<?> edit(@RequestBody Map<String, Object> payload) {
        LocalDate date;
        try {
            date = parseDate(payload.get("date"));
        } catch (DateTimeParseException ex) {
            return ApiResponses.badRequest("invalid_date");
        }
        ResponseEntity<Map<String, Object>> tooEarly = checkMinDate(date);
        if (tooEarly != null) return tooEarly;

        Object studentId = payload.get("studentId");
        if (studentId == null) return ApiResponses.badRequest("missing_studentId");
        Optional<RecordField> field = RecordField.fromCode(asString(payload.get("field")));
        if (field.isEmpty()) return ApiResponses.badRequest("invalid_field");

        Outcome<AttendanceRecord> outcome = attendanceService.editField(studentId.toString(), date, field.get(),
                asString(payload.get("value")));
        if (!outcome.isSuccess()) return ApiResponses.error(outcome.getError());
        return ResponseEntity.ok(Map.of("success", true, "record", ApiResponses.record(outcome.getValue())));
    }

    /**
     * Save several field edits for one date.
     * {
     *   "date":"YYYY-MM-DD",
     *   "items":[ {"studentId":"s1", "field":"attendance", "value":"absent"}, ... ]
     * }
     * Nothing is saved if any item is rejected.
     */
    @PostMapping("/save_batch")
    public ResponseEntity<?> saveBatch(@RequestBody Map<String, Object> payload) {
        LocalDate date;
        try {
            date = parseDate(payload.get("date"));
        } catch (DateTimeParseException ex) {
            return ApiResponses.badRequest("invalid_date");
        }
        ResponseEntity<Map<String, Object>> tooEarly = checkMinDate(date);
        if (tooEarly != null) return tooEarly;

        Object rawItems = payload.get("items");
        List<?> items = rawItems instanceof List ? (List<?>) rawItems : Collections.emptyList();

        List<RecordEdit> edits = new ArrayList<>();
        for (Object rawItem : items) {
            if (!(rawItem instanceof Map)) return ApiResponses.badRequest("invalid_body");
            Map<?, ?> it = (Map<?, ?>) rawItem;
            Object sid = it.get("studentId");
            if (sid == null) return ApiResponses.badRequest("missing_studentId");
            Optional<RecordField> field = RecordField.fromCode(asString(it.get("field")));
            if (field.isEmpty()) return ApiResponses.badRequest("invalid_field");
            edits.add(new RecordEdit(sid.toString(), field.get(), asString(it.get("value"))));
        }

        Outcome<List<AttendanceRecord>> outcome = attendanceService.applyEdits(date, edits);
        if (!outcome.isSuccess()) return ApiResponses.error(outcome.getError());
        return ResponseEntity.ok(Map.of("success", true,
                "saved", outcome.getValue().size(),
                "records", outcome.getValue().stream().map(ApiResponses::record).toList()));
    }

    private ResponseEntity<Map<String, Object>> checkMinDate(LocalDate date) {
        LocalDate minDate = LocalDate.parse(minDateStr);
        if (date.isBefore(minDate)) {
            return ResponseEntity.badRequest().body(Map.of("success", false, "error", "date_too_early", "minDate", minDate.toString()));
        }
        return null;
    }

    private LocalDate parseDate(Object raw) {
        return raw == null ? LocalDate.now() : LocalDate.parse(raw.toString());
    }

    private String asString(Object o) {
        return o == null ? null : o.toString();
    }
}
