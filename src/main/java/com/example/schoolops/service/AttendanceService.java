package com.example.schoolops.service;

import com.example.schoolops.engine.AttendanceRecordEngine;
import com.example.schoolops.engine.model.AttendanceRecord;
import com.example.schoolops.engine.model.EngineError;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.enums.RecordField;
import com.example.schoolops.store.AttendanceStore;
import com.example.schoolops.store.StudentDirectory;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily attendance and evaluation records.
 *
 * Edits are applied one field at a time through {@link AttendanceRecordEngine}; the resulting
 * record is what gets stored. Edits to the same student are applied in request order.
 */
@Service
@RequiredArgsConstructor
public class AttendanceService {

    private final Logger log = LoggerFactory.getLogger(AttendanceService.class);

    private final AttendanceStore attendanceStore;
    private final StudentDirectory studentDirectory;
    private final AttendanceRecordEngine recordEngine;

    public List<AttendanceRecord> recordsForDate(LocalDate date) {
        if (date == null) return List.of();
        return attendanceStore.listAttendanceRecords(date);
    }

    @Transactional
    public Outcome<AttendanceRecord> editField(String studentId, LocalDate date, RecordField field, String value) {
        if (studentDirectory.findStudent(studentId).isEmpty()) {
            log.warn("editField: student not found id={}", studentId);
            return Outcome.failure(EngineError.notFound("Student not found: " + studentId));
        }
        AttendanceRecord current = attendanceStore.findRecord(studentId, date).orElse(null);
        Outcome<AttendanceRecord> outcome = recordEngine.applyFieldEdit(current, studentId, date, field, value);
        if (!outcome.isSuccess()) {
            log.warn("editField rejected for student={} date={}: {}", studentId, date, outcome.getError().getMessage());
            return outcome;
        }
        attendanceStore.upsertAttendanceRecords(List.of(outcome.getValue()));
        log.info("Saved record {} ({}={})", outcome.getValue().getId(), field.getCode(), value);
        return outcome;
    }

    /**
     * Applies every edit for {@code date} in order and stores the touched records together.
     * Nothing is stored if any edit is rejected.
     */
    @Transactional
    public Outcome<List<AttendanceRecord>> applyEdits(LocalDate date, List<RecordEdit> edits) {
        if (date == null) {
            return Outcome.failure(EngineError.invalidArgument("date is required"));
        }
        if (edits == null || edits.isEmpty()) {
            return Outcome.success(List.of());
        }

        Map<String, AttendanceRecord> working = new LinkedHashMap<>();
        for (RecordEdit edit : edits) {
            String sid = edit.getStudentId();
            if (!working.containsKey(sid)) {
                if (studentDirectory.findStudent(sid).isEmpty()) {
                    log.warn("applyEdits: student not found id={}", sid);
                    return Outcome.failure(EngineError.notFound("Student not found: " + sid));
                }
                working.put(sid, attendanceStore.findRecord(sid, date).orElse(null));
            }
            Outcome<AttendanceRecord> step = recordEngine.applyFieldEdit(working.get(sid), sid, date, edit.getField(), edit.getValue());
            if (!step.isSuccess()) {
                log.warn("applyEdits rejected for student={} date={}: {}", sid, date, step.getError().getMessage());
                return Outcome.failure(step.getError());
            }
            working.put(sid, step.getValue());
        }

        List<AttendanceRecord> saved = new ArrayList<>(working.values());
        attendanceStore.upsertAttendanceRecords(saved);
        log.info("Saved {} records for {} from {} edits", saved.size(), date, edits.size());
        return Outcome.success(List.copyOf(saved));
    }
}
