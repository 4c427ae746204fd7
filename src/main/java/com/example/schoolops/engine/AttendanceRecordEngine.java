package com.example.schoolops.engine;

import com.example.schoolops.engine.model.AttendanceRecord;
import com.example.schoolops.engine.model.EngineError;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.enums.AttendanceStatus;
import com.example.schoolops.enums.EvaluationLevel;
import com.example.schoolops.enums.RecordField;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Applies single-field edits to a student's daily record.
 *
 * <ul>
 *   <li>No record yet: the edit starts from {@link #defaultRecord} (present, all axes excellent).</li>
 *   <li>Attendance set to absent or excused: every evaluation axis becomes NONE.</li>
 *   <li>Attendance set to present: axes at NONE go back to EXCELLENT, rated axes stay as they are.</li>
 *   <li>Axis edits are stored whatever the attendance is; disabling those inputs is up to the client.</li>
 * </ul>
 * Records loaded from storage are never normalized, only edits are.
 */
public class AttendanceRecordEngine {

    public static String recordId(String studentId, LocalDate date) {
        return studentId + "_" + date;
    }

    public AttendanceRecord defaultRecord(String studentId, LocalDate date) {
        return AttendanceRecord.builder()
                .id(recordId(studentId, date))
                .studentId(studentId)
                .date(date)
                .attendance(AttendanceStatus.PRESENT)
                .participation(EvaluationLevel.EXCELLENT)
                .homework(EvaluationLevel.EXCELLENT)
                .behavior(EvaluationLevel.EXCELLENT)
                .notes("")
                .build();
    }

    /**
     * @param current the stored record for the student and date, or null if there is none
     * @param value   wire code of the new value ({@code "absent"}, {@code "good"}, ...) or free text for notes
     */
    public Outcome<AttendanceRecord> applyFieldEdit(AttendanceRecord current, String studentId, LocalDate date,
                                                    RecordField field, String value) {
        if (field == null) {
            return Outcome.failure(EngineError.invalidArgument("field is required"));
        }
        if (studentId == null || studentId.isBlank() || date == null) {
            return Outcome.failure(EngineError.invalidArgument("studentId and date are required"));
        }
        if (current != null && (!studentId.equals(current.getStudentId()) || !date.equals(current.getDate()))) {
            return Outcome.failure(EngineError.invalidArgument(
                    "record " + current.getId() + " does not belong to " + recordId(studentId, date)));
        }

        AttendanceRecord base = current != null ? current : defaultRecord(studentId, date);
        AttendanceRecord.AttendanceRecordBuilder next = base.toBuilder();

        switch (field) {
            case ATTENDANCE -> {
                Optional<AttendanceStatus> status = AttendanceStatus.fromCode(value);
                if (status.isEmpty()) {
                    return Outcome.failure(EngineError.invalidArgument("Unknown attendance value: " + value));
                }
                next.attendance(status.get());
                if (status.get().isAbsence()) {
                    next.participation(EvaluationLevel.NONE)
                            .homework(EvaluationLevel.NONE)
                            .behavior(EvaluationLevel.NONE);
                } else {
                    next.participation(resetIfUnrated(base.getParticipation()))
                            .homework(resetIfUnrated(base.getHomework()))
                            .behavior(resetIfUnrated(base.getBehavior()));
                }
            }
            case PARTICIPATION, HOMEWORK, BEHAVIOR -> {
                Optional<EvaluationLevel> level = EvaluationLevel.fromCode(value);
                if (level.isEmpty()) {
                    return Outcome.failure(EngineError.invalidArgument(
                            "Unknown " + field.getCode() + " value: " + value));
                }
                if (field == RecordField.PARTICIPATION) next.participation(level.get());
                else if (field == RecordField.HOMEWORK) next.homework(level.get());
                else next.behavior(level.get());
            }
            case NOTES -> next.notes(value == null ? "" : value);
        }

        return Outcome.success(next.build());
    }

    private EvaluationLevel resetIfUnrated(EvaluationLevel level) {
        return level == null || level == EvaluationLevel.NONE ? EvaluationLevel.EXCELLENT : level;
    }
}
