package com.example.schoolops.controller;

import com.example.schoolops.engine.model.AbsenceSummary;
import com.example.schoolops.engine.model.AttendanceRecord;
import com.example.schoolops.engine.model.EngineError;
import com.example.schoolops.engine.model.RosterStudent;
import com.example.schoolops.engine.model.ScheduleSlot;
import com.example.schoolops.engine.model.SubstituteCandidate;
import com.example.schoolops.entities.SubstitutionRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shapes shared by the API controllers. Enum values are written as lower-case codes.
 */
final class ApiResponses {

    private ApiResponses() {
    }

    static ResponseEntity<Map<String, Object>> error(EngineError error) {
        HttpStatus status = switch (error.getType()) {
            case CONFLICT, INVALID_STATE -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
        };
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("error", error.getType().name().toLowerCase());
        body.put("message", error.getMessage());
        if (error.getConflictKind() != null) {
            body.put("conflictKind", error.getConflictKind().name().toLowerCase());
            body.put("conflictingSlot", slot(error.getConflictingSlot()));
        }
        return ResponseEntity.status(status).body(body);
    }

    static ResponseEntity<Map<String, Object>> badRequest(String code) {
        return ResponseEntity.badRequest().body(Map.of("success", false, "error", code));
    }

    static Map<String, Object> slot(ScheduleSlot s) {
        if (s == null) return null;
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", s.getId());
        m.put("day", s.getDay() == null ? null : s.getDay().name());
        m.put("period", s.getPeriod());
        m.put("subject", s.getSubject());
        m.put("classRoom", s.getClassRoom());
        m.put("teacher", s.getTeacher());
        m.put("originalTeacher", s.getOriginalTeacher());
        m.put("isSubstituted", s.isSubstituted());
        m.put("academicYear", s.getAcademicYear());
        m.put("createdAt", s.getCreatedAt() == null ? null : s.getCreatedAt().toString());
        return m;
    }

    static Map<String, Object> record(AttendanceRecord r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", r.getId());
        m.put("studentId", r.getStudentId());
        m.put("date", r.getDate() == null ? null : r.getDate().toString());
        m.put("attendance", r.getAttendance() == null ? null : r.getAttendance().getCode());
        m.put("participation", r.getParticipation() == null ? null : r.getParticipation().getCode());
        m.put("homework", r.getHomework() == null ? null : r.getHomework().getCode());
        m.put("behavior", r.getBehavior() == null ? null : r.getBehavior().getCode());
        m.put("notes", r.getNotes());
        return m;
    }

    static Map<String, Object> student(RosterStudent s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", s.getId());
        m.put("name", s.getName());
        m.put("classGrade", s.getClassGrade());
        m.put("studentNumber", s.getStudentNumber());
        return m;
    }

    static Map<String, Object> candidate(SubstituteCandidate c) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("teacher", c.getTeacher());
        m.put("available", c.isAvailable());
        m.put("conflictingSlot", slot(c.getConflictingSlot()));
        return m;
    }

    static Map<String, Object> absence(AbsenceSummary a) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("student", student(a.getStudent()));
        m.put("absenceDays", a.getAbsenceDays());
        m.put("consecutiveDays", a.getConsecutiveDays());
        m.put("lastAbsenceDate", a.getLastAbsenceDate() == null ? null : a.getLastAbsenceDate().toString());
        m.put("excused", a.isExcused());
        m.put("records", a.getRecords().stream().map(ApiResponses::record).toList());
        return m;
    }

    static Map<String, Object> request(SubstitutionRequest r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", r.getId());
        m.put("date", r.getRequestDate() == null ? null : r.getRequestDate().toString());
        m.put("scheduleItemId", r.getScheduleItemId());
        m.put("substituteTeacher", r.getSubstituteTeacher());
        m.put("status", r.getStatus() == null ? null : r.getStatus().name().toLowerCase());
        m.put("rejectionReason", r.getRejectionReason());
        m.put("requestedAt", r.getRequestedAt() == null ? null : r.getRequestedAt().toString());
        m.put("respondedAt", r.getRespondedAt() == null ? null : r.getRespondedAt().toString());
        m.put("requestedBy", r.getRequestedBy());
        return m;
    }
}
