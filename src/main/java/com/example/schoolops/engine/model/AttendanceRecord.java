package com.example.schoolops.engine.model;

import com.example.schoolops.enums.AttendanceStatus;
import com.example.schoolops.enums.EvaluationLevel;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Daily attendance and evaluation of one student. Identified by {@code studentId_date}.
 */
@Value
@Builder(toBuilder = true)
public class AttendanceRecord {

    String id;
    String studentId;
    LocalDate date;
    AttendanceStatus attendance;
    EvaluationLevel participation;
    EvaluationLevel homework;
    EvaluationLevel behavior;
    String notes;
}
