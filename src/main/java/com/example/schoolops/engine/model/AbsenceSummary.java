package com.example.schoolops.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Absences of one student inside a report range.
 */
@Value
@Builder
public class AbsenceSummary {

    RosterStudent student;
    int absenceDays;
    int consecutiveDays;
    LocalDate lastAbsenceDate;
    boolean excused;
    List<AttendanceRecord> records;
}
