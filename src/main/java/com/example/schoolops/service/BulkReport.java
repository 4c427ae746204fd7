package com.example.schoolops.service;

import com.example.schoolops.engine.model.AttendanceRecord;
import com.example.schoolops.engine.model.RosterStudent;
import com.example.schoolops.engine.model.ScheduleSlot;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * What an administrator sees before sending a session's daily reports.
 * {@code enabled} is false until every roster student has a record for the date.
 */
@Value
@Builder
public class BulkReport {

    ScheduleSlot slot;
    LocalDate date;
    boolean enabled;
    List<RosterStudent> students;
    List<AttendanceRecord> records;
    List<String> missingStudentIds;
}
