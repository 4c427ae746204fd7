package com.example.schoolops.engine.model;

import com.example.schoolops.enums.SchoolDay;
import lombok.Builder;
import lombok.Value;

/**
 * The booking a caller wants to make: who teaches which classroom at which day/period.
 */
@Value
@Builder(toBuilder = true)
public class SlotCandidate {

    SchoolDay day;
    int period;
    String teacher;
    String classRoom;
    String academicYear;

    public static SlotCandidate of(ScheduleSlot slot) {
        return SlotCandidate.builder()
                .day(slot.getDay())
                .period(slot.getPeriod())
                .teacher(slot.getTeacher())
                .classRoom(slot.getClassRoom())
                .academicYear(slot.getAcademicYear())
                .build();
    }
}
