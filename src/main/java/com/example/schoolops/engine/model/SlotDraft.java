package com.example.schoolops.engine.model;

import com.example.schoolops.enums.SchoolDay;
import lombok.Builder;
import lombok.Value;

/**
 * Raw slot fields as entered by an administrator, before normalization.
 */
@Value
@Builder
public class SlotDraft {

    SchoolDay day;
    Integer period;
    String subject;
    String classRoom;
    String teacher;
    String academicYear;
}
