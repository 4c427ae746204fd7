package com.example.schoolops.engine.model;

import com.example.schoolops.enums.SchoolDay;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One weekly teaching session. Immutable; edits produce a new instance via {@code toBuilder()}.
 *
 * {@code originalTeacher} is set only while a substitution is active and always holds the
 * slot's regular teacher, however many substitutions were chained on top of it.
 */
@Value
@Builder(toBuilder = true)
public class ScheduleSlot {

    String id;
    SchoolDay day;
    int period;
    String subject;
    String classRoom;
    String teacher;
    String originalTeacher;
    String academicYear;
    Instant createdAt;

    public boolean isSubstituted() {
        return originalTeacher != null && !originalTeacher.equals(teacher);
    }

    /**
     * The slot's regular teacher: the original one during a substitution, the current one otherwise.
     */
    public String getRegularTeacher() {
        return originalTeacher != null ? originalTeacher : teacher;
    }

    public boolean isTaughtBy(String name) {
        if (name == null) return false;
        return name.equals(teacher) || name.equals(originalTeacher);
    }
}
