package com.example.schoolops.engine;

import com.example.schoolops.engine.model.AttendanceRecord;
import com.example.schoolops.engine.model.RosterStudent;
import com.example.schoolops.engine.model.ScheduleSlot;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which sessions are complete for a date: every student of the session's classroom
 * has a record on that date. Always computed from the snapshot passed in, nothing is cached.
 */
public class SessionCompletionTracker {

    private final RosterMatcher rosterMatcher;

    public SessionCompletionTracker(RosterMatcher rosterMatcher) {
        this.rosterMatcher = rosterMatcher;
    }

    public List<String> rosterFor(ScheduleSlot slot, List<RosterStudent> students) {
        if (slot == null || students == null) return List.of();
        return students.stream()
                .filter(s -> rosterMatcher.matches(s.getClassGrade(), slot.getClassRoom()))
                .map(RosterStudent::getId)
                .toList();
    }

    /**
     * An empty roster is never complete: there is nothing to report on.
     */
    public boolean computeCompletion(List<String> rosterStudentIds, List<AttendanceRecord> recordsForDate, LocalDate date) {
        if (rosterStudentIds == null || rosterStudentIds.isEmpty() || date == null) return false;
        Set<String> recorded = recordedStudents(recordsForDate, date);
        return recorded.containsAll(rosterStudentIds);
    }

    public boolean isComplete(ScheduleSlot slot, List<RosterStudent> students, List<AttendanceRecord> recordsForDate, LocalDate date) {
        return computeCompletion(rosterFor(slot, students), recordsForDate, date);
    }

    public Set<String> completedSlotIds(List<ScheduleSlot> slots, List<RosterStudent> students,
                                        List<AttendanceRecord> recordsForDate, LocalDate date) {
        Set<String> completed = new LinkedHashSet<>();
        if (slots == null) return completed;
        Set<String> recorded = recordedStudents(recordsForDate, date);
        for (ScheduleSlot slot : slots) {
            List<String> roster = rosterFor(slot, students);
            if (!roster.isEmpty() && recorded.containsAll(roster)) {
                completed.add(slot.getId());
            }
        }
        return completed;
    }

    private Set<String> recordedStudents(List<AttendanceRecord> records, LocalDate date) {
        Set<String> ids = new HashSet<>();
        if (records == null || date == null) return ids;
        for (AttendanceRecord r : records) {
            if (r != null && date.equals(r.getDate())) {
                ids.add(r.getStudentId());
            }
        }
        return ids;
    }
}
