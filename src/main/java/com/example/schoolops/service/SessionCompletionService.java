package com.example.schoolops.service;

import com.example.schoolops.engine.SessionCompletionTracker;
import com.example.schoolops.engine.model.AttendanceRecord;
import com.example.schoolops.engine.model.EngineError;
import com.example.schoolops.engine.model.Outcome;
import com.example.schoolops.engine.model.RosterStudent;
import com.example.schoolops.engine.model.ScheduleSlot;
import com.example.schoolops.enums.SchoolDay;
import com.example.schoolops.store.AttendanceStore;
import com.example.schoolops.store.ScheduleStore;
import com.example.schoolops.store.StudentDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class SessionCompletionService {

    private final ScheduleStore scheduleStore;
    private final StudentDirectory studentDirectory;
    private final AttendanceStore attendanceStore;
    private final SessionCompletionTracker tracker;

    /**
     * Ids of the date's sessions whose whole roster has a record on that date.
     * Friday and Saturday have no sessions.
     */
    public Set<String> completedSessions(LocalDate date, String academicYear) {
        Optional<SchoolDay> day = SchoolDay.of(date);
        if (day.isEmpty()) return new LinkedHashSet<>();
        List<ScheduleSlot> slots = scheduleStore.listSchedule(academicYear).stream()
                .filter(s -> s.getDay() == day.get())
                .toList();
        return tracker.completedSlotIds(slots, studentDirectory.listStudents(),
                attendanceStore.listAttendanceRecords(date), date);
    }

    public Outcome<BulkReport> bulkReport(String slotId, LocalDate date) {
        Optional<ScheduleSlot> slot = scheduleStore.listSchedule(null).stream()
                .filter(s -> s.getId().equals(slotId))
                .findFirst();
        if (slot.isEmpty()) {
            return Outcome.failure(EngineError.notFound("Schedule slot not found: " + slotId));
        }

        List<RosterStudent> students = studentDirectory.listStudents();
        List<String> roster = tracker.rosterFor(slot.get(), students);
        Set<String> rosterIds = new HashSet<>(roster);
        List<AttendanceRecord> records = attendanceStore.listAttendanceRecords(date).stream()
                .filter(r -> rosterIds.contains(r.getStudentId()))
                .toList();
        Set<String> recorded = new HashSet<>();
        records.forEach(r -> recorded.add(r.getStudentId()));

        return Outcome.success(BulkReport.builder()
                .slot(slot.get())
                .date(date)
                .enabled(tracker.computeCompletion(roster, records, date))
                .students(students.stream().filter(s -> rosterIds.contains(s.getId())).toList())
                .records(records)
                .missingStudentIds(roster.stream().filter(id -> !recorded.contains(id)).toList())
                .build());
    }
}
