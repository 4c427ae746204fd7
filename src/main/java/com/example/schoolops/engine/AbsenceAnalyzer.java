package com.example.schoolops.engine;

import com.example.schoolops.engine.model.AbsenceQuery;
import com.example.schoolops.engine.model.AbsenceSummary;
import com.example.schoolops.engine.model.AttendanceRecord;
import com.example.schoolops.engine.model.RosterStudent;
import com.example.schoolops.enums.AbsenceFilter;
import com.example.schoolops.enums.AttendanceStatus;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Absence report over a snapshot of daily records. Absent and excused days both count as absences.
 */
public class AbsenceAnalyzer {

    static final int MAX_CONSECUTIVE_LOOKBACK_DAYS = 30;
    static final int REPEATED_THRESHOLD = 3;

    private final RosterMatcher rosterMatcher;

    public AbsenceAnalyzer(RosterMatcher rosterMatcher) {
        this.rosterMatcher = rosterMatcher;
    }

    /**
     * Fills in the date range implied by the query's filter, relative to {@code today}.
     * Filters without a range of their own keep the caller's range, defaulting to today.
     */
    public AbsenceQuery resolveRange(AbsenceQuery query, LocalDate today) {
        AbsenceFilter filter = query.getFilter() == null ? AbsenceFilter.CUSTOM : query.getFilter();
        AbsenceQuery.AbsenceQueryBuilder b = query.toBuilder().filter(filter).to(today);
        switch (filter) {
            case TODAY -> b.from(today);
            case THREE_DAYS -> b.from(today.minusDays(2));
            case WEEK -> b.from(today.minusDays(6));
            case REPEATED -> b.from(today.minusMonths(1));
            default -> b.from(query.getFrom() == null ? today : query.getFrom())
                    .to(query.getTo() == null ? today : query.getTo());
        }
        return b.build();
    }

    public List<AbsenceSummary> summarize(List<AttendanceRecord> records, List<RosterStudent> students, AbsenceQuery query) {
        if (records == null || students == null || query == null || query.getFrom() == null || query.getTo() == null) {
            return List.of();
        }
        Map<String, RosterStudent> studentsById = new HashMap<>();
        for (RosterStudent s : students) {
            studentsById.put(s.getId(), s);
        }

        Map<String, List<AttendanceRecord>> absencesByStudent = new LinkedHashMap<>();
        for (AttendanceRecord r : records) {
            if (r.getAttendance() == null || !r.getAttendance().isAbsence()) continue;
            if (r.getDate().isBefore(query.getFrom()) || r.getDate().isAfter(query.getTo())) continue;
            if (!studentsById.containsKey(r.getStudentId())) continue;
            absencesByStudent.computeIfAbsent(r.getStudentId(), k -> new ArrayList<>()).add(r);
        }

        List<AbsenceSummary> result = new ArrayList<>();
        for (Map.Entry<String, List<AttendanceRecord>> e : absencesByStudent.entrySet()) {
            List<AttendanceRecord> absences = e.getValue();
            LocalDate last = absences.stream().map(AttendanceRecord::getDate).max(Comparator.naturalOrder()).orElse(null);
            boolean excused = absences.stream().anyMatch(r -> r.getAttendance() == AttendanceStatus.EXCUSED);
            result.add(AbsenceSummary.builder()
                    .student(studentsById.get(e.getKey()))
                    .absenceDays(absences.size())
                    .consecutiveDays(consecutiveDays(e.getKey(), records, query.getTo()))
                    .lastAbsenceDate(last)
                    .excused(excused)
                    .records(List.copyOf(absences))
                    .build());
        }

        return result.stream()
                .filter(s -> matchesFilter(s, query.getFilter()))
                .filter(s -> query.getClassGrade() == null || query.getClassGrade().isBlank()
                        || rosterMatcher.matches(s.getStudent().getClassGrade(), query.getClassGrade()))
                .filter(s -> matchesSearch(s.getStudent(), query.getSearch()))
                .sorted(Comparator.comparingInt(AbsenceSummary::getConsecutiveDays).reversed()
                        .thenComparing(Comparator.comparingInt(AbsenceSummary::getAbsenceDays).reversed()))
                .toList();
    }

    /**
     * Absent or excused days in a row ending at {@code endDate}; a day without a record breaks the run.
     */
    int consecutiveDays(String studentId, List<AttendanceRecord> records, LocalDate endDate) {
        Map<LocalDate, AttendanceRecord> byDate = new HashMap<>();
        for (AttendanceRecord r : records) {
            if (studentId.equals(r.getStudentId()) && !r.getDate().isAfter(endDate)) {
                byDate.put(r.getDate(), r);
            }
        }
        int consecutive = 0;
        LocalDate day = endDate;
        for (int i = 0; i < MAX_CONSECUTIVE_LOOKBACK_DAYS; i++) {
            AttendanceRecord r = byDate.get(day);
            if (r == null || r.getAttendance() == null || !r.getAttendance().isAbsence()) break;
            consecutive++;
            day = day.minusDays(1);
        }
        return consecutive;
    }

    private boolean matchesFilter(AbsenceSummary s, AbsenceFilter filter) {
        if (filter == null) return true;
        return switch (filter) {
            case EXCUSED -> s.isExcused();
            case UNEXCUSED -> !s.isExcused();
            case THREE_DAYS -> s.getConsecutiveDays() >= REPEATED_THRESHOLD;
            case REPEATED -> s.getAbsenceDays() >= REPEATED_THRESHOLD;
            default -> true;
        };
    }

    private boolean matchesSearch(RosterStudent student, String search) {
        if (search == null || search.isBlank()) return true;
        String q = search.trim().toLowerCase(Locale.ROOT);
        return contains(student.getName(), q) || contains(student.getId(), q) || contains(student.getStudentNumber(), q);
    }

    private boolean contains(String value, String q) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(q);
    }
}
