package com.example.schoolops.service;

import com.example.schoolops.engine.AbsenceAnalyzer;
import com.example.schoolops.engine.model.AbsenceQuery;
import com.example.schoolops.engine.model.AbsenceSummary;
import com.example.schoolops.engine.model.AttendanceRecord;
import com.example.schoolops.store.AttendanceStore;
import com.example.schoolops.store.StudentDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

@Service
@RequiredArgsConstructor
public class AbsenceReportService {

    private final AttendanceStore attendanceStore;
    private final StudentDirectory studentDirectory;
    private final AbsenceAnalyzer absenceAnalyzer;

    public List<AbsenceSummary> report(AbsenceQuery query, LocalDate today) {
        AbsenceQuery resolved = absenceAnalyzer.resolveRange(query, today);
        // consecutive runs may start before the report range
        LocalDate lookbackStart = resolved.getTo().minusDays(31);
        LocalDate loadFrom = resolved.getFrom().isBefore(lookbackStart) ? resolved.getFrom() : lookbackStart;
        List<AttendanceRecord> records = attendanceStore.listAttendanceRecords(loadFrom, resolved.getTo());
        return absenceAnalyzer.summarize(records, studentDirectory.listStudents(), resolved);
    }
}
