package com.example.schoolops.store;

import com.example.schoolops.engine.AttendanceRecordEngine;
import com.example.schoolops.engine.model.AttendanceRecord;
import com.example.schoolops.entities.DailyRecord;
import com.example.schoolops.repository.DailyRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaAttendanceStore implements AttendanceStore {

    private final DailyRecordRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<AttendanceRecord> listAttendanceRecords(LocalDate date) {
        List<DailyRecord> rows = date == null ? repository.findAll() : repository.findByLessonDate(date);
        return rows.stream().map(JpaAttendanceStore::toRecord).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AttendanceRecord> listAttendanceRecords(LocalDate from, LocalDate to) {
        if (from == null || to == null || to.isBefore(from)) return List.of();
        return repository.findByLessonDateBetween(from, to).stream().map(JpaAttendanceStore::toRecord).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AttendanceRecord> findRecord(String studentId, LocalDate date) {
        if (studentId == null || date == null) return Optional.empty();
        return repository.findById(AttendanceRecordEngine.recordId(studentId, date)).map(JpaAttendanceStore::toRecord);
    }

    @Override
    @Transactional
    public void upsertAttendanceRecords(List<AttendanceRecord> records) {
        if (records == null || records.isEmpty()) return;
        Instant now = Instant.now();
        repository.saveAll(records.stream().map(r -> toEntity(r, now)).toList());
    }

    static AttendanceRecord toRecord(DailyRecord row) {
        return AttendanceRecord.builder()
                .id(row.getId())
                .studentId(row.getStudentId())
                .date(row.getLessonDate())
                .attendance(row.getAttendance())
                .participation(row.getParticipation())
                .homework(row.getHomework())
                .behavior(row.getBehavior())
                .notes(row.getNotes())
                .build();
    }

    static DailyRecord toEntity(AttendanceRecord record, Instant now) {
        String id = record.getId() != null
                ? record.getId()
                : AttendanceRecordEngine.recordId(record.getStudentId(), record.getDate());
        return DailyRecord.builder()
                .id(id)
                .studentId(record.getStudentId())
                .lessonDate(record.getDate())
                .attendance(record.getAttendance())
                .participation(record.getParticipation())
                .homework(record.getHomework())
                .behavior(record.getBehavior())
                .notes(record.getNotes())
                .updatedAt(now)
                .build();
    }
}
