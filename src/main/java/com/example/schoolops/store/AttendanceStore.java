package com.example.schoolops.store;

import com.example.schoolops.engine.model.AttendanceRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface AttendanceStore {

    /**
     * @param date null for every stored record
     */
    List<AttendanceRecord> listAttendanceRecords(LocalDate date);

    List<AttendanceRecord> listAttendanceRecords(LocalDate from, LocalDate to);

    Optional<AttendanceRecord> findRecord(String studentId, LocalDate date);

    /**
     * Inserts new records and overwrites existing ones with the same id.
     */
    void upsertAttendanceRecords(List<AttendanceRecord> records);
}
