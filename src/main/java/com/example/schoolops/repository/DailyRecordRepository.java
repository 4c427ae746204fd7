package com.example.schoolops.repository;

import com.example.schoolops.entities.DailyRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface DailyRecordRepository extends JpaRepository<DailyRecord, String> {

    List<DailyRecord> findByLessonDate(LocalDate lessonDate);

    List<DailyRecord> findByLessonDateBetween(LocalDate start, LocalDate end);
}
