package com.example.schoolops.repository;

import com.example.schoolops.entities.ScheduleItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScheduleItemRepository extends JpaRepository<ScheduleItem, String> {

    // slots without a year belong to every year
    List<ScheduleItem> findByAcademicYearOrAcademicYearIsNull(String academicYear);
}
