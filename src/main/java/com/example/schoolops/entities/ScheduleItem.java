package com.example.schoolops.entities;

import com.example.schoolops.enums.SchoolDay;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "schedule", indexes = {
        @Index(name = "idx_schedule_day_period", columnList = "school_day, period"),
        @Index(name = "idx_schedule_year", columnList = "academic_year")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleItem {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "school_day", nullable = false, length = 16)
    private SchoolDay day;

    @Column(nullable = false)
    private Integer period;

    @Column(length = 120)
    private String subject;

    @Column(name = "class_room", length = 64)
    private String classRoom;

    @Column(length = 120)
    private String teacher;

    // regular teacher while a substitute holds the slot
    @Column(name = "original_teacher", length = 120)
    private String originalTeacher;

    @Column(name = "academic_year", length = 32)
    private String academicYear;

    @Column(name = "created_at")
    private Instant createdAt;
}
