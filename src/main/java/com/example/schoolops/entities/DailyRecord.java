package com.example.schoolops.entities;

import com.example.schoolops.enums.AttendanceStatus;
import com.example.schoolops.enums.EvaluationLevel;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "daily_records", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"student_id", "lesson_date"})
}, indexes = {
        @Index(name = "idx_daily_record_date", columnList = "lesson_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyRecord {

    // studentId + "_" + lessonDate
    @Id
    @Column(length = 96)
    private String id;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    @Column(name = "lesson_date", nullable = false)
    private LocalDate lessonDate;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private AttendanceStatus attendance;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private EvaluationLevel participation;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private EvaluationLevel homework;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private EvaluationLevel behavior;

    @Column(length = 1000)
    private String notes;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
