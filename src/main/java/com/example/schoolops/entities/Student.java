package com.example.schoolops.entities;

import com.example.schoolops.enums.StudentStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "students", indexes = {
        @Index(name = "idx_student_class_grade", columnList = "class_grade"),
        @Index(name = "idx_student_number", columnList = "student_number")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Student {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 200)
    private String name;

    // class label, e.g. "Grade4" or a section such as "Grade4/A"
    @Column(name = "class_grade", length = 64)
    private String classGrade;

    @Column(name = "parent_phone", length = 40)
    private String parentPhone;

    // number from the imported roster file, display only
    @Column(name = "student_number", length = 64)
    private String studentNumber;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    @Builder.Default
    private StudentStatus status = StudentStatus.REGULAR;

    @Column(name = "created_at", updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();
}
