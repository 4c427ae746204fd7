package com.example.schoolops.entities;

import com.example.schoolops.enums.SubstitutionRequestStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "substitution_requests", indexes = {
        @Index(name = "idx_substitution_requests_status", columnList = "status"),
        @Index(name = "idx_substitution_requests_teacher", columnList = "substitute_teacher"),
        @Index(name = "idx_substitution_requests_date", columnList = "request_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubstitutionRequest {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "request_date", nullable = false)
    private LocalDate requestDate;

    @Column(name = "schedule_item_id", nullable = false, length = 64)
    private String scheduleItemId;

    @Column(name = "substitute_teacher", nullable = false, length = 120)
    private String substituteTeacher;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SubstitutionRequestStatus status;

    @Column(name = "rejection_reason", length = 512)
    private String rejectionReason;

    @Column(name = "requested_at", nullable = false)
    private Instant requestedAt;

    @Column(name = "responded_at")
    private Instant respondedAt;

    @Column(name = "requested_by", length = 120)
    private String requestedBy;
}
