package com.example.schoolops.enums;

/**
 * Lifecycle of a substitution request: PENDING until the requested teacher answers.
 */
public enum SubstitutionRequestStatus {
    PENDING,
    ACCEPTED,
    REJECTED
}
