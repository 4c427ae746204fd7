package com.example.schoolops.enums;

public enum StudentStatus {
    REGULAR,
    DROPPED,
    EXPELLED
}
