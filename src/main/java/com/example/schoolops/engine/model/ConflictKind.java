package com.example.schoolops.engine.model;

public enum ConflictKind {
    TEACHER,
    CLASS
}
