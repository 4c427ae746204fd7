package com.example.schoolops.engine.model;

public enum ErrorType {
    CONFLICT,
    INVALID_STATE,
    NOT_FOUND,
    INVALID_ARGUMENT
}
