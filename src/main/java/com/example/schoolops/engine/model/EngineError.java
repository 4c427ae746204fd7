package com.example.schoolops.engine.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A rejected engine operation. Conflict errors carry the slot that blocked the operation
 * so callers can report it without another lookup.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EngineError {

    ErrorType type;
    String message;
    ConflictKind conflictKind;
    ScheduleSlot conflictingSlot;

    public static EngineError conflict(ConflictResult result, String message) {
        return new EngineError(ErrorType.CONFLICT, message, result.getKind(), result.getConflictingSlot());
    }

    public static EngineError invalidState(String message) {
        return new EngineError(ErrorType.INVALID_STATE, message, null, null);
    }

    public static EngineError notFound(String message) {
        return new EngineError(ErrorType.NOT_FOUND, message, null, null);
    }

    public static EngineError invalidArgument(String message) {
        return new EngineError(ErrorType.INVALID_ARGUMENT, message, null, null);
    }
}
