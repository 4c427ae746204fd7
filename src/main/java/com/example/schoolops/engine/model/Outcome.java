package com.example.schoolops.engine.model;

import java.util.Objects;

/**
 * Either the new state produced by an engine operation or the reason it was rejected.
 * Rejections are ordinary results here, not exceptions.
 */
public final class Outcome<T> {

    private final T value;
    private final EngineError error;

    private Outcome(T value, EngineError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Outcome<T> failure(EngineError error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Outcome is a failure: " + error.getType());
        }
        return value;
    }

    public EngineError getError() {
        if (error == null) {
            throw new IllegalStateException("Outcome is a success");
        }
        return error;
    }

    @Override
    public String toString() {
        return error == null ? "Outcome.success(" + value + ")" : "Outcome.failure(" + error + ")";
    }
}
