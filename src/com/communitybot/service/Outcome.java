package com.communitybot.service;

import java.util.Objects;

/**
 * Result of an engine operation: a value, or the {@link Failure} that refused it.
 * Engine operations never throw past their boundary; callers branch on this instead.
 */
public final class Outcome<T> {
    private final T value;
    private final Failure failure;

    private Outcome(T value, Failure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Outcome<T> failed(Failure failure) {
        return new Outcome<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isOk() {
        return failure == null;
    }

    public boolean is(Failure expected) {
        return failure == expected;
    }

    /**
     * @throws IllegalStateException if this outcome is a failure
     */
    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("Outcome failed: " + failure);
        }
        return value;
    }

    /** The failure, or null when the operation succeeded. */
    public Failure getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return failure == null ? "Ok(" + value + ")" : "Failed(" + failure + ")";
    }
}
