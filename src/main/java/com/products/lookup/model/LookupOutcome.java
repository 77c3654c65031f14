package com.products.lookup.model;

import java.util.Optional;

/**
 * Typed result of a resolution step.
 * <p>
 * {@link Status#NOT_FOUND} and {@link Status#FAILED} both surface as "no
 * product" to callers of the public lookup, but stay distinguishable here so
 * tests and diagnostics do not have to read log output.
 * </p>
 *
 * @param status what happened
 * @param value  the resolved value, only for {@link Status#FOUND}
 * @param detail human-readable cause, only for {@link Status#FAILED} and optional otherwise
 * @param <T>    value type
 */
public record LookupOutcome<T>(Status status, T value, String detail) {

    public enum Status { FOUND, NOT_FOUND, FAILED }

    public static <T> LookupOutcome<T> found(final T value) {
        return new LookupOutcome<>(Status.FOUND, value, null);
    }

    public static <T> LookupOutcome<T> notFound(final String detail) {
        return new LookupOutcome<>(Status.NOT_FOUND, null, detail);
    }

    public static <T> LookupOutcome<T> failed(final String detail) {
        return new LookupOutcome<>(Status.FAILED, null, detail);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }
}
