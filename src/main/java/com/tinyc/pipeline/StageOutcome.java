package com.tinyc.pipeline;

import com.tinyc.TinyCException;

import java.util.Optional;

/**
 * Result of one pipeline stage: its value, the failure that stopped it, or
 * a marker that it never ran because a stage it depends on failed.
 */
public sealed interface StageOutcome<T> {
    record Success<T>(T value) implements StageOutcome<T> {}
    record Failure<T>(TinyCException error) implements StageOutcome<T> {}
    record Skipped<T>() implements StageOutcome<T> {}

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default Optional<T> result() {
        return this instanceof Success<T> success ? Optional.of(success.value()) : Optional.empty();
    }

    default Optional<TinyCException> failure() {
        return this instanceof Failure<T> failure ? Optional.of(failure.error()) : Optional.empty();
    }
}
