package com.example.estimations.model;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a game operation: either a value or a {@link GameError}.
 */
public final class Outcome<T> {

    private final T value;
    private final GameError error;

    private Outcome(T value, GameError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Outcome<T> failure(GameError error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    /** The value; throws if this is a failure. */
    public T getValue() {
        if (error != null) throw new NoSuchElementException("Outcome failed: " + error);
        return value;
    }

    public GameError getError() {
        return error;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> fn) {
        if (error != null) return failure(error);
        return ok(fn.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Outcome<?> other)) return false;
        return Objects.equals(value, other.value) && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isOk() ? "Outcome{ok=" + value + '}' : "Outcome{error=" + error + '}';
    }
}
