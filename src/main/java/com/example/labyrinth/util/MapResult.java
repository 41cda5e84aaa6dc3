package com.example.labyrinth.util;

import java.util.function.Function;

/**
 * Result of a map operation - either success carrying a value, or failure with a {@link MapError}.
 * Callers check {@link #isSuccess()} before reading the value.
 */
public final class MapResult<T> {
    private static final MapResult<Void> OK = new MapResult<>(null, null);

    private final T value;
    private final MapError error;

    private MapResult(T value, MapError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> MapResult<T> success(T value) {
        return new MapResult<>(value, null);
    }

    /** Success with no value, for operations that only mutate. */
    public static MapResult<Void> ok() {
        return OK;
    }

    public static <T> MapResult<T> failure(MapError error) {
        if (error == null) {
            throw new IllegalArgumentException("failure requires an error");
        }
        return new MapResult<>(null, error);
    }

    public static <T> MapResult<T> invalidArgument(String message) {
        return failure(new MapError(MapError.Kind.INVALID_ARGUMENT, message));
    }

    public static <T> MapResult<T> outOfBounds(String message) {
        return failure(new MapError(MapError.Kind.OUT_OF_BOUNDS, message));
    }

    public static <T> MapResult<T> shapeMismatch(String message) {
        return failure(new MapError(MapError.Kind.SHAPE_MISMATCH, message));
    }

    public boolean isSuccess() { return error == null; }
    public boolean isFailure() { return error != null; }
    public MapError getError() { return error; }

    public String getFailureMessage() {
        return error == null ? null : error.getMessage();
    }

    /** Kind of the failure, or null on success. */
    public MapError.Kind getErrorKind() {
        return error == null ? null : error.getKind();
    }

    /**
     * Value of a successful result.
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value on failed result (" + error + ")");
        }
        return value;
    }

    /**
     * Value of a successful result.
     * @throws MapException carrying the error if this result is a failure
     */
    public T orElseThrow() {
        if (error != null) {
            throw new MapException(error);
        }
        return value;
    }

    public <U> MapResult<U> map(Function<? super T, ? extends U> fn) {
        if (error != null) return failure(error);
        return success(fn.apply(value));
    }

    public <U> MapResult<U> flatMap(Function<? super T, MapResult<U>> fn) {
        if (error != null) return failure(error);
        return fn.apply(value);
    }

    /** Re-types a failure so it can be returned from an operation with another value type. */
    public <U> MapResult<U> propagate() {
        if (error == null) {
            throw new IllegalStateException("Only failed results can be propagated");
        }
        return failure(error);
    }

    @Override
    public String toString() {
        return error == null ? "MapResult[success=" + value + "]" : "MapResult[failure=" + error + "]";
    }
}
