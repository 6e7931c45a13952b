/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.util;

import java.util.Optional;
import java.util.function.Function;

/**
 * Type representing the result of an internal step that could be successful
 * or fail, used where a failure is an expected outcome rather than an
 * exceptional one (an unknown element id, a path that runs off the end of a
 * list).
 *
 * @param <T> Type of successful result
 * @param <E> Type of failed result
 */
public final class Result<T, E> {
    private final T value;
    private final E error;

    private Result(T value, E error) {
        this.value = value;
        this.error = error;
    }

    /**
     * @param value The success value, must not be null
     * @param <T> Type of successful result
     * @param <E> Type of failed result
     * @return The successful result
     */
    public static <T, E> Result<T, E> ok(T value) {
        return new Result<>(value, null);
    }

    /**
     * @param error The failed value, must not be null
     * @param <T> Type of successful result
     * @param <E> Type of failed result
     * @return The failed result
     */
    public static <T, E> Result<T, E> err(E error) {
        return new Result<>(null, error);
    }

    /**
     * @return Whether this result is successful
     */
    public boolean isOk() {
        return this.value != null;
    }

    /**
     * @return Whether this result is failed
     */
    public boolean isErr() {
        return this.error != null;
    }

    /**
     * @return The successful value, or throw an exception if this Result is failed
     */
    public T unwrap() {
        if (value == null) {
            throw new IllegalStateException("Called unwrap on an Err Result: " + error);
        }
        return value;
    }

    /**
     * @return The failed value, or throw an exception if this Result is successful
     */
    public E unwrapErr() {
        if (error == null) {
            throw new IllegalStateException("Called unwrapErr on an Ok Result: " + value);
        }
        return error;
    }

    /**
     * @return Get the successful value if present
     */
    public Optional<T> get() {
        return Optional.ofNullable(value);
    }

    /**
     * @return Get the failed value if present
     */
    public Optional<E> getErr() {
        return Optional.ofNullable(error);
    }

    /**
     * Transforms the successful value of this Result, if present.
     *
     * @param mapper Function to apply to the successful value of this result
     * @param <U> The type to map to
     * @return A new result with {@code mapper} applied, if this result is a
     *  successful one
     */
    public <U> Result<U, E> map(Function<T, U> mapper) {
        if (isOk()) {
            return Result.ok(mapper.apply(value));
        }
        return Result.err(error);
    }

    /**
     * Chains another fallible step onto the successful value of this Result.
     *
     * @param mapper Function producing the next result
     * @param <U> The type of the next successful value
     * @return The result of {@code mapper}, or this failure
     */
    public <U> Result<U, E> flatMap(Function<T, Result<U, E>> mapper) {
        if (isOk()) {
            return mapper.apply(value);
        }
        return Result.err(error);
    }
}
