/*
 * Copyright 2026 the eventfold authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventfold.result;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of an operation, either a {@link Success} holding a value or a {@link Failure} holding the {@link Stage}
 * at which the operation failed together with a human-readable message.
 * <p>
 * Expected failures (a rejected command, a persistence handler that could not store events etc) are always returned as a {@link Failure},
 * they are never thrown. Callers are expected to branch on {@link #isSuccess()}.
 * </p>
 *
 * @param <T> The type of the value held by a successful result
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * @param value The value
     * @return A successful result holding {@code value}
     */
    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * @return A successful result without a value, used by operations that only have side effects.
     */
    static Result<Void> success() {
        return new Success<>(null);
    }

    /**
     * @param stage   The stage at which the operation failed
     * @param message A human-readable description of the failure
     * @return A failed result
     */
    static <T> Result<T> failure(Stage stage, String message) {
        return new Failure<>(stage, message);
    }

    /**
     * Combine several results into one. If all results are successful a successful {@code Result<Void>} is returned.
     * If exactly one result is a failure it's returned as is, and if more than one failed a failure with stage {@link Stage#MANY}
     * is returned whose message contains the messages of all failures.
     *
     * @param results The results to combine
     * @return The combined result
     */
    static Result<Void> combine(List<? extends Result<?>> results) {
        requireNonNull(results, "results cannot be null");
        List<Failure<?>> failures = results.stream()
                .filter(Failure.class::isInstance)
                .<Failure<?>>map(Failure.class::cast)
                .collect(Collectors.toList());

        if (failures.isEmpty()) {
            return success();
        } else if (failures.size() == 1) {
            return failures.get(0).cast();
        }
        String message = failures.stream()
                .map(failure -> failure.stage().tag() + ": " + failure.message())
                .collect(Collectors.joining("; ", failures.size() + " operations failed (", ")"));
        return failure(Stage.MANY, message);
    }

    /**
     * @see #combine(List)
     */
    static Result<Void> combine(Result<?>... results) {
        return combine(Arrays.asList(results));
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * @return The value of a successful result
     * @throws IllegalStateException If this result is a {@link Failure}
     */
    T get();

    /**
     * Apply {@code fn} to the value if this result is successful, otherwise return the failure unchanged.
     */
    <U> Result<U> map(Function<? super T, ? extends U> fn);

    /**
     * Apply {@code fn} to the value if this result is successful and return its result, otherwise return the failure unchanged.
     */
    <U> Result<U> flatMap(Function<? super T, Result<U>> fn);

    /**
     * Reduce this result to a single value.
     *
     * @param onSuccess Invoked with the value if this result is successful
     * @param onFailure Invoked with the failure otherwise
     */
    <R> R fold(Function<? super T, ? extends R> onSuccess, Function<Failure<T>, ? extends R> onFailure);

    record Success<T>(@Nullable T value) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T get() {
            return value;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> fn) {
            requireNonNull(fn, "fn cannot be null");
            return new Success<>(fn.apply(value));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> fn) {
            requireNonNull(fn, "fn cannot be null");
            return requireNonNull(fn.apply(value), "flatMap function returned null");
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<Failure<T>, ? extends R> onFailure) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(Stage stage, String message) implements Result<T> {

        public Failure {
            requireNonNull(stage, Stage.class.getSimpleName() + " cannot be null");
            message = Objects.requireNonNullElse(message, "");
        }

        /**
         * @return This failure typed as a failure of another value type. Failures hold no value so this is always safe.
         */
        @SuppressWarnings("unchecked")
        public <U> Failure<U> cast() {
            return (Failure<U>) this;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T get() {
            throw new IllegalStateException("Cannot get the value of a failed result (" + stage.tag() + "): " + message);
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> fn) {
            return cast();
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> fn) {
            return cast();
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<Failure<T>, ? extends R> onFailure) {
            return onFailure.apply(this);
        }
    }
}
