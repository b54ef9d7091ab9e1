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

package org.eventfold.core.internal;

import org.eventfold.result.Result;
import org.eventfold.result.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Invokes a collaborator (persistence or publishing handler) and makes sure that the outcome is always a {@link Result}.
 * An error signal, an exception thrown while creating the {@link Mono}, or a {@code Mono} that completes without a value,
 * are all converted into a {@link Result.Failure} of the given {@link Stage}.
 */
public final class CollaboratorCall {
    private static final Logger log = LoggerFactory.getLogger(CollaboratorCall.class);

    private CollaboratorCall() {
    }

    public static <T> Mono<Result<T>> call(Stage stage, String description, Supplier<Mono<Result<T>>> supplier) {
        requireNonNull(stage, Stage.class.getSimpleName() + " cannot be null");
        requireNonNull(description, "description cannot be null");
        requireNonNull(supplier, "supplier cannot be null");
        return Mono.defer(supplier)
                .switchIfEmpty(Mono.fromSupplier(() -> Result.<T>failure(stage, description + " completed without a result")))
                .onErrorResume(throwable -> {
                    log.warn("{} failed: {}", description, throwable.getMessage(), throwable);
                    return Mono.just(Result.<T>failure(stage, messageOf(throwable)));
                });
    }

    private static String messageOf(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null ? throwable.getClass().getName() : message;
    }
}
