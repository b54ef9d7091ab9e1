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

import org.eventfold.core.PersistedBundle;
import org.eventfold.result.Result;
import org.eventfold.result.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * The read path shared by aggregates and projections: fetch, hydrate, maybe snapshot, return the state.
 * A failing snapshot never fails the read.
 *
 * @param <S> The state type
 * @param <E> The domain event type
 */
public class QueryWorkflow<S, E> {
    private static final Logger log = LoggerFactory.getLogger(QueryWorkflow.class);

    private final S defaultState;
    private final Hydrator<S, E> hydrator;
    private final SnapshotPolicy<S> snapshotPolicy;
    private final Stage fetchErrorStage;

    /**
     * @param fetchErrorStage The stage of the failure that is returned if fetching signals an error
     */
    public QueryWorkflow(S defaultState, Hydrator<S, E> hydrator, SnapshotPolicy<S> snapshotPolicy, Stage fetchErrorStage) {
        requireNonNull(defaultState, "defaultState cannot be null");
        requireNonNull(hydrator, Hydrator.class.getSimpleName() + " cannot be null");
        requireNonNull(snapshotPolicy, SnapshotPolicy.class.getSimpleName() + " cannot be null");
        requireNonNull(fetchErrorStage, "fetchErrorStage cannot be null");
        this.defaultState = defaultState;
        this.hydrator = hydrator;
        this.snapshotPolicy = snapshotPolicy;
        this.fetchErrorStage = fetchErrorStage;
    }

    /**
     * @param key   The key that snapshots are stored under
     * @param fetch Fetches the bundle from the persistence handler
     */
    public Mono<Result<S>> read(String key, Supplier<Mono<Result<PersistedBundle<S, E>>>> fetch) {
        requireNonNull(key, "key cannot be null");
        requireNonNull(fetch, "fetch cannot be null");
        return CollaboratorCall.call(fetchErrorStage, "Fetching " + key, fetch)
                .flatMap(fetched -> fetched.<Mono<Result<S>>>fold(bundle -> {
                    S state = hydrator.hydrate(defaultState, bundle.snapshot(), snapshotPolicy.expectedSchemaVersion(), bundle.events());
                    return snapshotPolicy.maybeSnapshot(key, state, bundle.checkpoint(), bundle.lastSnapshotSequence())
                            .map(snapshotResult -> {
                                if (snapshotResult instanceof Result.Failure<Void> failure) {
                                    log.warn("Failed to write snapshot for {} ({}: {}), returning state anyway", key, failure.stage().tag(), failure.message());
                                }
                                return Result.success(state);
                            });
                }, failure -> Mono.<Result<S>>just(failure.cast())));
    }
}
