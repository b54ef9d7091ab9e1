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

package org.eventfold.core;

import org.eventfold.result.Result;
import org.jspecify.annotations.NullMarked;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The data storage layer. Implement this interface to store and retrieve events and snapshots in a datastore of your choice.
 * <br><br>
 * Implementations are expected to:
 * <ul>
 *     <li>store events and return them by the subject of their {@link EventSequenceId}</li>
 *     <li>return the <i>latest</i> snapshot stored under a key and <i>only</i> the events whose sequence is greater than the
 *     snapshot's {@link Snapshot#lastConsideredSequence()}</li>
 *     <li>make the append of a list of events for one subject atomic, and either serialize or reject writes whose identifiers
 *     collide with events that are already stored. The workflows that call this handler don't lock and don't use optimistic
 *     concurrency, so two concurrent commands for the same subject can produce the same identifiers.</li>
 *     <li>not implement any event handling logic</li>
 * </ul>
 * Expected failures should be returned as a {@link Result.Failure} with stage {@link org.eventfold.result.Stage#PERSISTENCE}.
 *
 * @param <S> The type of the state that is snapshotted
 * @param <E> The type of the domain events
 */
@NullMarked
public interface PersistenceHandler<S, E> {

    /**
     * Store events. The events are ordered by their {@link EventSequenceId} and all belong to the same subject.
     *
     * @param events The events to store, in the order they should be stored
     */
    Mono<Result<Void>> save(List<PersistedEvent<E>> events);

    /**
     * Get the latest snapshot stored under {@code id} and the events of subject {@code id} that are newer than the snapshot.
     *
     * @param id The aggregate or named projection id
     */
    Mono<Result<PersistedBundle<S, E>>> get(String id);

    /**
     * Get the latest snapshot stored under {@code projectionName} and the events of <i>all</i> subjects that are newer than the snapshot.
     * This is used by global projections.
     * <p>
     * Sequences are only ordered within a subject, so the returned bundle must carry a {@link PersistedBundle#logPosition()}:
     * a position that increases with every event appended, whatever its subject. Global projection snapshots record this
     * position as their {@link Snapshot#lastConsideredSequence()}, and the events returned are those appended after it.
     * </p>
     *
     * @param projectionName The name of the global projection
     */
    Mono<Result<PersistedBundle<S, E>>> getAll(String projectionName);

    /**
     * Store a snapshot.
     *
     * @param snapshot The snapshot to store
     */
    Mono<Result<Void>> snapshot(Snapshot<S> snapshot);
}
