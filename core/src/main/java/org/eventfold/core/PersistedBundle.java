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

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static org.eventfold.core.EventSequenceId.BASELINE_SEQUENCE;

/**
 * What a {@link PersistenceHandler} returns when fetching: the latest snapshot, if any, and the events whose sequence is
 * greater than the snapshot's {@link Snapshot#lastConsideredSequence()} (all events if there's no snapshot).
 *
 * <p>
 * Bundles that span several subjects (see {@link PersistenceHandler#getAll(String)}) can't be checkpointed by event sequence
 * since sequences are only ordered within a subject. Such bundles carry a {@code logPosition} instead, and the snapshot's
 * {@link Snapshot#lastConsideredSequence()} is then a log position as well.
 * </p>
 *
 * @param key         The id or projection name that was fetched
 * @param snapshot    The latest snapshot or {@code null}
 * @param events      The pending events, in the order they were written
 * @param logPosition The position in the log of all subjects that the pending events end at, or {@code null} if the bundle
 *                    holds the events of one subject
 * @param <S>         The state type
 * @param <E>         The domain event type
 */
public record PersistedBundle<S, E>(String key, @Nullable Snapshot<S> snapshot, List<PersistedEvent<E>> events, @Nullable Long logPosition) {

    public PersistedBundle {
        requireNonNull(key, "key cannot be null");
        events = events == null ? List.of() : List.copyOf(events);
    }

    public PersistedBundle(String key, @Nullable Snapshot<S> snapshot, List<PersistedEvent<E>> events) {
        this(key, snapshot, events, null);
    }

    public static <S, E> PersistedBundle<S, E> empty(String key) {
        return new PersistedBundle<>(key, null, List.of());
    }

    public static <S, E> PersistedBundle<S, E> of(String key, List<PersistedEvent<E>> events) {
        return new PersistedBundle<>(key, null, events);
    }

    public Optional<Snapshot<S>> findSnapshot() {
        return Optional.ofNullable(snapshot);
    }

    /**
     * @return The sequence of the last event in this bundle, or the snapshot's last considered sequence if there are no events,
     * or {@link EventSequenceId#BASELINE_SEQUENCE} if there's neither.
     */
    public long lastEventSequence() {
        if (!events.isEmpty()) {
            return events.get(events.size() - 1).sequence();
        }
        return lastSnapshotSequence();
    }

    /**
     * @return The value to record as {@link Snapshot#lastConsideredSequence()} when snapshotting the state folded from this
     * bundle, the {@code logPosition} if there is one and {@link #lastEventSequence()} otherwise.
     */
    public long checkpoint() {
        return logPosition == null ? lastEventSequence() : logPosition;
    }

    /**
     * @return The snapshot's last considered sequence, or {@link EventSequenceId#BASELINE_SEQUENCE} if there's no snapshot.
     */
    public long lastSnapshotSequence() {
        return snapshot == null ? BASELINE_SEQUENCE : snapshot.lastConsideredSequence();
    }
}
