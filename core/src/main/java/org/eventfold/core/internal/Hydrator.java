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

import org.eventfold.core.EventHandler;
import org.eventfold.core.PersistedEvent;
import org.eventfold.core.Snapshot;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Rebuilds state from an optional snapshot and the events that follow it.
 * <p>
 * Note that a snapshot that is rejected (empty or with another schema version) does not make the hydrator fetch earlier events.
 * The events passed to {@link #hydrate(Object, Snapshot, Integer, List)} are folded onto the default state as they are, so
 * the persistence handler must return all events when it knows that the snapshot is stale.
 * </p>
 *
 * @param <S> The state type
 * @param <E> The domain event type
 */
public class Hydrator<S, E> {
    private static final Logger log = LoggerFactory.getLogger(Hydrator.class);
    private static final Comparator<PersistedEvent<?>> BY_SEQUENCE = Comparator.comparingLong(PersistedEvent::sequence);

    private final EventHandler<S, E> eventHandler;

    public Hydrator(EventHandler<S, E> eventHandler) {
        requireNonNull(eventHandler, EventHandler.class.getSimpleName() + " cannot be null");
        this.eventHandler = eventHandler;
    }

    /**
     * @param defaultState          The state to start from if there's no usable snapshot
     * @param snapshot              The latest snapshot, or {@code null}
     * @param expectedSchemaVersion The schema version a snapshot must have to be used, {@code null} to never use snapshots
     * @param events                The events that follow the snapshot
     * @return The hydrated state
     */
    public S hydrate(S defaultState, @Nullable Snapshot<S> snapshot, @Nullable Integer expectedSchemaVersion, List<PersistedEvent<E>> events) {
        requireNonNull(defaultState, "defaultState cannot be null");
        final S baseline;
        if (snapshot != null && snapshot.isUsableFor(expectedSchemaVersion)) {
            baseline = snapshot.state();
        } else {
            if (snapshot != null) {
                log.debug("Ignoring snapshot for {} (schemaVersion={}, expectedSchemaVersion={}, empty={})", snapshot.key(), snapshot.schemaVersion(), expectedSchemaVersion, snapshot.isEmpty());
            }
            baseline = defaultState;
        }
        return fold(baseline, events);
    }

    /**
     * Apply {@code events}, in ascending sequence order, to {@code state}. The sort is stable, so events from different
     * subjects with the same sequence keep the order they were given in.
     */
    public S fold(S state, List<PersistedEvent<E>> events) {
        requireNonNull(state, "state cannot be null");
        requireNonNull(events, "events cannot be null");
        S current = state;
        for (PersistedEvent<E> event : events.stream().sorted(BY_SEQUENCE).toList()) {
            current = eventHandler.apply(current, event);
        }
        return current;
    }
}
