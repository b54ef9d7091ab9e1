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

import org.eventfold.core.EventMetadata;
import org.eventfold.core.EventSequenceId;
import org.eventfold.core.EventTypeGetter;
import org.eventfold.core.PersistedEvent;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;
import static org.eventfold.core.PersistedEvent.DEFAULT_CONTENT_TYPE;
import static org.eventfold.core.PersistedEvent.SPEC_VERSION;

/**
 * Assigns {@link EventSequenceId}s and envelope attributes to domain events produced by a command handler.
 * <p>
 * Identifiers for a subject increase strictly from {@code lastKnownSequence + 1}. The sequencer has no state and offers
 * no concurrency guarantees, two callers with the same {@code lastKnownSequence} get the same identifiers.
 * </p>
 *
 * @param <E> The domain event type
 */
public class EventSequencer<E> {
    private final String source;
    private final EventTypeGetter<E> eventTypeGetter;
    private final Clock clock;

    public EventSequencer(String source, EventTypeGetter<E> eventTypeGetter, Clock clock) {
        requireNonNull(source, "source cannot be null");
        requireNonNull(eventTypeGetter, EventTypeGetter.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        if (source.isBlank()) {
            throw new IllegalArgumentException("source cannot be blank");
        }
        this.source = source;
        this.eventTypeGetter = eventTypeGetter;
        this.clock = clock;
    }

    /**
     * @param subject           The subject of the events, for example the aggregate id
     * @param lastKnownSequence The sequence of the last event that is known for the subject
     * @param events            The domain events, in the order they were produced
     * @return The persisted events, in the same order as {@code events}, all with the same timestamp
     */
    public List<PersistedEvent<E>> sequence(String subject, long lastKnownSequence, List<E> events) {
        requireNonNull(subject, "subject cannot be null");
        requireNonNull(events, "events cannot be null");
        if (events.isEmpty()) {
            return List.of();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<PersistedEvent<E>> persistedEvents = new ArrayList<>(events.size());
        EventSequenceId id = new EventSequenceId(lastKnownSequence, subject);
        for (E event : events) {
            id = id.next();
            persistedEvents.add(new PersistedEvent<>(id, eventTypeGetter.getEventType(event), event, now, DEFAULT_CONTENT_TYPE, SPEC_VERSION, source, EventMetadata.privateEvent()));
        }
        return List.copyOf(persistedEvents);
    }
}
