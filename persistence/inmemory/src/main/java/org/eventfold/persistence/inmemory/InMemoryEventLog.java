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

package org.eventfold.persistence.inmemory;

import org.eventfold.core.EventSequenceId;
import org.eventfold.core.PersistedEvent;

import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;
import static org.eventfold.core.EventSequenceId.BASELINE_SEQUENCE;

/**
 * An append-only log of {@link PersistedEvent}s kept in memory, grouped by subject. Mainly useful for testing and demo purposes.
 * <p>
 * The log can be shared by several {@link InMemoryPersistenceHandler}s, for example one for an aggregate and one for a
 * projection of the same events. Appending events for a subject is atomic and is rejected with a
 * {@link DuplicateEventIdException} if any of the identifiers are already stored.
 * </p>
 *
 * @param <E> The domain event type
 */
public class InMemoryEventLog<E> {

    // We cannot use ConcurrentMap since it doesn't maintain insertion order
    private final Map<String, List<PersistedEvent<E>>> state = Collections.synchronizedMap(new LinkedHashMap<>());
    // All events in append order, guarded by state
    private final List<PersistedEvent<E>> journal = new ArrayList<>();

    private final Consumer<List<PersistedEvent<E>>> listener;

    public InMemoryEventLog() {
        // @formatter:off
        this(__ -> {});
        // @formatter:on
    }

    /**
     * @param listener A listener that will be invoked (synchronously) after events have been appended
     */
    public InMemoryEventLog(Consumer<List<PersistedEvent<E>>> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.listener = listener;
    }

    /**
     * Append events to the log. Events are grouped by subject and each group is appended atomically.
     * Every appended event is given the next position in the log, whatever its subject.
     *
     * @param events The events to append
     * @throws DuplicateEventIdException If an event with the same identifier is already stored
     */
    public void append(List<PersistedEvent<E>> events) {
        requireNonNull(events, "events cannot be null");
        Map<String, List<PersistedEvent<E>>> eventsBySubject = events.stream().collect(Collectors.groupingBy(PersistedEvent::subject, LinkedHashMap::new, Collectors.toList()));
        eventsBySubject.forEach((subject, newEvents) -> {
            synchronized (state) {
                state.compute(subject, (__, currentEvents) -> {
                    if (currentEvents == null) {
                        requireUniqueIds(subject, Set.of(), newEvents);
                        return List.copyOf(newEvents);
                    }
                    Set<EventSequenceId> currentIds = currentEvents.stream().map(PersistedEvent::id).collect(Collectors.toSet());
                    requireUniqueIds(subject, currentIds, newEvents);
                    List<PersistedEvent<E>> eventList = new ArrayList<>(currentEvents);
                    eventList.addAll(newEvents);
                    return List.copyOf(eventList);
                });
                journal.addAll(newEvents);
            }
            listener.accept(List.copyOf(newEvents));
        });
    }

    /**
     * @return The events of {@code subject} in the order they were appended
     */
    public List<PersistedEvent<E>> read(String subject) {
        requireNonNull(subject, "subject cannot be null");
        return state.getOrDefault(subject, List.of());
    }

    /**
     * Read the events of all subjects that were appended after {@code position}. The first event appended to the log has
     * position {@code BASELINE_SEQUENCE + 1}, so in a log with a single subject the position of an event equals its sequence.
     *
     * @param position The position to read after, events at this position or before are skipped
     * @return The events in the order they were appended, and the position of the last event in the log
     */
    public Slice<E> readAllAfter(long position) {
        synchronized (state) {
            int from = (int) Math.min(Math.max(position - BASELINE_SEQUENCE, 0), journal.size());
            return new Slice<>(List.copyOf(journal.subList(from, journal.size())), BASELINE_SEQUENCE + journal.size());
        }
    }

    public boolean exists(String subject) {
        return state.containsKey(subject);
    }

    public long count() {
        synchronized (state) {
            return journal.size();
        }
    }

    /**
     * Events read from the log of all subjects.
     *
     * @param events       The events, in the order they were appended
     * @param lastPosition The position of the last event in the log at the time of reading
     */
    public record Slice<E>(List<PersistedEvent<E>> events, long lastPosition) {
    }

    private static <E> void requireUniqueIds(String subject, Set<EventSequenceId> currentIds, List<PersistedEvent<E>> newEvents) {
        Set<EventSequenceId> seen = new HashSet<>(currentIds);
        List<EventSequenceId> duplicates = newEvents.stream().map(PersistedEvent::id).filter(id -> !seen.add(id)).collect(Collectors.toList());
        if (!duplicates.isEmpty()) {
            throw new DuplicateEventIdException(subject, duplicates);
        }
    }
}
