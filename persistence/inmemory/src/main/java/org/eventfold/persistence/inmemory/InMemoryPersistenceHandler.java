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

import org.eventfold.core.PersistedBundle;
import org.eventfold.core.PersistedEvent;
import org.eventfold.core.PersistenceHandler;
import org.eventfold.core.Snapshot;
import org.eventfold.result.Result;
import org.eventfold.result.Stage;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.*;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;
import static org.eventfold.core.EventSequenceId.BASELINE_SEQUENCE;

/**
 * A {@link PersistenceHandler} that keeps events in an {@link InMemoryEventLog} and snapshots in memory.
 * This is mainly useful for testing and/or demo purposes.
 * <p>
 * Snapshots are never replaced, the history of all snapshots written under a key is kept and the latest one is returned when
 * fetching. If an {@code acceptedSchemaVersion} is configured and the latest snapshot has another schema version, the snapshot
 * is returned together with <i>all</i> events so that the state can be rebuilt from scratch.
 * </p>
 *
 * @param <S> The state type
 * @param <E> The domain event type
 */
public class InMemoryPersistenceHandler<S, E> implements PersistenceHandler<S, E> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryPersistenceHandler.class);

    private final InMemoryEventLog<E> eventLog;
    private final @Nullable Integer acceptedSchemaVersion;
    private final Map<String, List<Snapshot<S>>> snapshots = Collections.synchronizedMap(new LinkedHashMap<>());

    /**
     * Create an instance of {@link InMemoryPersistenceHandler} with its own {@link InMemoryEventLog}
     */
    public InMemoryPersistenceHandler() {
        this(new InMemoryEventLog<>());
    }

    public InMemoryPersistenceHandler(InMemoryEventLog<E> eventLog) {
        this(eventLog, null);
    }

    /**
     * @param eventLog              The event log to read and write events from
     * @param acceptedSchemaVersion If not {@code null}, the latest snapshot is considered stale unless it has this schema version
     */
    public InMemoryPersistenceHandler(InMemoryEventLog<E> eventLog, @Nullable Integer acceptedSchemaVersion) {
        requireNonNull(eventLog, InMemoryEventLog.class.getSimpleName() + " cannot be null");
        this.eventLog = eventLog;
        this.acceptedSchemaVersion = acceptedSchemaVersion;
    }

    @Override
    public Mono<Result<Void>> save(List<PersistedEvent<E>> events) {
        requireNonNull(events, "events cannot be null");
        return Mono.fromCallable(() -> {
            try {
                eventLog.append(events);
                return Result.success();
            } catch (DuplicateEventIdException e) {
                log.warn("Rejected events: {}", e.getMessage());
                return Result.<Void>failure(Stage.PERSISTENCE, e.getMessage());
            }
        });
    }

    @Override
    public Mono<Result<PersistedBundle<S, E>>> get(String id) {
        requireNonNull(id, "id cannot be null");
        return Mono.fromSupplier(() -> Result.success(bundle(id, eventLog.read(id))));
    }

    @Override
    public Mono<Result<PersistedBundle<S, E>>> getAll(String projectionName) {
        requireNonNull(projectionName, "projectionName cannot be null");
        return Mono.fromSupplier(() -> Result.success(globalBundle(projectionName)));
    }

    @Override
    public Mono<Result<Void>> snapshot(Snapshot<S> snapshot) {
        requireNonNull(snapshot, Snapshot.class.getSimpleName() + " cannot be null");
        return Mono.fromSupplier(() -> {
            synchronized (snapshots) {
                snapshots.computeIfAbsent(snapshot.key(), __ -> new ArrayList<>()).add(snapshot);
            }
            return Result.success();
        });
    }

    /**
     * @return All snapshots written under {@code key}, oldest first
     */
    public List<Snapshot<S>> snapshots(String key) {
        synchronized (snapshots) {
            return List.copyOf(snapshots.getOrDefault(key, List.of()));
        }
    }

    /**
     * @return The number of snapshots written, under any key
     */
    public int snapshotCount() {
        synchronized (snapshots) {
            return snapshots.values().stream().mapToInt(List::size).sum();
        }
    }

    public Optional<Snapshot<S>> latestSnapshot(String key) {
        List<Snapshot<S>> history = snapshots(key);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    public InMemoryEventLog<E> eventLog() {
        return eventLog;
    }

    private PersistedBundle<S, E> bundle(String key, List<PersistedEvent<E>> events) {
        Snapshot<S> snapshot = latestSnapshot(key).orElse(null);
        if (snapshot == null) {
            return new PersistedBundle<>(key, null, events);
        } else if (acceptedSchemaVersion != null && snapshot.schemaVersion() != acceptedSchemaVersion) {
            log.debug("Snapshot of {} has schema version {} but {} is accepted, returning all events", key, snapshot.schemaVersion(), acceptedSchemaVersion);
            return new PersistedBundle<>(key, snapshot, events);
        }
        List<PersistedEvent<E>> pending = events.stream().filter(event -> event.sequence() > snapshot.lastConsideredSequence()).collect(Collectors.toList());
        return new PersistedBundle<>(key, snapshot, pending);
    }

    // Global snapshots are checkpointed by log position since sequences only order the events of one subject
    private PersistedBundle<S, E> globalBundle(String projectionName) {
        Snapshot<S> snapshot = latestSnapshot(projectionName).orElse(null);
        long readAfter = BASELINE_SEQUENCE;
        if (snapshot != null && acceptedSchemaVersion != null && snapshot.schemaVersion() != acceptedSchemaVersion) {
            log.debug("Snapshot of {} has schema version {} but {} is accepted, returning all events", projectionName, snapshot.schemaVersion(), acceptedSchemaVersion);
        } else if (snapshot != null) {
            readAfter = snapshot.lastConsideredSequence();
        }
        InMemoryEventLog.Slice<E> slice = eventLog.readAllAfter(readAfter);
        return new PersistedBundle<>(projectionName, snapshot, slice.events(), slice.lastPosition());
    }
}
