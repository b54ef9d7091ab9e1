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

package org.eventfold.application.aggregate;

import org.eventfold.core.*;
import org.eventfold.core.internal.CollaboratorCall;
import org.eventfold.core.internal.EventSequencer;
import org.eventfold.core.internal.Hydrator;
import org.eventfold.core.internal.QueryWorkflow;
import org.eventfold.core.internal.SnapshotPolicy;
import org.eventfold.result.Result;
import org.eventfold.result.Stage;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An {@link Aggregate} that works in many scenarios. It handles a command like this:
 * <ol>
 *     <li>Fetch the latest snapshot and the events after it from the {@link PersistenceHandler}</li>
 *     <li>Hydrate the current state</li>
 *     <li>Invoke the {@link CommandHandler}. If no events are produced the current state is returned right away.</li>
 *     <li>Assign sequence identifiers to the new events and save them</li>
 *     <li>Apply the new events to the current state</li>
 *     <li>Concurrently write a snapshot (if due) and publish the new events (if a {@link PublishingHandler} is configured)</li>
 * </ol>
 * Failures of the last step are logged but don't fail the command unless {@link Builder#surfaceSideEffectFailures(boolean)} is enabled,
 * since the events are already saved at that point.
 * <p>
 * There's no locking or optimistic concurrency. Concurrent commands for the same aggregate may be assigned the same
 * identifiers, it's up to the {@link PersistenceHandler} to reject or serialize such writes.
 * </p>
 * Use {@link #builder()} to create an instance.
 *
 * @param <S> The state type
 * @param <C> The command type
 * @param <E> The domain event type
 */
public class GenericAggregate<S, C, E> implements Aggregate<S, C> {
    private static final Logger log = LoggerFactory.getLogger(GenericAggregate.class);

    private final S defaultState;
    private final CommandHandler<S, C, E> commandHandler;
    private final PersistenceHandler<S, E> persistenceHandler;
    private final @Nullable PublishingHandler<S, E> publishingHandler;
    private final boolean surfaceSideEffectFailures;
    private final EventSequencer<E> eventSequencer;
    private final Hydrator<S, E> hydrator;
    private final SnapshotPolicy<S> snapshotPolicy;
    private final QueryWorkflow<S, E> queryWorkflow;

    private GenericAggregate(Builder<S, C, E> builder) {
        this.defaultState = builder.defaultState;
        this.commandHandler = builder.commandHandler;
        this.persistenceHandler = builder.persistenceHandler;
        this.publishingHandler = builder.publishingHandler;
        this.surfaceSideEffectFailures = builder.surfaceSideEffectFailures;
        this.eventSequencer = new EventSequencer<>(builder.serviceName, builder.eventTypeGetter, builder.clock);
        this.hydrator = new Hydrator<>(builder.eventHandler);
        this.snapshotPolicy = new SnapshotPolicy<>(persistenceHandler, builder.snapshotConfig, EventKind.AGGREGATE_SNAPSHOT);
        this.queryWorkflow = new QueryWorkflow<>(defaultState, hydrator, snapshotPolicy, Stage.PERSISTENCE);
    }

    public static <S, C, E> Builder<S, C, E> builder() {
        return new Builder<>();
    }

    @Override
    public Mono<Result<S>> push(String id, C command) {
        requireNonNull(id, "id cannot be null");
        requireNonNull(command, "command cannot be null");
        return CollaboratorCall.call(Stage.PERSISTENCE, "Fetching aggregate " + id, () -> persistenceHandler.get(id))
                .flatMap(fetched -> fetched.<Mono<Result<S>>>fold(
                        bundle -> handle(id, command, bundle),
                        failure -> Mono.<Result<S>>just(failure.cast())));
    }

    @Override
    public Mono<Result<S>> get(String id) {
        requireNonNull(id, "id cannot be null");
        return queryWorkflow.read(id, () -> persistenceHandler.get(id));
    }

    private Mono<Result<S>> handle(String id, C command, PersistedBundle<S, E> bundle) {
        long lastKnownSequence = bundle.lastEventSequence();
        S currentState = hydrator.hydrate(defaultState, bundle.snapshot(), snapshotPolicy.expectedSchemaVersion(), bundle.events());

        Result<List<E>> decision = requireNonNull(commandHandler.handle(currentState, command), CommandHandler.class.getSimpleName() + " returned null");
        if (decision instanceof Result.Failure<List<E>> failure) {
            log.debug("Command {} was rejected by aggregate {}: {}", command.getClass().getSimpleName(), id, failure.message());
            return Mono.just(failure.cast());
        }

        List<E> newDomainEvents = decision.get() == null ? List.of() : decision.get();
        if (newDomainEvents.isEmpty()) {
            log.debug("Command {} produced no events for aggregate {}", command.getClass().getSimpleName(), id);
            return Mono.just(Result.success(currentState));
        }

        List<PersistedEvent<E>> newEvents = eventSequencer.sequence(id, lastKnownSequence, newDomainEvents);
        return CollaboratorCall.call(Stage.PERSISTENCE, "Saving events of aggregate " + id, () -> persistenceHandler.save(newEvents))
                .flatMap(saved -> {
                    if (saved instanceof Result.Failure<Void> failure) {
                        return Mono.just(failure.<S>cast());
                    }
                    // Only the new events are applied, the existing ones are already part of the current state
                    S finalState = hydrator.fold(currentState, newEvents);
                    long lastAppliedSequence = newEvents.get(newEvents.size() - 1).sequence();
                    return runSideEffects(id, finalState, newEvents, lastAppliedSequence, bundle.lastSnapshotSequence());
                });
    }

    private Mono<Result<S>> runSideEffects(String id, S finalState, List<PersistedEvent<E>> newEvents, long lastAppliedSequence, long lastSnapshotSequence) {
        Mono<Result<Void>> snapshot = snapshotPolicy.maybeSnapshot(id, finalState, lastAppliedSequence, lastSnapshotSequence);
        Mono<Result<Void>> publish = publishingHandler == null ?
                Mono.just(Result.success()) :
                CollaboratorCall.call(Stage.PUBLISHING, "Publishing events of aggregate " + id, () -> publishingHandler.publish(finalState, newEvents));

        return Mono.zip(snapshot, publish, (snapshotResult, publishResult) -> Result.combine(snapshotResult, publishResult))
                .map(sideEffects -> {
                    if (sideEffects instanceof Result.Failure<Void> failure) {
                        if (surfaceSideEffectFailures) {
                            return failure.<S>cast();
                        }
                        log.warn("Events of aggregate {} were saved but a side effect failed ({}: {})", id, failure.stage().tag(), failure.message());
                    }
                    return Result.success(finalState);
                });
    }

    /**
     * Builder for {@link GenericAggregate}. {@code serviceName}, {@code defaultState}, {@code commandHandler},
     * {@code eventHandler} and {@code persistenceHandler} are required.
     */
    public static class Builder<S, C, E> {
        private @Nullable String serviceName;
        private @Nullable S defaultState;
        private @Nullable CommandHandler<S, C, E> commandHandler;
        private @Nullable EventHandler<S, E> eventHandler;
        private @Nullable PersistenceHandler<S, E> persistenceHandler;
        private @Nullable SnapshotConfig snapshotConfig;
        private @Nullable PublishingHandler<S, E> publishingHandler;
        private Clock clock = Clock.systemUTC();
        private EventTypeGetter<E> eventTypeGetter = EventTypeGetter.simpleClassName();
        private boolean surfaceSideEffectFailures = false;

        private Builder() {
        }

        /**
         * @param serviceName The name of the service, used as source of all events
         */
        public Builder<S, C, E> serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        /**
         * @param defaultState The state of an aggregate without snapshot or events
         */
        public Builder<S, C, E> defaultState(S defaultState) {
            this.defaultState = defaultState;
            return this;
        }

        public Builder<S, C, E> commandHandler(CommandHandler<S, C, E> commandHandler) {
            this.commandHandler = commandHandler;
            return this;
        }

        public Builder<S, C, E> eventHandler(EventHandler<S, E> eventHandler) {
            this.eventHandler = eventHandler;
            return this;
        }

        public Builder<S, C, E> persistenceHandler(PersistenceHandler<S, E> persistenceHandler) {
            this.persistenceHandler = persistenceHandler;
            return this;
        }

        /**
         * Enable snapshots. Snapshots are disabled by default.
         */
        public Builder<S, C, E> snapshotConfig(@Nullable SnapshotConfig snapshotConfig) {
            this.snapshotConfig = snapshotConfig;
            return this;
        }

        public Builder<S, C, E> publishingHandler(@Nullable PublishingHandler<S, E> publishingHandler) {
            this.publishingHandler = publishingHandler;
            return this;
        }

        /**
         * @param clock The clock used to timestamp new events, defaults to {@link Clock#systemUTC()}
         */
        public Builder<S, C, E> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @param eventTypeGetter Gets the type of new events, defaults to {@link EventTypeGetter#simpleClassName()}
         */
        public Builder<S, C, E> eventTypeGetter(EventTypeGetter<E> eventTypeGetter) {
            this.eventTypeGetter = eventTypeGetter;
            return this;
        }

        /**
         * @param surfaceSideEffectFailures {@code true} to return a failure from {@link Aggregate#push(String, Object)} when
         *                                  writing the snapshot or publishing fails, even though the events are saved.
         *                                  Defaults to {@code false}.
         */
        public Builder<S, C, E> surfaceSideEffectFailures(boolean surfaceSideEffectFailures) {
            this.surfaceSideEffectFailures = surfaceSideEffectFailures;
            return this;
        }

        public GenericAggregate<S, C, E> build() {
            if (serviceName == null || serviceName.isBlank()) throw new IllegalArgumentException("serviceName cannot be blank");
            if (defaultState == null) throw new IllegalArgumentException("defaultState cannot be null");
            if (commandHandler == null) throw new IllegalArgumentException(CommandHandler.class.getSimpleName() + " cannot be null");
            if (eventHandler == null) throw new IllegalArgumentException(EventHandler.class.getSimpleName() + " cannot be null");
            if (persistenceHandler == null) throw new IllegalArgumentException(PersistenceHandler.class.getSimpleName() + " cannot be null");
            if (clock == null) throw new IllegalArgumentException(Clock.class.getSimpleName() + " cannot be null");
            if (eventTypeGetter == null) throw new IllegalArgumentException(EventTypeGetter.class.getSimpleName() + " cannot be null");
            return new GenericAggregate<>(this);
        }
    }
}
