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

package org.eventfold.application.projection;

import org.eventfold.core.EventHandler;
import org.eventfold.core.EventKind;
import org.eventfold.core.PersistenceHandler;
import org.eventfold.core.SnapshotConfig;
import org.eventfold.core.internal.Hydrator;
import org.eventfold.core.internal.QueryWorkflow;
import org.eventfold.core.internal.SnapshotPolicy;
import org.eventfold.result.Result;
import org.eventfold.result.Stage;
import org.jspecify.annotations.Nullable;
import reactor.core.publisher.Mono;

import static java.util.Objects.requireNonNull;

/**
 * A {@link NamedProjection} that fetches the events of the subject {@code id}, folds them onto the latest snapshot (or the
 * default state) and writes a new snapshot, keyed by {@code id}, when due.
 *
 * @param <S> The projection state type
 * @param <E> The domain event type
 */
public class GenericNamedProjection<S, E> implements NamedProjection<S> {
    private final String projectionName;
    private final PersistenceHandler<S, E> persistenceHandler;
    private final QueryWorkflow<S, E> queryWorkflow;

    private GenericNamedProjection(Builder<S, E> builder) {
        this.projectionName = builder.projectionName;
        this.persistenceHandler = builder.persistenceHandler;
        SnapshotPolicy<S> snapshotPolicy = new SnapshotPolicy<>(persistenceHandler, builder.snapshotConfig, EventKind.NAMED_PROJECTION);
        this.queryWorkflow = new QueryWorkflow<>(builder.defaultState, new Hydrator<>(builder.eventHandler), snapshotPolicy, Stage.PROJECTION);
    }

    public static <S, E> Builder<S, E> builder() {
        return new Builder<>();
    }

    @Override
    public Mono<Result<S>> get(String id) {
        requireNonNull(id, "id cannot be null");
        return queryWorkflow.read(id, () -> persistenceHandler.get(id));
    }

    public String projectionName() {
        return projectionName;
    }

    public static class Builder<S, E> {
        private @Nullable String projectionName;
        private @Nullable S defaultState;
        private @Nullable EventHandler<S, E> eventHandler;
        private @Nullable PersistenceHandler<S, E> persistenceHandler;
        private @Nullable SnapshotConfig snapshotConfig;

        private Builder() {
        }

        public Builder<S, E> projectionName(String projectionName) {
            this.projectionName = projectionName;
            return this;
        }

        public Builder<S, E> defaultState(S defaultState) {
            this.defaultState = defaultState;
            return this;
        }

        public Builder<S, E> eventHandler(EventHandler<S, E> eventHandler) {
            this.eventHandler = eventHandler;
            return this;
        }

        public Builder<S, E> persistenceHandler(PersistenceHandler<S, E> persistenceHandler) {
            this.persistenceHandler = persistenceHandler;
            return this;
        }

        public Builder<S, E> snapshotConfig(@Nullable SnapshotConfig snapshotConfig) {
            this.snapshotConfig = snapshotConfig;
            return this;
        }

        public GenericNamedProjection<S, E> build() {
            if (projectionName == null || projectionName.isBlank()) throw new IllegalArgumentException("projectionName cannot be blank");
            if (defaultState == null) throw new IllegalArgumentException("defaultState cannot be null");
            if (eventHandler == null) throw new IllegalArgumentException(EventHandler.class.getSimpleName() + " cannot be null");
            if (persistenceHandler == null) throw new IllegalArgumentException(PersistenceHandler.class.getSimpleName() + " cannot be null");
            return new GenericNamedProjection<>(this);
        }
    }
}
