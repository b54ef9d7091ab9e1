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

import org.jspecify.annotations.NullMarked;

/**
 * Applies an event to a state. Used to hydrate aggregates and projections so it runs on every read and write.
 * It must be pure and handle every event type.
 *
 * @param <S> The state type
 * @param <E> The domain event type
 */
@NullMarked
@FunctionalInterface
public interface EventHandler<S, E> {

    S apply(S state, PersistedEvent<E> event);
}
